package br.edu.ifba.scholargraph.llm;

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Functional interface for the external text-analysis capability.
 * Implementations call a language model provider; tests substitute lambdas.
 *
 * <p>Failures surface through the returned future, typically as
 * {@link br.edu.ifba.exception.ExternalServiceException}.</p>
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Runs one completion.
     *
     * @param request instructions, content and sampling settings
     * @return the raw response content
     */
    CompletableFuture<Response> apply(@NotNull Request request);

    /**
     * @param instructions fixed instruction set for the stage (system prompt)
     * @param content stage input (user prompt)
     * @param temperature sampling temperature
     * @param maxOutputTokens upper bound on generated tokens
     * @param structuredOutputRequired whether the provider must return a JSON object
     */
    record Request(
        @NotNull String instructions,
        @NotNull String content,
        double temperature,
        int maxOutputTokens,
        boolean structuredOutputRequired
    ) {}

    record Response(
        @NotNull String content,
        @Nullable TokenUsage tokenUsage
    ) {
        public static Response of(@NotNull String content) {
            return new Response(content, null);
        }
    }

    record TokenUsage(int inputTokens, int outputTokens) {

        public int totalTokens() {
            return inputTokens + outputTokens;
        }
    }
}
