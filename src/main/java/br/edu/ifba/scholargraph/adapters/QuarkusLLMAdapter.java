package br.edu.ifba.scholargraph.adapters;

import java.time.temporal.ChronoUnit;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import br.edu.ifba.chat.LlmChatClient;
import br.edu.ifba.chat.LlmChatRequest;
import br.edu.ifba.chat.LlmChatResponse;
import br.edu.ifba.exception.ExternalServiceException;
import br.edu.ifba.scholargraph.llm.LLMFunction;
import br.edu.ifba.scholargraph.utils.TransientLlmFailurePredicate;
import io.quarkus.arc.Arc;
import io.quarkus.arc.ManagedContext;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;

/**
 * Bridges the Quarkus-managed {@link LlmChatClient} to {@link LLMFunction}.
 *
 * <p>Blocking HTTP calls run on a bounded worker pool whose threads carry the
 * Quarkus classloader. Transient failures are retried; a call that keeps
 * failing surfaces as {@link ExternalServiceException}.</p>
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);
    private static final ClassLoader QUARKUS_CLASSLOADER = QuarkusLLMAdapter.class.getClassLoader();

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @ConfigProperty(name = "chat.model")
    String model;

    @ConfigProperty(name = "chat.max-concurrent-calls", defaultValue = "8")
    int maxConcurrentCalls;

    private volatile ExecutorService executor;

    @Override
    @Retry(maxRetries = 3, delay = 1000, delayUnit = ChronoUnit.MILLIS, maxDuration = 10, durationUnit = ChronoUnit.MINUTES)
    @RetryWhen(exception = TransientLlmFailurePredicate.class)
    @Timeout(value = 180, unit = ChronoUnit.SECONDS)
    public CompletableFuture<Response> apply(@NotNull final Request request) {
        return CompletableFuture.supplyAsync(() -> {
            final ManagedContext requestContext = Arc.container().requestContext();
            final boolean activated = !requestContext.isActive();
            if (activated) {
                requestContext.activate();
            }

            try {
                LOG.debugf("LLM request - model: %s, temperature: %.2f, maxTokens: %d, content length: %d",
                    model, request.temperature(), request.maxOutputTokens(), request.content().length());

                final LlmChatResponse response = chatClient.complete(LlmChatRequest.of(
                    model,
                    request.instructions(),
                    request.content(),
                    request.temperature(),
                    request.maxOutputTokens(),
                    request.structuredOutputRequired()));

                final String content = response.firstContent();
                if (content == null || content.isBlank()) {
                    throw new ExternalServiceException("LLM returned an empty response", 200, false);
                }

                TokenUsage usage = null;
                if (response.usage() != null) {
                    usage = new TokenUsage(
                        valueOrZero(response.usage().promptTokens()),
                        valueOrZero(response.usage().completionTokens()));
                }
                LOG.debugf("LLM response received - length: %d characters, tokens: %s",
                    content.length(), usage != null ? String.valueOf(usage.totalTokens()) : "unknown");

                return new Response(content, usage);
            } catch (ExternalServiceException e) {
                throw e;
            } catch (ProcessingException e) {
                LOG.warnf("LLM transport failure: %s", e.getMessage());
                throw new ExternalServiceException("Failed to reach LLM endpoint: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Error calling LLM via QuarkusLLMAdapter");
                throw e;
            } finally {
                if (activated) {
                    requestContext.deactivate();
                }
            }
        }, executor());
    }

    private ExecutorService executor() {
        ExecutorService current = executor;
        if (current == null) {
            synchronized (this) {
                current = executor;
                if (current == null) {
                    current = Executors.newFixedThreadPool(Math.max(1, maxConcurrentCalls), threadFactory());
                    executor = current;
                }
            }
        }
        return current;
    }

    private static ThreadFactory threadFactory() {
        final AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
                task.run();
            }, "llm-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
