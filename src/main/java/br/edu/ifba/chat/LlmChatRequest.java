package br.edu.ifba.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI-compatible chat completion request body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<Message> messages,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature,

    @JsonProperty("response_format")
    ResponseFormat responseFormat
) {
    private static final ResponseFormat JSON_OBJECT = new ResponseFormat("json_object");

    /**
     * Builds a two-message request: system instructions followed by user content.
     */
    public static LlmChatRequest of(String model, String instructions, String content,
            double temperature, int maxTokens, boolean jsonOutput) {
        return new LlmChatRequest(
            model,
            List.of(new Message("system", instructions), new Message("user", content)),
            maxTokens,
            temperature,
            jsonOutput ? JSON_OBJECT : null
        );
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Message(String role, String content) {}

    public record ResponseFormat(String type) {}
}
