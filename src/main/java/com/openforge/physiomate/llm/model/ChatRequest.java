package com.openforge.physiomate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * The "stream" flag is not part of this record; LlmClient injects it when
 * serializing a streaming request.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    public static ChatRequest withTools(String model, List<Message> messages, List<Tool> tools,
                                        int maxTokens) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .maxTokens(maxTokens)
                .build();
    }
}
