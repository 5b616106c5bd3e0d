package com.openforge.physiomate.llm.model;

import java.util.List;

/**
 * Top-level non-streaming response from /chat/completions.
 * Used by the research sub-agent and by workout plan generation.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    public Message firstMessage() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    public boolean hasToolCalls() {
        if (choices == null || choices.isEmpty()) return false;
        Message msg = choices.get(0).message();
        return msg != null && msg.hasToolCalls();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
