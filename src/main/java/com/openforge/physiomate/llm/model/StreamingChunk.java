package com.openforge.physiomate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One SSE data frame of a streaming /chat/completions response.
 *
 * Wire format (one line of the SSE stream):
 *   data: {"id":"chatcmpl-xxx","object":"chat.completion.chunk",
 *           "choices":[{"index":0,"delta":{"content":"Hello"},"finish_reason":null}]}
 *
 * Last frame:
 *   data: [DONE]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String object,
        Long created,
        String model,
        List<ChunkChoice> choices
) {

    /** The first choice, or null for keep-alive / usage-only frames. */
    public ChunkChoice firstChoice() {
        return choices == null || choices.isEmpty() ? null : choices.get(0);
    }

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    /**
     * Sparse message delta. The first chunk usually carries {"role":"assistant"},
     * later ones {"content":"token"} or {"tool_calls":[...]}.
     */
    public record DeltaMessage(
            String role,
            String content,
            List<ToolCallDelta> toolCalls
    ) {}

    /**
     * Incremental tool-call fragment. Providers send id and name on the first
     * fragment of an index and spread the arguments JSON over many more;
     * fragments of different indices may interleave.
     */
    public record ToolCallDelta(
            Integer index,
            String id,
            String type,
            FunctionDelta function
    ) {}

    public record FunctionDelta(
            String name,
            String arguments
    ) {}
}
