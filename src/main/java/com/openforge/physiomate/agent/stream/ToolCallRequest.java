package com.openforge.physiomate.agent.stream;

import com.openforge.physiomate.llm.model.ToolCall;

/**
 * A tool call reassembled from stream fragments, finalized at turn end.
 *
 * @param index              the stream's call index; dispatch order
 * @param id                 provider id, or a synthesized one when none arrived
 * @param name               tool name; empty when no fragment carried one
 * @param argumentsText      concatenated argument fragments
 * @param argumentsTruncated true when fragments past the size ceiling were dropped
 */
public record ToolCallRequest(
        int index,
        String id,
        String name,
        String argumentsText,
        boolean argumentsTruncated
) {

    /** Wire form written into the assistant history message. */
    public ToolCall toToolCall() {
        return ToolCall.function(id, name, argumentsText);
    }
}
