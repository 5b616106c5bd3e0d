package com.openforge.physiomate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One entry of the conversation history sent to the model.
 *
 * role variants:
 *   "system": persona, instructions and dynamic patient context
 *   "user": human turn
 *   "assistant": model reply; may carry tool_calls alongside or instead of content
 *   "tool": result of a tool call, linked back through tool_call_id
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Present only on assistant messages that request tool calls. */
        List<ToolCall> toolCalls,

        /** Present only on tool messages; matches the id of an earlier ToolCall. */
        String toolCallId
) {

    public static final String ROLE_SYSTEM    = "system";
    public static final String ROLE_USER      = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL      = "tool";

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    /** Assistant turn that requested tools. Blank text is omitted from the wire. */
    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(content == null || content.isEmpty() ? null : content)
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role(ROLE_TOOL).toolCallId(toolCallId).content(result).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
