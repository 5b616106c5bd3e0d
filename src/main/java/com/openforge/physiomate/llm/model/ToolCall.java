package com.openforge.physiomate.llm.model;

/**
 * A complete tool invocation as it appears in an assistant message.
 *
 * The streaming loop never receives these whole; they are rebuilt from
 * fragments by the DeltaAccumulator and written back into history in this
 * shape so the next request replays them verbatim.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }
}
