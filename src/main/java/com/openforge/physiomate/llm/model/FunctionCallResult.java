package com.openforge.physiomate.llm.model;

/**
 * The "function" sub-object inside a ToolCall.
 *
 * "arguments" is the raw JSON text produced by the model, not a parsed
 * object. Example:
 *   name      = "update_muscle"
 *   arguments = "{\"meshId\":\"Deltoid\",\"pain\":6}"
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
