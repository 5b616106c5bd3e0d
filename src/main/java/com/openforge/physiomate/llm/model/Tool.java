package com.openforge.physiomate.llm.model;

/**
 * One entry of the "tools" array sent to the model.
 *
 * Wire format:
 * {
 *   "type": "function",
 *   "function": { "name": "...", "description": "...", "parameters": { ... } }
 * }
 */
public record Tool(
        String type,
        ToolFunction function
) {

    public static Tool ofFunction(ToolFunction function) {
        return new Tool("function", function);
    }
}
