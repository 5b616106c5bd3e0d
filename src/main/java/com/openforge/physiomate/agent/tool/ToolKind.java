package com.openforge.physiomate.agent.tool;

/**
 * How a tool call's result travels.
 */
public enum ToolKind {

    /** Executed inside the loop; the result is fed back to the model. */
    INTERNAL,

    /** Never executed locally; forwarded to the client as an action. */
    ACTION
}
