package com.openforge.physiomate.agent.tool;

/**
 * Progress notification from inside a sub-agent tool.
 *
 * @param id       unique within the sub-agent run; pairs start and completion
 * @param toolName the nested tool being executed
 * @param label    human-readable label
 * @param complete false when the nested tool starts, true when it finishes
 */
public record Substep(String id, String toolName, String label, boolean complete) {

    public static Substep started(String id, String toolName, String label) {
        return new Substep(id, toolName, label, false);
    }

    public static Substep completed(String id, String toolName, String label) {
        return new Substep(id, toolName, label, true);
    }
}
