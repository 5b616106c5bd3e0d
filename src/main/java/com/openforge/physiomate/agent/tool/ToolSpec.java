package com.openforge.physiomate.agent.tool;

import com.openforge.physiomate.llm.model.Tool;
import com.openforge.physiomate.llm.model.ToolFunction;

import java.util.Objects;

/**
 * One registry entry: declaration sent to the model plus the binding used
 * at dispatch time.
 *
 * @param name          unique tool name
 * @param kind          INTERNAL or ACTION
 * @param declaration   JSON-schema function declaration, sent verbatim every turn
 * @param stepLabel     label of the progress step shown while the tool runs
 * @param callable      implementation; null for ACTION tools
 * @param emitsSubsteps true for sub-agent tools whose progress is drained concurrently
 */
public record ToolSpec(
        String name,
        ToolKind kind,
        ToolFunction declaration,
        String stepLabel,
        ToolCallable callable,
        boolean emitsSubsteps
) {

    public ToolSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(declaration, "declaration");
        if (!name.equals(declaration.name())) {
            throw new IllegalArgumentException(
                    "Declaration name '%s' does not match tool '%s'".formatted(declaration.name(), name));
        }
        if (kind == ToolKind.INTERNAL && callable == null) {
            throw new IllegalArgumentException("INTERNAL tool '%s' needs a callable".formatted(name));
        }
        if (kind == ToolKind.ACTION && (callable != null || emitsSubsteps)) {
            throw new IllegalArgumentException("ACTION tool '%s' must not be executable".formatted(name));
        }
        if (stepLabel == null || stepLabel.isBlank()) {
            stepLabel = name;
        }
    }

    public static ToolSpec internal(ToolFunction declaration, String stepLabel, ToolCallable callable) {
        return new ToolSpec(declaration.name(), ToolKind.INTERNAL, declaration, stepLabel, callable, false);
    }

    public static ToolSpec subAgent(ToolFunction declaration, String stepLabel, ToolCallable callable) {
        return new ToolSpec(declaration.name(), ToolKind.INTERNAL, declaration, stepLabel, callable, true);
    }

    public static ToolSpec action(ToolFunction declaration, String stepLabel) {
        return new ToolSpec(declaration.name(), ToolKind.ACTION, declaration, stepLabel, null, false);
    }

    public Tool toTool() {
        return Tool.ofFunction(declaration);
    }
}
