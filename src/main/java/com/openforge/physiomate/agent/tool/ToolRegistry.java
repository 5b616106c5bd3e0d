package com.openforge.physiomate.agent.tool;

import com.openforge.physiomate.llm.model.Tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name → {@link ToolSpec} table.
 *
 * Built once at startup; declaration order is preserved so the tools array
 * sent to the model is stable from turn to turn.
 */
public final class ToolRegistry {

    private final Map<String, ToolSpec> specs;
    private final List<Tool>            declarations;

    private ToolRegistry(Map<String, ToolSpec> specs) {
        this.specs = Collections.unmodifiableMap(specs);
        List<Tool> tools = new ArrayList<>(specs.size());
        specs.values().forEach(spec -> tools.add(spec.toTool()));
        this.declarations = List.copyOf(tools);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ToolSpec> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(specs.get(name));
    }

    /** Declarations in registration order, as sent to the completion endpoint. */
    public List<Tool> declarations() {
        return declarations;
    }

    public List<String> names() {
        return List.copyOf(specs.keySet());
    }

    public int size() {
        return specs.size();
    }

    public static final class Builder {

        private final Map<String, ToolSpec> specs = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(ToolSpec spec) {
            if (specs.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + spec.name());
            }
            return this;
        }

        public Builder registerAll(List<ToolSpec> toolSpecs) {
            toolSpecs.forEach(this::register);
            return this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(new LinkedHashMap<>(specs));
        }
    }
}
