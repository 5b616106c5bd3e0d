package com.openforge.physiomate.agent.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.llm.model.Tool;
import com.openforge.physiomate.llm.model.ToolFunction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ToolFunction fn(String name) {
        return new ToolFunction(name, "desc of " + name, MAPPER.createObjectNode().put("type", "object"));
    }

    @Test
    void preservesRegistrationOrderInDeclarations() {
        ToolRegistry registry = ToolRegistry.builder()
                .register(ToolSpec.subAgent(fn("research"), "Researching", inv -> "findings"))
                .register(ToolSpec.action(fn("select_muscles"), "Selecting muscles"))
                .register(ToolSpec.internal(fn("get_patient_muscle_context"), null, inv -> "ctx"))
                .build();

        assertEquals(List.of("research", "select_muscles", "get_patient_muscle_context"), registry.names());
        assertEquals(3, registry.size());
        List<Tool> declarations = registry.declarations();
        assertEquals("function", declarations.get(0).type());
        assertEquals("select_muscles", declarations.get(1).function().name());
    }

    @Test
    void findResolvesByExactName() {
        ToolSpec action = ToolSpec.action(fn("update_muscle"), "Updating muscle state");
        ToolRegistry registry = ToolRegistry.builder().register(action).build();

        assertSame(action, registry.find("update_muscle").orElseThrow());
        assertTrue(registry.find("Update_Muscle").isEmpty());
        assertTrue(registry.find("").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        ToolRegistry.Builder builder = ToolRegistry.builder()
                .register(ToolSpec.action(fn("add_knot"), "Adding trigger point"));

        assertThrows(IllegalArgumentException.class,
                () -> builder.register(ToolSpec.action(fn("add_knot"), "again")));
    }

    @Test
    void specDefaultsBlankLabelToName() {
        ToolSpec spec = ToolSpec.internal(fn("search_knowledge_base"), " ", inv -> "");
        assertEquals("search_knowledge_base", spec.stepLabel());
        assertFalse(spec.emitsSubsteps());
    }

    @Test
    void actionSpecsCarryNoCallable() {
        ToolSpec spec = ToolSpec.action(fn("create_assessment"), "Creating assessment");
        assertEquals(ToolKind.ACTION, spec.kind());
        assertNull(spec.callable());
    }

    @Test
    void internalSpecRequiresCallable() {
        assertThrows(IllegalArgumentException.class,
                () -> ToolSpec.internal(fn("search_by_condition"), "Searching", null));
    }

    @Test
    void declarationNameMustMatchToolName() {
        assertThrows(IllegalArgumentException.class,
                () -> new ToolSpec("research", ToolKind.ACTION, fn("other"), "x", null, false));
    }
}
