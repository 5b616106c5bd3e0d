package com.openforge.physiomate.agent.stream;

import com.openforge.physiomate.llm.model.StreamingChunk.FunctionDelta;
import com.openforge.physiomate.llm.model.StreamingChunk.ToolCallDelta;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeltaAccumulatorTest {

    private static ToolCallDelta delta(Integer index, String id, String name, String args) {
        return new ToolCallDelta(index, id, id == null ? null : "function", new FunctionDelta(name, args));
    }

    @Test
    void concatenatesFragmentsOfOneIndexInArrivalOrder() {
        DeltaAccumulator accumulator = new DeltaAccumulator(1024);
        accumulator.accept(delta(0, "call_a", "update_muscle", "{\"mesh_id\":"));
        accumulator.accept(delta(0, null, null, "\"Deltoid\","));
        accumulator.accept(delta(0, null, null, "\"pain\":6}"));

        List<ToolCallRequest> calls = accumulator.finish("call_1_");

        assertEquals(1, calls.size());
        ToolCallRequest call = calls.get(0);
        assertEquals("call_a", call.id());
        assertEquals("update_muscle", call.name());
        assertEquals("{\"mesh_id\":\"Deltoid\",\"pain\":6}", call.argumentsText());
        assertFalse(call.argumentsTruncated());
    }

    @Test
    void interleavedIndicesStayApartAndFinishInAscendingOrder() {
        DeltaAccumulator accumulator = new DeltaAccumulator(1024);
        accumulator.accept(delta(1, "call_b", "research", "{\"query\":"));
        accumulator.accept(delta(0, "call_a", "select_muscles", "{\"mesh_ids\":"));
        accumulator.accept(delta(1, null, null, "\"neck pain\"}"));
        accumulator.accept(delta(0, null, null, "[\"Trapezius\"]}"));

        List<ToolCallRequest> calls = accumulator.finish("call_1_");

        assertEquals(List.of(0, 1), calls.stream().map(ToolCallRequest::index).toList());
        assertEquals("{\"mesh_ids\":[\"Trapezius\"]}", calls.get(0).argumentsText());
        assertEquals("{\"query\":\"neck pain\"}", calls.get(1).argumentsText());
    }

    @Test
    void firstNonEmptyIdAndNameWin() {
        DeltaAccumulator accumulator = new DeltaAccumulator(1024);
        accumulator.accept(delta(0, "", "", "{"));
        accumulator.accept(delta(0, "call_x", "add_knot", null));
        accumulator.accept(delta(0, "call_y", "update_muscle", "}"));

        ToolCallRequest call = accumulator.finish("call_2_").get(0);

        assertEquals("call_x", call.id());
        assertEquals("add_knot", call.name());
        assertEquals("{}", call.argumentsText());
    }

    @Test
    void missingIdIsSynthesizedFromPrefixAndIndex() {
        DeltaAccumulator accumulator = new DeltaAccumulator(1024);
        accumulator.accept(delta(3, null, "research", "{}"));

        assertEquals("call_4_3", accumulator.finish("call_4_").get(0).id());
    }

    @Test
    void missingIndexCountsAsZero() {
        DeltaAccumulator accumulator = new DeltaAccumulator(1024);
        accumulator.accept(delta(null, "call_a", "research", "{\"q\":"));
        accumulator.accept(delta(0, null, null, "1}"));

        List<ToolCallRequest> calls = accumulator.finish("p_");
        assertEquals(1, calls.size());
        assertEquals("{\"q\":1}", calls.get(0).argumentsText());
    }

    @Test
    void argumentsPastCeilingAreDroppedAndFlagged() {
        DeltaAccumulator accumulator = new DeltaAccumulator(8);
        accumulator.accept(delta(0, "call_a", "research", "{\"q\":"));
        accumulator.accept(delta(0, null, null, "\"long text\"}"));
        accumulator.accept(delta(0, null, null, "}"));

        ToolCallRequest call = accumulator.finish("p_").get(0);

        assertTrue(call.argumentsTruncated());
        assertEquals("{\"q\":", call.argumentsText());
    }

    @Test
    void emptyTurnFinishesWithNoCalls() {
        DeltaAccumulator accumulator = new DeltaAccumulator(16);
        accumulator.acceptAll(null);

        assertTrue(accumulator.isEmpty());
        assertTrue(accumulator.finish("p_").isEmpty());
    }

    @Test
    void rejectsDeltasAfterFinish() {
        DeltaAccumulator accumulator = new DeltaAccumulator(16);
        accumulator.finish("p_");

        assertThrows(IllegalStateException.class, () -> accumulator.accept(delta(0, "a", "b", "{}")));
    }
}
