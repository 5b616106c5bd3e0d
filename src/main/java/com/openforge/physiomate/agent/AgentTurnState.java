package com.openforge.physiomate.agent;

import com.openforge.physiomate.agent.stream.DeltaAccumulator;
import com.openforge.physiomate.agent.stream.ToolCallRequest;
import com.openforge.physiomate.llm.model.StreamingChunk;

import java.util.List;

/**
 * What one streamed turn has produced so far. Created when the turn's request
 * goes out, discarded once its tool calls are dispatched.
 */
class AgentTurnState {

    private final int              turn;
    private final StringBuilder    textBuffer = new StringBuilder();
    private final DeltaAccumulator accumulator;
    private String finishReason;

    AgentTurnState(int turn, int maxArgumentChars) {
        this.turn        = turn;
        this.accumulator = new DeltaAccumulator(maxArgumentChars);
    }

    int turn() {
        return turn;
    }

    void appendText(String fragment) {
        textBuffer.append(fragment);
    }

    void acceptToolCalls(List<StreamingChunk.ToolCallDelta> deltas) {
        accumulator.acceptAll(deltas);
    }

    void finishReason(String reason) {
        this.finishReason = reason;
    }

    String finishReason() {
        return finishReason;
    }

    String text() {
        return textBuffer.toString();
    }

    /** Finalized calls in index order; ids missing from the stream become {@code call_<turn>_<index>}. */
    List<ToolCallRequest> finishToolCalls() {
        return accumulator.finish("call_" + turn + "_");
    }
}
