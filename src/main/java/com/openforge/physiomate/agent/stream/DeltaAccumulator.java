package com.openforge.physiomate.agent.stream;

import com.openforge.physiomate.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds complete tool calls from the partial deltas of one streamed turn.
 *
 * Deltas are keyed by their integer index and may interleave freely; each
 * index keeps its own builder. Argument fragments are appended in arrival
 * order, and the first non-empty id and name seen for an index win.
 *
 * Not thread-safe. One instance per turn, discarded after {@link #finish}.
 */
@Slf4j
public class DeltaAccumulator {

    private final Map<Integer, ToolCallBuilder> builders = new TreeMap<>();
    private final int maxArgumentChars;
    private boolean finished;

    public DeltaAccumulator(int maxArgumentChars) {
        if (maxArgumentChars <= 0) {
            throw new IllegalArgumentException("maxArgumentChars must be positive");
        }
        this.maxArgumentChars = maxArgumentChars;
    }

    public void accept(StreamingChunk.ToolCallDelta delta) {
        if (finished) {
            throw new IllegalStateException("Accumulator already finished");
        }
        if (delta == null) return;

        int index = delta.index() != null ? delta.index() : 0;
        ToolCallBuilder builder = builders.computeIfAbsent(index, ToolCallBuilder::new);

        builder.offerId(delta.id());
        if (delta.function() != null) {
            builder.offerName(delta.function().name());
            builder.appendArguments(delta.function().arguments(), maxArgumentChars);
        }
    }

    public void acceptAll(List<StreamingChunk.ToolCallDelta> deltas) {
        if (deltas == null) return;
        deltas.forEach(this::accept);
    }

    public boolean isEmpty() {
        return builders.isEmpty();
    }

    /**
     * Finalizes every index, ascending. Indices that never got an id receive
     * {@code <idPrefix><index>} so later tool messages can reference them.
     */
    public List<ToolCallRequest> finish(String idPrefix) {
        finished = true;
        List<ToolCallRequest> calls = new ArrayList<>(builders.size());
        for (ToolCallBuilder builder : builders.values()) {
            calls.add(builder.build(idPrefix));
        }
        return calls;
    }

    // ── Per-index builder ────────────────────────────────────────────────────

    private static final class ToolCallBuilder {

        private final int index;
        private final StringBuilder arguments = new StringBuilder();
        private String  id   = "";
        private String  name = "";
        private boolean truncated;

        ToolCallBuilder(int index) {
            this.index = index;
        }

        void offerId(String candidate) {
            if (id.isEmpty() && candidate != null && !candidate.isEmpty()) {
                id = candidate;
            }
        }

        void offerName(String candidate) {
            if (name.isEmpty() && candidate != null && !candidate.isEmpty()) {
                name = candidate;
            }
        }

        void appendArguments(String fragment, int limit) {
            if (fragment == null || fragment.isEmpty() || truncated) return;
            int room = limit - arguments.length();
            if (fragment.length() > room) {
                truncated = true;
                log.warn("[DeltaAccumulator] Arguments of call #{} exceed {} chars, dropping the rest",
                        index, limit);
                return;
            }
            arguments.append(fragment);
        }

        ToolCallRequest build(String idPrefix) {
            String effectiveId = id.isEmpty() ? idPrefix + index : id;
            return new ToolCallRequest(index, effectiveId, name, arguments.toString(), truncated);
        }
    }
}
