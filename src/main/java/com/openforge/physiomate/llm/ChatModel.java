package com.openforge.physiomate.llm;

import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.ChatResponse;
import com.openforge.physiomate.llm.model.StreamingChunk;

import java.util.function.Consumer;

/**
 * The completion endpoint as seen by the agent.
 *
 * Implemented by {@link LlmClient} for a single provider and by
 * {@link LlmRouter} for primary/fallback routing.
 */
public interface ChatModel {

    /** Blocking completion; returns the whole response. */
    ChatResponse chat(ChatRequest request);

    /**
     * Streaming completion. {@code chunkConsumer} is invoked synchronously,
     * in arrival order, on the calling thread for every parsed chunk; the
     * method returns when the stream ends.
     */
    void streamChat(ChatRequest request, Consumer<StreamingChunk> chunkConsumer);
}
