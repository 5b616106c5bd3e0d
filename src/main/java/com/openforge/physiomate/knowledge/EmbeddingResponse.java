package com.openforge.physiomate.knowledge;

import java.util.List;

/**
 * Response from POST /v1/embeddings. Only the first vector is used; queries
 * are embedded one at a time.
 */
public record EmbeddingResponse(
        List<EmbeddingData> data,
        String model
) {

    public List<Float> firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new EmbeddingClient.EmbeddingException("Embedding response contained no vector");
        }
        return data.get(0).embedding();
    }

    public record EmbeddingData(int index, List<Float> embedding) {}
}
