package com.openforge.physiomate.knowledge;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for POST /v1/embeddings.
 *
 * Wire format:
 * {
 *   "input": "query: rotator cuff impingement",
 *   "model": "text-embedding-3-small",
 *   "dimensions": 1536
 * }
 *
 * dimensions is only understood by text-embedding-3-*; other models get it
 * omitted by passing a non-positive value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String input,
        String model,
        Integer dimensions
) {
    public static EmbeddingRequest of(String input, String model, int dimensions) {
        return new EmbeddingRequest(input, model, dimensions > 0 ? dimensions : null);
    }
}
