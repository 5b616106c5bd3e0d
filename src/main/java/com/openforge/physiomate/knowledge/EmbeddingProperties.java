package com.openforge.physiomate.knowledge;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * agent:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:${PRIMARY_LLM_API_KEY:sk-placeholder}}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     query-prefix: ""
 *     timeout-seconds: 30
 *
 * The query prefix is prepended to search queries only. Instruction-tuned
 * embedding models (e5, bge) expect one, e.g. "query: ".
 */
@ConfigurationProperties(prefix = "agent.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("") String queryPrefix,
        @DefaultValue("30") int timeoutSeconds
) {}
