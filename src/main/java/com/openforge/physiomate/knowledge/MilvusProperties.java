package com.openforge.physiomate.knowledge;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection and search parameters for the knowledge collection in Milvus.
 *
 * agent:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-name: physio_knowledge
 *     vector-dimensions: 1536
 *     min-score: 0.3
 *
 * @param minScore hits scoring below this (inner product) are dropped
 */
@ConfigurationProperties(prefix = "agent.milvus")
public record MilvusProperties(
        @DefaultValue("true")             boolean enabled,
        @DefaultValue("localhost")        String  host,
        @DefaultValue("19530")            int     port,
        @DefaultValue("physio_knowledge") String  collectionName,
        @DefaultValue("1536")             int     vectorDimensions,
        @DefaultValue("0.3")              double  minScore
) {}
