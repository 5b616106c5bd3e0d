package com.openforge.physiomate.knowledge;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Milvus client for the knowledge base.
 *
 * On startup:
 *   1. Connects a MilvusClientV2 to the configured host:port
 *   2. Creates the knowledge collection if it is missing, so a fresh
 *      deployment starts with an empty but searchable collection
 *
 * Collection schema (physio_knowledge):
 * ┌───────────────┬──────────────────────┬──────────────────────────────────┐
 * │ Field         │ Type                 │ Notes                            │
 * ├───────────────┼──────────────────────┼──────────────────────────────────┤
 * │ id            │ VARCHAR(64) PK       │ chunk id assigned at ingestion   │
 * │ text          │ VARCHAR(8192)        │ chunk text                       │
 * │ source        │ VARCHAR(512)         │ source document                  │
 * │ content_type  │ VARCHAR(64)          │ one of the seven content types   │
 * │ summary       │ VARCHAR(2048)        │ one-line chunk summary           │
 * │ muscle_groups │ ARRAY<VARCHAR(64)>   │ tags, filtered with ARRAY_CONTAINS│
 * │ conditions    │ ARRAY<VARCHAR(128)>  │ lower-cased condition names      │
 * │ exercises     │ ARRAY<VARCHAR(128)>  │ lower-cased exercise names       │
 * │ embedding     │ FLOAT_VECTOR         │ dim = vectorDimensions           │
 * └───────────────┴──────────────────────┴──────────────────────────────────┘
 *
 * Index: HNSW on embedding, metric IP.
 *
 * An unreachable Milvus does not stop the application; the retriever then
 * answers every search with no results.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "true", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            ensureCollectionExists(client, props);
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, knowledge search will return no results. Cause: {}. "
                     + "Set agent.milvus.enabled=false to skip the connection attempt.", e.getMessage());
            return null;
        }
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();
        if (client.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            log.info("[Milvus] Collection '{}' found.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder()
                .fieldName("id").dataType(DataType.VarChar).maxLength(64)
                .isPrimaryKey(true).autoID(false).build());
        schema.addField(varchar("text", 8192));
        schema.addField(varchar("source", 512));
        schema.addField(varchar("content_type", 64));
        schema.addField(varchar("summary", 2048));
        schema.addField(tags("muscle_groups", 64));
        schema.addField(tags("conditions", 128));
        schema.addField(tags("exercises", 128));
        schema.addField(AddFieldReq.builder()
                .fieldName("embedding").dataType(DataType.FloatVector)
                .dimension(props.vectorDimensions()).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        IndexParam contentTypeIndex = IndexParam.builder()
                .fieldName("content_type")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, contentTypeIndex))
                .build());

        log.info("[Milvus] Collection '{}' created.", name);
    }

    private static AddFieldReq varchar(String field, int maxLength) {
        return AddFieldReq.builder().fieldName(field).dataType(DataType.VarChar).maxLength(maxLength).build();
    }

    private static AddFieldReq tags(String field, int maxLength) {
        return AddFieldReq.builder()
                .fieldName(field)
                .dataType(DataType.Array)
                .elementType(DataType.VarChar)
                .maxCapacity(32)
                .maxLength(maxLength)
                .build();
    }
}
