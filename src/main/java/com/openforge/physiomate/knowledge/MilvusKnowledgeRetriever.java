package com.openforge.physiomate.knowledge;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ANN search over the knowledge collection.
 *
 * Filtered searches embed a templated query ("<group> physical therapy",
 * "<condition> rehabilitation", "<exercise> technique") and restrict hits
 * with a scalar filter on the chunk's tags. Hits below
 * {@link MilvusProperties#minScore()} are dropped.
 */
@Slf4j
@Service
public class MilvusKnowledgeRetriever implements KnowledgeRetriever {

    static final List<String> OUTPUT_FIELDS = List.of(
            "id", "text", "source", "content_type", "summary", "muscle_groups", "conditions", "exercises");

    /** Null when agent.milvus.enabled=false or Milvus was unreachable at startup. */
    private final MilvusClientV2   milvusClient;
    private final EmbeddingClient  embeddingClient;
    private final MilvusProperties props;

    @Autowired
    public MilvusKnowledgeRetriever(@Nullable MilvusClientV2 milvusClient,
                                    EmbeddingClient embeddingClient,
                                    MilvusProperties props) {
        this.milvusClient    = milvusClient;
        this.embeddingClient = embeddingClient;
        this.props           = props;
        if (milvusClient == null) {
            log.warn("[Knowledge] MilvusClientV2 is not available, knowledge search disabled.");
        }
    }

    @Override
    public List<KnowledgeHit> search(String query, int topK) {
        return searchMilvus(query, topK, null);
    }

    @Override
    public List<KnowledgeHit> searchByMuscleGroup(String muscleGroup, int topK) {
        return searchMilvus(muscleGroup + " physical therapy", topK,
                "ARRAY_CONTAINS(muscle_groups, %s)".formatted(quote(muscleGroup)));
    }

    @Override
    public List<KnowledgeHit> searchByCondition(String condition, int topK) {
        return searchMilvus(condition + " rehabilitation", topK,
                "ARRAY_CONTAINS(conditions, %s)".formatted(quote(condition.toLowerCase(Locale.ROOT))));
    }

    @Override
    public List<KnowledgeHit> searchByContentType(String contentType, String query, int topK) {
        return searchMilvus(query, topK, "content_type == %s".formatted(quote(contentType)));
    }

    @Override
    public List<KnowledgeHit> searchByExercise(String exercise, int topK) {
        return searchMilvus(exercise + " technique", topK,
                "ARRAY_CONTAINS(exercises, %s)".formatted(quote(exercise.toLowerCase(Locale.ROOT))));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<KnowledgeHit> searchMilvus(String queryText, int topK, @Nullable String filter) {
        if (milvusClient == null) {
            log.debug("[Knowledge] Skipped, Milvus not connected.");
            return List.of();
        }
        List<Float> vector = embeddingClient.embedQuery(queryText);

        SearchReq.SearchReqBuilder builder = SearchReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(new FloatVec(vector)))
                .annsField("embedding")
                .topK(Math.max(1, topK))
                .outputFields(OUTPUT_FIELDS);
        if (filter != null) builder.filter(filter);

        SearchResp resp = milvusClient.search(builder.build());
        List<KnowledgeHit> hits = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return hits;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                double score = hit.getScore() == null ? 0.0 : hit.getScore().doubleValue();
                if (score < props.minScore()) continue;
                hits.add(toHit(hit.getId(), score, hit.getEntity()));
            }
        }
        log.debug("[Knowledge] query='{}' filter={} → {} hit(s)", queryText, filter, hits.size());
        return hits;
    }

    static KnowledgeHit toHit(Object rawId, double score, Map<String, Object> entity) {
        return new KnowledgeHit(
                rawId == null ? "" : String.valueOf(rawId),
                score,
                str(entity, "text"),
                str(entity, "source"),
                strings(entity, "muscle_groups"),
                strings(entity, "conditions"),
                strings(entity, "exercises"),
                str(entity, "content_type"),
                str(entity, "summary"));
    }

    /** Milvus string literal: double-quoted with backslashes and quotes escaped. */
    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    // ── Field extractors ─────────────────────────────────────────────────────

    private static String str(Map<String, Object> e, String key) {
        Object value = e == null ? null : e.get(key);
        return value == null ? "" : value.toString();
    }

    private static List<String> strings(Map<String, Object> e, String key) {
        Object value = e == null ? null : e.get(key);
        if (!(value instanceof List<?> list)) return List.of();
        return list.stream().map(String::valueOf).toList();
    }
}
