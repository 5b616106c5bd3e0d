package com.openforge.physiomate.knowledge;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.response.SearchResp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MilvusKnowledgeRetrieverTest {

    private final MilvusProperties props =
            new MilvusProperties(true, "localhost", 19530, "physio_knowledge", 3, 0.3);

    private MilvusClientV2 milvus;
    private EmbeddingClient embeddings;
    private MilvusKnowledgeRetriever retriever;

    @BeforeEach
    void setUp() {
        milvus     = mock(MilvusClientV2.class);
        embeddings = mock(EmbeddingClient.class);
        retriever  = new MilvusKnowledgeRetriever(milvus, embeddings, props);
        when(embeddings.embedQuery(anyString())).thenReturn(List.of(0.1f, 0.2f, 0.3f));
    }

    private static SearchResp.SearchResult result(Object id, float score, Map<String, Object> entity) {
        SearchResp.SearchResult result = mock(SearchResp.SearchResult.class);
        when(result.getId()).thenReturn(id);
        when(result.getScore()).thenReturn(score);
        when(result.getEntity()).thenReturn(entity);
        return result;
    }

    private void respondWith(SearchResp.SearchResult... results) {
        SearchResp resp = mock(SearchResp.class);
        when(resp.getSearchResults()).thenReturn(List.of(List.of(results)));
        when(milvus.search(any(SearchReq.class))).thenReturn(resp);
    }

    private SearchReq capturedRequest() {
        ArgumentCaptor<SearchReq> captor = ArgumentCaptor.forClass(SearchReq.class);
        verify(milvus).search(captor.capture());
        return captor.getValue();
    }

    @Test
    void dropsHitsBelowMinimumScore() {
        respondWith(
                result(11L, 0.82f, Map.of("text", "Eccentric loading", "source", "achilles.pdf",
                        "conditions", List.of("tendinopathy"))),
                result(12L, 0.10f, Map.of("text", "Noise")));

        List<KnowledgeHit> hits = retriever.search("achilles pain", 5);

        assertEquals(1, hits.size());
        KnowledgeHit hit = hits.get(0);
        assertEquals("11", hit.id());
        assertEquals("Eccentric loading", hit.text());
        assertEquals(List.of("tendinopathy"), hit.conditions());
        assertEquals("", hit.summary());
        assertEquals(null, capturedRequest().getFilter());
    }

    @Test
    void muscleGroupSearchUsesTemplateAndArrayFilter() {
        respondWith();

        retriever.searchByMuscleGroup("rotator_cuff", 4);

        verify(embeddings).embedQuery("rotator_cuff physical therapy");
        SearchReq request = capturedRequest();
        assertEquals("ARRAY_CONTAINS(muscle_groups, \"rotator_cuff\")", request.getFilter());
        assertEquals("physio_knowledge", request.getCollectionName());
        assertEquals(4, request.getTopK());
    }

    @Test
    void conditionAndExerciseFiltersAreLowerCased() {
        respondWith();
        retriever.searchByCondition("Frozen Shoulder", 5);
        verify(embeddings).embedQuery("Frozen Shoulder rehabilitation");
        assertEquals("ARRAY_CONTAINS(conditions, \"frozen shoulder\")", capturedRequest().getFilter());
    }

    @Test
    void exerciseSearchUsesTechniqueTemplate() {
        respondWith();
        retriever.searchByExercise("Deadlift", 5);
        verify(embeddings).embedQuery("Deadlift technique");
        assertEquals("ARRAY_CONTAINS(exercises, \"deadlift\")", capturedRequest().getFilter());
    }

    @Test
    void contentTypeSearchEmbedsTheQueryAsIs() {
        respondWith();
        retriever.searchByContentType("rehab_protocol", "ACL reconstruction", 5);
        verify(embeddings).embedQuery("ACL reconstruction");
        assertEquals("content_type == \"rehab_protocol\"", capturedRequest().getFilter());
    }

    @Test
    void quoteEscapesQuotesAndBackslashes() {
        assertEquals("\"a\\\"b\\\\c\"", MilvusKnowledgeRetriever.quote("a\"b\\c"));
    }

    @Test
    void withoutClientEverySearchIsEmpty() {
        MilvusKnowledgeRetriever offline = new MilvusKnowledgeRetriever(null, embeddings, props);

        assertTrue(offline.search("neck", 5).isEmpty());
        assertTrue(offline.searchByCondition("whiplash", 5).isEmpty());
        verifyNoInteractions(embeddings);
    }
}
