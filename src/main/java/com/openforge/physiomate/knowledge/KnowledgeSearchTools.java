package com.openforge.physiomate.knowledge;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * The knowledge-base search tools as the research agent sees them: each one
 * runs a retriever query and renders the hits as numbered text blocks.
 *
 *   [1] (score: 0.812, source: rotator_cuff_protocol.pdf)
 *   External rotation with a band, 3 x 15 ...
 */
@Component
public class KnowledgeSearchTools {

    static final String NO_RESULTS = "No relevant results found.";

    private final KnowledgeRetriever retriever;

    public KnowledgeSearchTools(KnowledgeRetriever retriever) {
        this.retriever = retriever;
    }

    public String searchKnowledgeBase(String query, int topK) {
        return format(retriever.search(query, topK));
    }

    public String searchByMuscleGroup(String muscleGroup, int topK) {
        List<KnowledgeHit> hits = retriever.searchByMuscleGroup(muscleGroup, topK);
        return hits.isEmpty() ? "No results found for muscle group: " + muscleGroup : format(hits);
    }

    public String searchByCondition(String condition, int topK) {
        List<KnowledgeHit> hits = retriever.searchByCondition(condition, topK);
        return hits.isEmpty() ? "No results found for condition: " + condition : format(hits);
    }

    public String searchByContentType(String contentType, String query, int topK) {
        List<KnowledgeHit> hits = retriever.searchByContentType(contentType, query, topK);
        return hits.isEmpty()
                ? "No results found for content type '%s' with query '%s'".formatted(contentType, query)
                : format(hits);
    }

    public String searchByExercise(String exercise, int topK) {
        List<KnowledgeHit> hits = retriever.searchByExercise(exercise, topK);
        return hits.isEmpty() ? "No results found for exercise: " + exercise : format(hits);
    }

    static String format(List<KnowledgeHit> hits) {
        if (hits.isEmpty()) return NO_RESULTS;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < hits.size(); i++) {
            KnowledgeHit hit = hits.get(i);
            if (i > 0) sb.append('\n');
            String source = hit.source() == null || hit.source().isBlank() ? "unknown" : hit.source();
            sb.append(String.format(Locale.ROOT, "[%d] (score: %.3f, source: %s)", i + 1, hit.score(), source))
              .append('\n')
              .append(hit.text())
              .append('\n');
        }
        return sb.toString();
    }
}
