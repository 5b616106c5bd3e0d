package com.openforge.physiomate.knowledge;

import java.util.List;

/**
 * Vector retrieval over the physical therapy knowledge base. Filtered
 * variants narrow the candidate set by the chunk's ingestion tags.
 */
public interface KnowledgeRetriever {

    List<KnowledgeHit> search(String query, int topK);

    List<KnowledgeHit> searchByMuscleGroup(String muscleGroup, int topK);

    List<KnowledgeHit> searchByCondition(String condition, int topK);

    List<KnowledgeHit> searchByContentType(String contentType, String query, int topK);

    List<KnowledgeHit> searchByExercise(String exercise, int topK);
}
