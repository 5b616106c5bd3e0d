package com.openforge.physiomate.knowledge;

import java.util.List;

/**
 * One scored chunk of the knowledge base.
 *
 * @param score        similarity from the vector search, higher is closer
 * @param source       document the chunk was cut from
 * @param muscleGroups muscle groups the chunk was tagged with at ingestion
 * @param contentType  exercise_technique, rehab_protocol, pathology, assessment,
 *                     anatomy, training_principles or reference_data
 */
public record KnowledgeHit(
        String       id,
        double       score,
        String       text,
        String       source,
        List<String> muscleGroups,
        List<String> conditions,
        List<String> exercises,
        String       contentType,
        String       summary
) {}
