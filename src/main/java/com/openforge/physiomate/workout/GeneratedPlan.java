package com.openforge.physiomate.workout;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A generated workout, in the shape the front end stores it.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record GeneratedPlan(
        String title,
        String notes,
        List<GeneratedExercise> exercises
) {

    public GeneratedPlan {
        exercises = exercises == null ? List.of() : List.copyOf(exercises);
    }

    public GeneratedPlan withExercises(List<GeneratedExercise> replacement) {
        return new GeneratedPlan(title, notes, replacement);
    }

    /**
     * One exercise. Either sets/reps or durationSecs is normally present;
     * notes carry the evidence behind the choice.
     */
    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record GeneratedExercise(
            String name,
            Integer sets,
            Integer reps,
            Integer durationSecs,
            Double weight,
            String weightUnit,
            String notes,
            List<String> targetMeshIds,
            String imageUrl
    ) {

        public GeneratedExercise {
            targetMeshIds = targetMeshIds == null ? List.of() : List.copyOf(targetMeshIds);
        }

        public GeneratedExercise withTargets(List<String> targets) {
            return new GeneratedExercise(name, sets, reps, durationSecs, weight, weightUnit, notes, targets, imageUrl);
        }

        public GeneratedExercise withImageUrl(String url) {
            return new GeneratedExercise(name, sets, reps, durationSecs, weight, weightUnit, notes, targetMeshIds, url);
        }
    }
}
