package com.openforge.physiomate.workout;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.physiomate.patient.MuscleState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of POST /api/generate-workout.
 *
 * @param ragSummaries     evidence summaries produced by earlier research
 * @param muscleStates     current state of the patient's muscles
 * @param availableMeshIds the only mesh ids an exercise may target
 * @param goals            free text; "general fitness" when absent
 * @param durationMinutes  target session length; 45 when absent
 * @param equipment        available equipment; empty means bodyweight only
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record GenerateWorkoutRequest(
        @NotNull List<String> ragSummaries,
        @Valid List<MuscleState> muscleStates,
        List<String> availableMeshIds,
        String sex,
        String goals,
        @Min(5) @Max(240) Integer durationMinutes,
        List<String> equipment,
        List<String> focusGroups
) {

    public static final String DEFAULT_GOALS = "general fitness";
    public static final int DEFAULT_DURATION_MINUTES = 45;

    public GenerateWorkoutRequest {
        muscleStates     = muscleStates     == null ? List.of() : List.copyOf(muscleStates);
        availableMeshIds = availableMeshIds == null ? List.of() : List.copyOf(availableMeshIds);
        equipment        = equipment        == null ? List.of() : List.copyOf(equipment);
        focusGroups      = focusGroups      == null ? List.of() : List.copyOf(focusGroups);
        if (goals == null || goals.isBlank()) goals = DEFAULT_GOALS;
        if (durationMinutes == null) durationMinutes = DEFAULT_DURATION_MINUTES;
    }
}
