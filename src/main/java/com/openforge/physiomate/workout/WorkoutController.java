package com.openforge.physiomate.workout;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * POST /api/generate-workout: one structured workout plan per request,
 * returned as a whole. A model failure or an unusable reply is a 502.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class WorkoutController {

    private final WorkoutPlanner planner;

    public WorkoutController(WorkoutPlanner planner) {
        this.planner = planner;
    }

    @PostMapping("/generate-workout")
    public GeneratedPlan generateWorkout(@Valid @RequestBody GenerateWorkoutRequest request) {
        try {
            return planner.generate(request);
        } catch (WorkoutPlanner.WorkoutGenerationException e) {
            log.warn("[Workout] Generation failed: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Workout generation failed: " + e.getMessage(), e);
        }
    }
}
