package com.openforge.physiomate.workout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.llm.ChatModel;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.Message;
import com.openforge.physiomate.patient.MuscleState;
import com.openforge.physiomate.prompt.PromptTemplates;
import com.openforge.physiomate.workout.GeneratedPlan.GeneratedExercise;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Turns research summaries and the patient's muscle states into a structured
 * workout plan with one blocking completion.
 *
 * Pipeline:
 *   1. fill the workout template with the request
 *   2. chat (no tools) and parse the reply as a JSON plan
 *   3. drop target mesh ids outside the allowed list
 *   4. illustrate exercises in parallel when images are enabled
 */
@Slf4j
@Service
@EnableConfigurationProperties(WorkoutProperties.class)
public class WorkoutPlanner {

    static final String NO_ISSUES = "No muscle issues reported. The user is in good condition.";

    private final ChatModel           chatModel;
    private final PromptTemplates     prompts;
    private final ObjectMapper        objectMapper;
    private final ExerciseImageClient images;
    private final ExecutorService     toolExecutor;
    private final WorkoutProperties   properties;
    private final AtomicLong          planCounter = new AtomicLong();

    public WorkoutPlanner(ChatModel chatModel,
                          PromptTemplates prompts,
                          ObjectMapper objectMapper,
                          ExerciseImageClient images,
                          @Qualifier("toolExecutor") ExecutorService toolExecutor,
                          WorkoutProperties properties) {
        this.chatModel    = chatModel;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
        this.images       = images;
        this.toolExecutor = toolExecutor;
        this.properties   = properties;
    }

    public GeneratedPlan generate(GenerateWorkoutRequest request) {
        String planId = "workout-" + planCounter.incrementAndGet();
        log.info("[Workout:{}] Generating. summaries={} muscles={} meshIds={} duration={}min",
                planId, request.ragSummaries().size(), request.muscleStates().size(),
                request.availableMeshIds().size(), request.durationMinutes());

        ChatRequest chat = ChatRequest.builder()
                .messages(List.of(Message.system(renderPrompt(request))))
                .temperature(properties.temperature())
                .maxTokens(properties.maxTokens())
                .build();

        String reply;
        try {
            reply = chatModel.chat(chat).firstMessage().content();
        } catch (RuntimeException e) {
            throw new WorkoutGenerationException("Model call failed: " + e.getMessage(), e);
        }

        GeneratedPlan plan = restrictTargets(parsePlan(reply), request.availableMeshIds(), planId);
        if (images.enabled()) {
            plan = illustrate(plan, planId);
        }
        log.info("[Workout:{}] Done: '{}' with {} exercise(s)", planId, plan.title(), plan.exercises().size());
        return plan;
    }

    // ── Prompt ───────────────────────────────────────────────────────────────

    String renderPrompt(GenerateWorkoutRequest request) {
        String meshIds;
        try {
            meshIds = objectMapper.writeValueAsString(request.availableMeshIds());
        } catch (JsonProcessingException e) {
            throw new WorkoutGenerationException("Cannot serialize mesh ids", e);
        }
        Map<String, String> values = Map.of(
                "rag_context", request.ragSummaries().stream()
                        .map(summary -> "- " + summary)
                        .collect(Collectors.joining("\n\n")),
                "muscle_states", formatMuscleStates(request.muscleStates()),
                "available_mesh_ids", meshIds,
                "goals", request.goals(),
                "duration_minutes", String.valueOf(request.durationMinutes()),
                "equipment", request.equipment().isEmpty() ? "bodyweight only" : String.join(", ", request.equipment()),
                "focus_groups", request.focusGroups().isEmpty() ? "none" : String.join(", ", request.focusGroups()));

        String prompt = prompts.workout();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            prompt = prompt.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return prompt;
    }

    static String formatMuscleStates(List<MuscleState> states) {
        if (states.isEmpty()) {
            return NO_ISSUES;
        }
        return states.stream()
                .map(m -> "- %s: condition=%s, pain=%s/10, strength=%.0f%%, mobility=%.0f%%".formatted(
                        m.meshId(), m.condition(), number(m.pain()), m.strength() * 100, m.mobility() * 100))
                .collect(Collectors.joining("\n"));
    }

    private static String number(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    // ── Reply ────────────────────────────────────────────────────────────────

    /** Accepts the object bare or wrapped in a Markdown code fence or prose. */
    GeneratedPlan parsePlan(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new WorkoutGenerationException("Model returned an empty plan");
        }
        int start = reply.indexOf('{');
        int end   = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new WorkoutGenerationException("Model reply contains no JSON object");
        }

        GeneratedPlan plan;
        try {
            plan = objectMapper.readValue(reply.substring(start, end + 1), GeneratedPlan.class);
        } catch (JsonProcessingException e) {
            throw new WorkoutGenerationException("Model reply is not a valid plan: " + e.getOriginalMessage(), e);
        }
        if (plan.title() == null || plan.title().isBlank()) {
            throw new WorkoutGenerationException("Plan has no title");
        }
        if (plan.exercises().isEmpty()) {
            throw new WorkoutGenerationException("Plan has no exercises");
        }
        return plan;
    }

    /** An empty allowed list means the caller did not restrict targets. */
    private static GeneratedPlan restrictTargets(GeneratedPlan plan, List<String> allowed, String planId) {
        if (allowed.isEmpty()) {
            return plan;
        }
        Set<String> valid = new HashSet<>(allowed);
        List<GeneratedExercise> exercises = new ArrayList<>(plan.exercises().size());
        for (GeneratedExercise exercise : plan.exercises()) {
            List<String> kept = exercise.targetMeshIds().stream().filter(valid::contains).toList();
            if (kept.size() < exercise.targetMeshIds().size()) {
                log.warn("[Workout:{}] Dropped unknown mesh ids from '{}': {}", planId, exercise.name(),
                        exercise.targetMeshIds().stream().filter(id -> !valid.contains(id)).toList());
            }
            exercises.add(exercise.withTargets(kept));
        }
        return plan.withExercises(exercises);
    }

    // ── Images ───────────────────────────────────────────────────────────────

    private GeneratedPlan illustrate(GeneratedPlan plan, String planId) {
        List<Future<Optional<String>>> pending = new ArrayList<>();
        for (GeneratedExercise exercise : plan.exercises()) {
            pending.add(toolExecutor.submit(() -> images.illustrate(exercise.name())));
        }

        List<GeneratedExercise> exercises = new ArrayList<>(pending.size());
        try {
            for (int i = 0; i < pending.size(); i++) {
                GeneratedExercise exercise = plan.exercises().get(i);
                exercises.add(exercise.withImageUrl(imageOf(pending.get(i), exercise, planId)));
            }
        } catch (InterruptedException e) {
            pending.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new WorkoutGenerationException("Interrupted while illustrating the plan", e);
        }
        return plan.withExercises(exercises);
    }

    private static String imageOf(Future<Optional<String>> future, GeneratedExercise exercise, String planId)
            throws InterruptedException {
        try {
            return future.get().orElse(null);
        } catch (ExecutionException e) {
            log.warn("[Workout:{}] Image for '{}' failed: {}", planId, exercise.name(), e.getCause().toString());
            return null;
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class WorkoutGenerationException extends RuntimeException {
        public WorkoutGenerationException(String message) { super(message); }
        public WorkoutGenerationException(String message, Throwable cause) { super(message, cause); }
    }
}
