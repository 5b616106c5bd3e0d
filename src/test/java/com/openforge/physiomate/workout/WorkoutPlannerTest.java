package com.openforge.physiomate.workout;

import com.openforge.physiomate.config.AppConfig;
import com.openforge.physiomate.llm.ChatModel;
import com.openforge.physiomate.llm.LlmClient;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.ChatResponse;
import com.openforge.physiomate.llm.model.Message;
import com.openforge.physiomate.patient.MuscleState;
import com.openforge.physiomate.prompt.PromptTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkoutPlannerTest {

    private static final String PLAN = """
            {"title": "Shoulder rehab and upper-body strength",
             "notes": "Keep pain below 3/10.",
             "exercises": [
               {"name": "Band pull-apart", "sets": 3, "reps": 15, "notes": "Scapular activation",
                "targetMeshIds": ["Trapezius", "Rhomboid_1"]},
               {"name": "Wall slide", "durationSecs": 60, "targetMeshIds": ["Deltoid"]}
             ]}""";

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ExerciseImageClient images = mock(ExerciseImageClient.class);
    private ExecutorService executor;
    private WorkoutPlanner planner;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        WorkoutProperties properties = new WorkoutProperties(0.5, 4096,
                new WorkoutProperties.Images(false, null, null, "dall-e-3", "1024x1024", 60));
        planner = new WorkoutPlanner(chatModel, new PromptTemplates(), new AppConfig().objectMapper(),
                images, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ChatResponse reply(String content) {
        return new ChatResponse("r", "chat.completion", 0L, "test-model",
                List.of(new ChatResponse.Choice(0, Message.assistantText(content), "stop")), null);
    }

    private static GenerateWorkoutRequest request(List<String> meshIds) {
        return new GenerateWorkoutRequest(
                List.of("Eccentric loading improves tendon pain.", "Scapular control precedes overhead work."),
                List.of(new MuscleState("Deltoid", "strained", 6, 0.4, 0.7, null, null)),
                meshIds, null, null, null, List.of(), List.of());
    }

    @Test
    void parsesFencedReplyAndKeepsOnlyKnownMeshIds() {
        when(chatModel.chat(any())).thenReturn(reply("Here is your plan:\n```json\n" + PLAN + "\n```"));

        GeneratedPlan plan = planner.generate(request(List.of("Trapezius", "Deltoid")));

        assertEquals("Shoulder rehab and upper-body strength", plan.title());
        assertEquals(2, plan.exercises().size());
        assertEquals(List.of("Trapezius"), plan.exercises().get(0).targetMeshIds());
        assertEquals(15, plan.exercises().get(0).reps());
        assertEquals(60, plan.exercises().get(1).durationSecs());
        assertNull(plan.exercises().get(1).imageUrl());
        verify(images, never()).illustrate(any());
    }

    @Test
    void promptCarriesEvidenceMuscleStatesAndDefaults() {
        when(chatModel.chat(any())).thenReturn(reply(PLAN));

        planner.generate(request(List.of("Trapezius", "Deltoid")));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        assertEquals(0.5, sent.temperature());
        assertNull(sent.tools());
        String prompt = sent.messages().get(0).content();
        assertTrue(prompt.contains("- Eccentric loading improves tendon pain."));
        assertTrue(prompt.contains("- Deltoid: condition=strained, pain=6/10, strength=40%, mobility=70%"));
        assertTrue(prompt.contains("[\"Trapezius\",\"Deltoid\"]"));
        assertTrue(prompt.contains("Goals: general fitness"));
        assertTrue(prompt.contains("45 minutes"));
        assertTrue(prompt.contains("Available equipment: bodyweight only"));
        assertFalse(prompt.contains("{{"));
    }

    @Test
    void noMuscleStatesReadsAsGoodCondition() {
        assertEquals(WorkoutPlanner.NO_ISSUES, WorkoutPlanner.formatMuscleStates(List.of()));
    }

    @Test
    void emptyAllowedListLeavesTargetsAlone() {
        when(chatModel.chat(any())).thenReturn(reply(PLAN));

        GeneratedPlan plan = planner.generate(request(List.of()));

        assertEquals(List.of("Trapezius", "Rhomboid_1"), plan.exercises().get(0).targetMeshIds());
    }

    @Test
    void replyWithoutJsonIsAGenerationFailure() {
        when(chatModel.chat(any())).thenReturn(reply("I cannot build a plan for that."));

        assertThrows(WorkoutPlanner.WorkoutGenerationException.class,
                () -> planner.generate(request(List.of())));
    }

    @Test
    void planWithoutExercisesIsAGenerationFailure() {
        when(chatModel.chat(any())).thenReturn(reply("{\"title\": \"Rest day\", \"exercises\": []}"));

        WorkoutPlanner.WorkoutGenerationException e = assertThrows(WorkoutPlanner.WorkoutGenerationException.class,
                () -> planner.generate(request(List.of())));
        assertEquals("Plan has no exercises", e.getMessage());
    }

    @Test
    void modelFailureIsAGenerationFailure() {
        when(chatModel.chat(any())).thenThrow(new LlmClient.LlmException("provider down"));

        WorkoutPlanner.WorkoutGenerationException e = assertThrows(WorkoutPlanner.WorkoutGenerationException.class,
                () -> planner.generate(request(List.of())));
        assertEquals("Model call failed: provider down", e.getMessage());
    }

    @Test
    void enabledImagesAreAttachedPerExercise() {
        when(chatModel.chat(any())).thenReturn(reply(PLAN));
        when(images.enabled()).thenReturn(true);
        when(images.illustrate("Band pull-apart")).thenReturn(Optional.of("https://img.example.com/1.png"));
        when(images.illustrate("Wall slide")).thenReturn(Optional.empty());

        GeneratedPlan plan = planner.generate(request(List.of()));

        assertEquals("https://img.example.com/1.png", plan.exercises().get(0).imageUrl());
        assertNull(plan.exercises().get(1).imageUrl());
    }
}
