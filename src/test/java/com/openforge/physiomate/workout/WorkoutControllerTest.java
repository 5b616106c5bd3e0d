package com.openforge.physiomate.workout;

import com.openforge.physiomate.workout.GeneratedPlan.GeneratedExercise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkoutControllerTest {

    private WorkoutPlanner planner;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        planner = mock(WorkoutPlanner.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new WorkoutController(planner)).build();
    }

    @Test
    void returnsThePlanInCamelCase() throws Exception {
        GeneratedPlan plan = new GeneratedPlan("Knee stability", null, List.of(
                new GeneratedExercise("Step-down", 3, 10, null, null, null, "Eccentric quad control",
                        List.of("Vastus_medialis"), null)));
        when(planner.generate(any())).thenReturn(plan);

        mockMvc.perform(post("/api/generate-workout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ragSummaries":["Step-downs build eccentric control."],
                                 "muscleStates":[{"meshId":"Vastus_medialis","condition":"weak",
                                                  "pain":2,"strength":0.5,"mobility":0.9}],
                                 "availableMeshIds":["Vastus_medialis"],
                                 "durationMinutes":30,
                                 "equipment":["dumbbells"]}"""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Knee stability"))
                .andExpect(jsonPath("$.exercises[0].targetMeshIds[0]").value("Vastus_medialis"))
                .andExpect(jsonPath("$.exercises[0].sets").value(3));

        ArgumentCaptor<GenerateWorkoutRequest> captor = ArgumentCaptor.forClass(GenerateWorkoutRequest.class);
        verify(planner).generate(captor.capture());
        GenerateWorkoutRequest received = captor.getValue();
        assertEquals(30, received.durationMinutes());
        assertEquals(GenerateWorkoutRequest.DEFAULT_GOALS, received.goals());
        assertEquals("weak", received.muscleStates().get(0).condition());
        assertEquals(List.of("dumbbells"), received.equipment());
    }

    @Test
    void missingSummariesAreRejected() throws Exception {
        mockMvc.perform(post("/api/generate-workout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"availableMeshIds\":[\"Deltoid\"]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(planner);
    }

    @Test
    void generationFailureIsABadGateway() throws Exception {
        when(planner.generate(any()))
                .thenThrow(new WorkoutPlanner.WorkoutGenerationException("Plan has no exercises"));

        mockMvc.perform(post("/api/generate-workout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ragSummaries\":[]}"))
                .andExpect(status().isBadGateway());
    }
}
