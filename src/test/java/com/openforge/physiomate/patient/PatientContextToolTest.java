package com.openforge.physiomate.patient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PatientContextToolTest {

    private final PatientDataClient client = mock(PatientDataClient.class);
    private final MuscleGroups groups = new MuscleGroups(Map.of(
            "shoulders", List.of("deltoid"),
            "upper_back", List.of("trapezius", "rhomboid")));
    private PatientContextTool tool;

    private static final MuscleState SORE_DELTOID =
            new MuscleState("Deltoid_1", "strained", 6, 0.8, 0.7, "hurts overhead", null);
    private static final MuscleState HEALTHY_DELTOID =
            new MuscleState("Deltoid", "healthy", 0, 1, 1, null, null);
    private static final MuscleState TIGHT_TRAP =
            new MuscleState("Trapezius_Upper", "tight", 3.5, 1, 0.6, null, "desk posture");

    @BeforeEach
    void setUp() {
        tool = new PatientContextTool(client, groups);
    }

    @Test
    void noMusclesAtAll() {
        when(client.musclesByBody("b1")).thenReturn(List.of());

        assertEquals("No muscle data found for this patient.", tool.describe("b1", null, null));
    }

    @Test
    void listsOnlyAffectedMusclesByDefault() {
        when(client.musclesByBody("b1")).thenReturn(List.of(SORE_DELTOID, HEALTHY_DELTOID, TIGHT_TRAP));

        String text = tool.describe("b1", "", "");

        assertEquals("""
                Patient muscle status (2 affected out of 3 tracked):
                  - Deltoid_1: condition=strained, pain=6/10, strength=80%, mobility=70%, notes="hurts overhead"
                  - Trapezius_Upper: condition=tight, pain=3.5/10, strength=100%, mobility=60%, summary="desk posture\"""",
                text);
    }

    @Test
    void allHealthy() {
        when(client.musclesByBody("b1")).thenReturn(List.of(HEALTHY_DELTOID));

        assertEquals("Patient has 1 tracked muscles, all in healthy condition with no pain reported.",
                tool.describe("b1", null, null));
    }

    @Test
    void meshIdTakesPrecedenceOverGroup() {
        when(client.musclesByBody("b1")).thenReturn(List.of(SORE_DELTOID, HEALTHY_DELTOID, TIGHT_TRAP));

        String text = tool.describe("b1", "upper_back", "trapezius");

        assertTrue(text.startsWith("Muscle detail for 'trapezius':"), text);
        assertTrue(text.contains("Trapezius_Upper"));
    }

    @Test
    void unknownMesh() {
        when(client.musclesByBody("b1")).thenReturn(List.of(HEALTHY_DELTOID));

        assertEquals("No data found for muscle 'Soleus' on this patient.", tool.describe("b1", null, "Soleus"));
    }

    @Test
    void groupFilterReportsAffectedCount() {
        when(client.musclesByBody("b1")).thenReturn(List.of(SORE_DELTOID, HEALTHY_DELTOID, TIGHT_TRAP));

        String text = tool.describe("b1", "Shoulders", null);

        assertTrue(text.startsWith("Shoulders status (1 affected out of 2):"), text);
        assertTrue(text.contains("Deltoid_1"));
    }

    @Test
    void unknownGroupListsValidOnes() {
        when(client.musclesByBody("b1")).thenReturn(List.of(HEALTHY_DELTOID));

        String text = tool.describe("b1", "tail", null);

        assertTrue(text.startsWith("Unknown muscle group 'tail'. Valid groups: "), text);
        assertTrue(text.contains("shoulders"));
    }

    @Test
    void healthyGroup() {
        when(client.musclesByBody("b1")).thenReturn(List.of(HEALTHY_DELTOID, TIGHT_TRAP));

        assertEquals("Patient has 1 tracked muscles in 'shoulders', all healthy with no pain.",
                tool.describe("b1", "shoulders", null));
    }
}
