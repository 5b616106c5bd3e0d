package com.openforge.physiomate.patient;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Backs get_patient_muscle_context: a text summary of a patient's tracked
 * muscles, optionally narrowed to one mesh or one muscle group.
 *
 * Precedence: mesh id, then muscle group, then all affected muscles.
 */
@Slf4j
@Component
public class PatientContextTool {

    private final PatientDataClient client;
    private final MuscleGroups      muscleGroups;

    public PatientContextTool(PatientDataClient client, MuscleGroups muscleGroups) {
        this.client       = client;
        this.muscleGroups = muscleGroups;
    }

    public String describe(String bodyId, String muscleGroup, String meshId) {
        List<MuscleState> muscles = client.musclesByBody(bodyId);
        log.debug("[PatientContext] body={} muscles={} group='{}' mesh='{}'",
                bodyId, muscles.size(), muscleGroup, meshId);
        if (muscles.isEmpty()) {
            return "No muscle data found for this patient.";
        }
        if (meshId != null && !meshId.isBlank()) {
            return byMesh(muscles, meshId);
        }
        if (muscleGroup != null && !muscleGroup.isBlank()) {
            return byGroup(muscles, muscleGroup);
        }
        return allAffected(muscles);
    }

    private String byMesh(List<MuscleState> muscles, String meshId) {
        String target = MuscleGroups.normalize(meshId);
        List<MuscleState> matches = muscles.stream()
                .filter(m -> MuscleGroups.normalize(m.meshId()).contains(target))
                .toList();
        if (matches.isEmpty()) {
            return "No data found for muscle '%s' on this patient.".formatted(meshId);
        }
        return lines("Muscle detail for '%s':".formatted(meshId), matches);
    }

    private String byGroup(List<MuscleState> muscles, String muscleGroup) {
        String key = muscleGroup.strip().toLowerCase(Locale.ROOT);
        if (!muscleGroups.isKnown(key)) {
            return "Unknown muscle group '%s'. Valid groups: %s"
                    .formatted(muscleGroup, String.join(", ", muscleGroups.names()));
        }
        List<MuscleState> matches = muscles.stream()
                .filter(m -> muscleGroups.contains(key, m.meshId()))
                .toList();
        if (matches.isEmpty()) {
            return "No tracked muscles in the '%s' group for this patient.".formatted(muscleGroup);
        }
        List<MuscleState> issues = matches.stream().filter(MuscleState::hasIssues).toList();
        if (issues.isEmpty()) {
            return "Patient has %d tracked muscles in '%s', all healthy with no pain."
                    .formatted(matches.size(), muscleGroup);
        }
        return lines("%s status (%d affected out of %d):"
                .formatted(muscleGroup, issues.size(), matches.size()), issues);
    }

    private String allAffected(List<MuscleState> muscles) {
        List<MuscleState> issues = muscles.stream().filter(MuscleState::hasIssues).toList();
        if (issues.isEmpty()) {
            return "Patient has %d tracked muscles, all in healthy condition with no pain reported."
                    .formatted(muscles.size());
        }
        return lines("Patient muscle status (%d affected out of %d tracked):"
                .formatted(issues.size(), muscles.size()), issues);
    }

    private static String lines(String header, List<MuscleState> muscles) {
        List<String> lines = new ArrayList<>();
        lines.add(header);
        muscles.forEach(m -> lines.add("  - " + MuscleFormat.describe(m)));
        return String.join("\n", lines);
    }
}
