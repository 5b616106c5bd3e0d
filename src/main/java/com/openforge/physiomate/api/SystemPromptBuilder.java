package com.openforge.physiomate.api;

import com.openforge.physiomate.api.dto.BodyInfo;
import com.openforge.physiomate.api.dto.ChatTurnRequest;
import com.openforge.physiomate.api.dto.HistoryMessage;
import com.openforge.physiomate.llm.model.Message;
import com.openforge.physiomate.patient.MuscleFormat;
import com.openforge.physiomate.patient.MuscleGroups;
import com.openforge.physiomate.patient.MuscleState;
import com.openforge.physiomate.prompt.PromptTemplates;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a chat request into the message list of the first turn:
 * system prompt with the request's dynamic context, earlier messages,
 * then the new user message.
 *
 * Dynamic context, in order:
 *   affected muscles, body info, equipment, fitness goal,
 *   mesh ids grouped by muscle group, selected muscles (or the
 *   auto-select hint when none are selected), active groups, body id
 */
@Component
public class SystemPromptBuilder {

    private final PromptTemplates prompts;
    private final MuscleGroups    muscleGroups;

    public SystemPromptBuilder(PromptTemplates prompts, MuscleGroups muscleGroups) {
        this.prompts      = prompts;
        this.muscleGroups = muscleGroups;
    }

    public List<Message> buildHistory(ChatTurnRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(prompts.coordinator() + buildContext(request)));
        for (HistoryMessage m : request.conversationHistory()) {
            messages.add(Message.ROLE_ASSISTANT.equals(m.role())
                    ? Message.assistantText(m.content())
                    : Message.user(m.content()));
        }
        messages.add(Message.user(request.message()));
        return messages;
    }

    String buildContext(ChatTurnRequest request) {
        StringBuilder sb = new StringBuilder();

        List<MuscleState> issues = request.muscleStates().stream().filter(MuscleState::hasIssues).toList();
        if (!issues.isEmpty()) {
            sb.append("\n\nCurrent muscle states with issues:");
            issues.forEach(m -> sb.append("\n- ").append(MuscleFormat.describe(m)));
        }

        appendBody(sb, request.body());
        appendMeshIds(sb, request.availableMeshIds());
        appendSelection(sb, request.selectedMeshIds(), request.muscleStates());

        if (!request.activeGroups().isEmpty()) {
            String labels = request.activeGroups().stream()
                    .map(SystemPromptBuilder::title)
                    .collect(Collectors.joining(", "));
            sb.append("\n\n## Active Muscle Groups")
              .append("\nThe user is currently focused on these muscle groups in the 3D model: ").append(labels)
              .append("\nWhen the user describes symptoms without naming specific muscles, ")
              .append("use the mesh IDs from these groups for `select_muscles` and `update_muscle`.");
        }

        if (request.bodyId() != null && !request.bodyId().isBlank()) {
            sb.append("\n\nThe current patient's body ID is: ").append(request.bodyId())
              .append("\nUse get_patient_muscle_context with this ID to look up their current muscle status ")
              .append("when relevant, and include it in research queries that need patient data.");
        }
        return sb.toString();
    }

    private static void appendBody(StringBuilder sb, BodyInfo body) {
        if (body == null) return;
        List<String> parts = new ArrayList<>();
        if (body.sex() != null && !body.sex().isBlank()) parts.add("sex=" + body.sex());
        if (body.weightKg() != null && body.weightKg() != 0) parts.add("weight=" + MuscleFormat.number(body.weightKg()) + "kg");
        if (body.heightCm() != null && body.heightCm() != 0) parts.add("height=" + MuscleFormat.number(body.heightCm()) + "cm");
        if (!parts.isEmpty()) {
            sb.append("\n\nUser body info: ").append(String.join(", ", parts));
        }
        if (body.equipment() != null && !body.equipment().isEmpty()) {
            sb.append("\nAvailable equipment: ").append(String.join(", ", body.equipment()));
        }
        if (body.fitnessGoals() != null && !body.fitnessGoals().isBlank()) {
            sb.append("\nFitness goal: ").append(body.fitnessGoals());
        }
    }

    private void appendMeshIds(StringBuilder sb, List<String> meshIds) {
        sb.append("\n\n## Available Muscle Mesh IDs (use EXACT names)\n")
          .append("Organized by muscle group. Use the exact mesh ID strings when calling tools.\n");
        for (Map.Entry<String, List<String>> entry : muscleGroups.group(meshIds).entrySet()) {
            sb.append("**").append(title(entry.getKey())).append("**: ").append(jsonList(entry.getValue())).append('\n');
        }
        List<String> ungrouped = muscleGroups.ungrouped(meshIds);
        if (!ungrouped.isEmpty()) {
            sb.append("**Other**: ").append(jsonList(ungrouped)).append('\n');
        }
    }

    private static void appendSelection(StringBuilder sb, List<String> selected, List<MuscleState> states) {
        if (selected.isEmpty()) {
            sb.append("\n\n## No Muscles Selected\n")
              .append("The user has NOT selected any muscles on the 3D model. ")
              .append("If they describe a body area or pain location, call `select_muscles` ")
              .append("with the relevant mesh IDs from the grouped list above and include your ")
              .append("text response in the same turn.\n")
              .append("Use the muscle group headings to find the right mesh IDs for a body area.");
            return;
        }
        sb.append("\n\n## Currently Selected Muscles (FOCUS HERE)\n")
          .append("The user has selected these muscles on the 3D model. ")
          .append("These are your PRIMARY targets -- update them with `update_muscle` ")
          .append("when the user describes symptoms:");
        for (String meshId : selected) {
            sb.append('\n').append(states.stream()
                    .filter(s -> meshId.equals(s.meshId()))
                    .findFirst()
                    .map(s -> "- " + MuscleFormat.describe(s))
                    .orElse("- " + meshId + ": (no data yet)"));
        }
    }

    /** "upper_back" → "Upper Back". */
    static String title(String group) {
        return Arrays.stream(group.replace('_', ' ').split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    /** JSON array literal with ", " separators: ["a", "b"]. */
    static String jsonList(List<String> values) {
        return values.stream()
                .map(v -> "\"" + v.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
