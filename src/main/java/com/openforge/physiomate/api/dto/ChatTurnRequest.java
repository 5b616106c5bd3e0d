package com.openforge.physiomate.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.physiomate.patient.MuscleState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/chat. Field names are camelCase on the wire.
 *
 * @param message             the new user message
 * @param conversationHistory earlier user/assistant messages, oldest first
 * @param muscleStates        tracked muscle states of the body model
 * @param availableMeshIds    every mesh id the model may reference
 * @param selectedMeshIds     meshes the user currently has selected
 * @param activeGroups        muscle groups the user is focused on
 * @param bodyId              patient body id, enables get_patient_muscle_context
 * @param model               optional model override
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatTurnRequest(

        @NotBlank(message = "message must not be blank")
        @Size(max = 8000, message = "message must not exceed 8000 characters")
        String message,

        @Valid
        List<HistoryMessage> conversationHistory,

        List<MuscleState> muscleStates,

        BodyInfo body,

        List<String> availableMeshIds,

        List<String> selectedMeshIds,

        List<String> activeGroups,

        String bodyId,

        String model
) {

    public ChatTurnRequest {
        conversationHistory = conversationHistory == null ? List.of() : conversationHistory;
        muscleStates        = muscleStates == null ? List.of() : muscleStates;
        availableMeshIds    = availableMeshIds == null ? List.of() : availableMeshIds;
        selectedMeshIds     = selectedMeshIds == null ? List.of() : selectedMeshIds;
        activeGroups        = activeGroups == null ? List.of() : activeGroups;
    }
}
