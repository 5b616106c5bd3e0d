package com.openforge.physiomate.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.physiomate.agent.ActionRecord;
import com.openforge.physiomate.agent.SessionResult;
import com.openforge.physiomate.agent.tool.Substep;
import com.openforge.physiomate.llm.model.Message;

import java.util.List;

/**
 * The single event envelope written to the output stream, one JSON object
 * per line.
 *
 * Fields:
 *   type: discriminator; tells the client how to render the event
 *   id: correlation id pairing step/step_complete and substep/substep_complete
 *   parentId: for substeps, the id of the tool call that owns them
 *   label: human-readable progress label
 *   tool: tool name, when the event concerns a tool
 *   text: the fragment of a text_delta
 *   content: final text of done
 *   actions: action list of done
 *   toolThread: messages appended during the invocation, on done
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        EventType type,
        String id,
        String parentId,
        String label,
        String tool,
        String text,
        String content,
        List<ActionRecord> actions,
        @JsonProperty("toolThread") List<Message> toolThread
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static AgentEvent step(String id, String label, String tool) {
        return new AgentEvent(EventType.STEP, id, null, label, tool, null, null, null, null);
    }

    public static AgentEvent stepComplete(String id, String label, String tool) {
        return new AgentEvent(EventType.STEP_COMPLETE, id, null, label, tool, null, null, null, null);
    }

    public static AgentEvent substep(String parentId, Substep substep) {
        return new AgentEvent(substep.complete() ? EventType.SUBSTEP_COMPLETE : EventType.SUBSTEP,
                substep.id(), parentId, substep.label(), substep.toolName(), null, null, null, null);
    }

    public static AgentEvent textDelta(String text) {
        return new AgentEvent(EventType.TEXT_DELTA, null, null, null, null, text, null, null, null);
    }

    public static AgentEvent done(SessionResult result) {
        return new AgentEvent(EventType.DONE, null, null, null, null, null,
                result.finalText(), result.actions(), result.toolThread());
    }
}
