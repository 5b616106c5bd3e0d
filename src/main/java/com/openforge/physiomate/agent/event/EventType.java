package com.openforge.physiomate.agent.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classifies every event written to the output stream.
 *
 * Flow per turn: STEP("Thinking") → TEXT_DELTA* → STEP_COMPLETE, then for each
 * tool call STEP → (SUBSTEP → SUBSTEP_COMPLETE)* → STEP_COMPLETE. DONE closes
 * the stream.
 */
public enum EventType {

    /** A unit of work started. Paired with STEP_COMPLETE by id. */
    STEP("step"),

    STEP_COMPLETE("step_complete"),

    /** Progress inside a sub-agent tool; parent_id is the tool call id. */
    SUBSTEP("substep"),

    SUBSTEP_COMPLETE("substep_complete"),

    /** Incremental model text. */
    TEXT_DELTA("text_delta"),

    /** Terminal event: final text, actions, tool thread. */
    DONE("done");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
