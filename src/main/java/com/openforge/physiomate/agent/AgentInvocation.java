package com.openforge.physiomate.agent;

import com.openforge.physiomate.agent.event.AgentEvent;
import com.openforge.physiomate.agent.event.EventEmitter;
import com.openforge.physiomate.llm.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one run of the loop.
 *
 * Owned by exactly one thread at a time: the TurnController's thread, or a
 * dispatcher acting on its behalf. Sub-agent tasks never touch it; their
 * events reach it through the dispatcher's drain loop.
 */
public class AgentInvocation {

    private final String             id;
    private final List<Message>      history;
    private final List<Message>      toolThread = new ArrayList<>();
    private final List<ActionRecord> actions    = new ArrayList<>();
    private final StringBuilder      text       = new StringBuilder();
    private final EventEmitter       emitter;
    private int stepCounter;
    private int toolCallsStarted;

    public AgentInvocation(String id, List<Message> history, EventEmitter emitter) {
        this.id      = id;
        this.history = new ArrayList<>(history);
        this.emitter = emitter;
    }

    public String id() {
        return id;
    }

    /** Snapshot of the conversation for the next request. */
    public List<Message> history() {
        return List.copyOf(history);
    }

    public List<Message> toolThread() {
        return Collections.unmodifiableList(toolThread);
    }

    public List<ActionRecord> actions() {
        return Collections.unmodifiableList(actions);
    }

    /** Appends to both the model-facing history and the tool thread. */
    public void append(Message message) {
        history.add(message);
        toolThread.add(message);
    }

    public void addAction(ActionRecord action) {
        actions.add(action);
    }

    public void appendText(String fragment) {
        text.append(fragment);
    }

    public String text() {
        return text.toString();
    }

    public void emit(AgentEvent event) {
        emitter.emit(event);
    }

    /** Correlation id for a step/step_complete pair, unique within this invocation. */
    public String nextStepId() {
        return "step-" + (++stepCounter);
    }

    /**
     * Counts a tool call against the invocation's ceiling.
     *
     * @return false when the ceiling is already reached; the call must not run
     */
    public boolean reserveToolCall(int ceiling) {
        if (toolCallsStarted >= ceiling) return false;
        toolCallsStarted++;
        return true;
    }

    public int toolCallsStarted() {
        return toolCallsStarted;
    }
}
