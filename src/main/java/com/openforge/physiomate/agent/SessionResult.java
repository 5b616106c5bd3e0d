package com.openforge.physiomate.agent;

import com.openforge.physiomate.llm.model.Message;

import java.util.List;

/**
 * Outcome of one invocation, handed to the caller after the loop ends.
 *
 * @param finalText  text the model produced across all turns, or the apology on failure
 * @param actions    ACTION calls in the order the model issued them
 * @param toolThread assistant/tool messages appended during this invocation
 * @param turns      model turns actually executed
 * @param failed     true when the loop ended on an unhandled exception
 */
public record SessionResult(
        String finalText,
        List<ActionRecord> actions,
        List<Message> toolThread,
        int turns,
        boolean failed
) {

    public SessionResult {
        actions    = List.copyOf(actions);
        toolThread = List.copyOf(toolThread);
    }
}
