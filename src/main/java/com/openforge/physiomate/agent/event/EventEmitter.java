package com.openforge.physiomate.agent.event;

/**
 * Push side of the output stream.
 *
 * Fire-and-forget: implementations never throw and never block the loop on
 * a slow or vanished consumer.
 */
@FunctionalInterface
public interface EventEmitter {

    void emit(AgentEvent event);
}
