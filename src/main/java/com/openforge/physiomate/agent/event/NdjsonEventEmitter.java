package com.openforge.physiomate.agent.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Serializes events as newline-delimited JSON and hands each line to a sink.
 *
 * The first delivery failure marks the emitter broken; later events are
 * dropped silently so a disconnected client costs one warning, not one per
 * token. The loop itself is never told.
 */
@Slf4j
public class NdjsonEventEmitter implements EventEmitter {

    /** Receives one complete line, terminator included. */
    @FunctionalInterface
    public interface LineSink {
        void write(String line) throws IOException;
    }

    private final ObjectMapper objectMapper;
    private final LineSink     sink;
    private final String       streamId;
    private volatile boolean   broken;

    public NdjsonEventEmitter(ObjectMapper objectMapper, LineSink sink, String streamId) {
        this.objectMapper = objectMapper;
        this.sink         = sink;
        this.streamId     = streamId;
    }

    @Override
    public synchronized void emit(AgentEvent event) {
        if (broken) return;
        String line;
        try {
            line = objectMapper.writeValueAsString(event) + "\n";
        } catch (JsonProcessingException e) {
            log.warn("[Emitter:{}] Failed to serialize {} event: {}", streamId, event.type(), e.getMessage());
            return;
        }
        try {
            sink.write(line);
        } catch (IOException | RuntimeException e) {
            broken = true;
            log.warn("[Emitter:{}] Failed to deliver {} event, dropping the rest: {}",
                    streamId, event.type(), e.getMessage());
        }
    }

    public boolean isBroken() {
        return broken;
    }
}
