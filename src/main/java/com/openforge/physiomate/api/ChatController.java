package com.openforge.physiomate.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.agent.SessionResult;
import com.openforge.physiomate.agent.TurnController;
import com.openforge.physiomate.agent.event.NdjsonEventEmitter;
import com.openforge.physiomate.api.dto.ChatTurnRequest;
import com.openforge.physiomate.llm.model.Message;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * HTTP entry point of the agent.
 *
 * Endpoints:
 *   POST /api/chat: run one agent invocation, streaming events as NDJSON
 *   GET  /api/health: liveness probe
 *
 * Each chat request runs on the agentExecutor; the servlet thread returns
 * immediately with a ResponseBodyEmitter. When the client disconnects or the
 * async request times out, the invocation's future is cancelled, which
 * interrupts the loop thread.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class ChatController {

    static final MediaType NDJSON_LINE = new MediaType("application", "x-ndjson", StandardCharsets.UTF_8);

    private final TurnController      turnController;
    private final SystemPromptBuilder promptBuilder;
    private final ObjectMapper        objectMapper;
    private final ExecutorService     agentExecutor;
    private final Duration            streamTimeout;

    public ChatController(TurnController turnController,
                          SystemPromptBuilder promptBuilder,
                          ObjectMapper objectMapper,
                          @Qualifier("agentExecutor") ExecutorService agentExecutor,
                          @Value("${agent.chat.stream-timeout:10m}") Duration streamTimeout) {
        this.turnController = turnController;
        this.promptBuilder  = promptBuilder;
        this.objectMapper   = objectMapper;
        this.agentExecutor  = agentExecutor;
        this.streamTimeout  = streamTimeout;
    }

    // ── Chat ─────────────────────────────────────────────────────────────────

    @PostMapping(value = "/chat", produces = "application/x-ndjson")
    public ResponseEntity<ResponseBodyEmitter> chat(@Valid @RequestBody ChatTurnRequest request) {
        String invocationId = UUID.randomUUID().toString().substring(0, 8);
        List<Message> history = promptBuilder.buildHistory(request);

        ResponseBodyEmitter emitter = new ResponseBodyEmitter(streamTimeout.toMillis());
        NdjsonEventEmitter events = new NdjsonEventEmitter(objectMapper,
                line -> emitter.send(line, NDJSON_LINE), invocationId);

        Future<?> invocation = agentExecutor.submit(() -> {
            try {
                SessionResult result = turnController.run(invocationId, history, request.model(), events);
                log.info("[Chat:{}] Completed: turns={} actions={} failed={}",
                        invocationId, result.turns(), result.actions().size(), result.failed());
                emitter.complete();
            } catch (RuntimeException | Error e) {
                log.error("[Chat:{}] Invocation crashed: {}", invocationId, e.getMessage(), e);
                emitter.completeWithError(e);
            }
        });

        emitter.onTimeout(() -> {
            log.warn("[Chat:{}] Stream timed out after {}, cancelling", invocationId, streamTimeout);
            invocation.cancel(true);
        });
        emitter.onError(e -> {
            log.info("[Chat:{}] Client stream error ({}), cancelling", invocationId, e.getMessage());
            invocation.cancel(true);
        });
        emitter.onCompletion(() -> invocation.cancel(true));

        log.info("[Chat:{}] Started. history={} selected={} bodyId={}",
                invocationId, request.conversationHistory().size(),
                request.selectedMeshIds().size(), request.bodyId());

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_NDJSON)
                .body(emitter);
    }

    // ── Health ───────────────────────────────────────────────────────────────

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
