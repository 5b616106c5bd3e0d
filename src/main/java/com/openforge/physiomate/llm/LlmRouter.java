package com.openforge.physiomate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.ChatResponse;
import com.openforge.physiomate.llm.model.StreamingChunk;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * High-availability LLM request router.
 *
 * Call graph (both chat and streamChat):
 *
 *   chat(request)  /  streamChat(request, chunkConsumer)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.{chat|streamChat}(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackLlmClient.{chat|streamChat}(request)
 *
 * Streaming note:
 *   Once a chunk has reached the consumer the turn has already emitted
 *   text and accumulated deltas from it. A stream that fails after that
 *   point is neither retried nor routed to the fallback; the failure goes
 *   straight back to the TurnController.
 */
@Slf4j
@Primary
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements ChatModel {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     @Qualifier("primaryLlmCircuitBreaker") CircuitBreaker primaryLlmCircuitBreaker,
                     @Qualifier("fallbackLlmCircuitBreaker") CircuitBreaker fallbackLlmCircuitBreaker,
                     @Qualifier("primaryLlmRetry") Retry primaryLlmRetry,
                     @Qualifier("fallbackLlmRetry") Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.fallback() == null ? null
                        : new LlmClient(httpClient, objectMapper, properties.fallback()),
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = withModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), "primary");
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) throw primaryException;
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    @Override
    public void streamChat(ChatRequest request, Consumer<StreamingChunk> chunkConsumer) {
        AtomicBoolean delivered = new AtomicBoolean();
        Consumer<StreamingChunk> tracking = chunk -> {
            delivered.set(true);
            chunkConsumer.accept(chunk);
        };

        try {
            ChatRequest primaryRequest = withModel(request, primaryClient.modelName());
            executeWithResilience(primaryCb, primaryRetry, () -> {
                primaryClient.streamChat(primaryRequest, tracking);
                return null;
            }, "primary");
        } catch (RuntimeException primaryException) {
            if (delivered.get() || fallbackClient == null) throw primaryException;
            log.warn("[LlmRouter] Primary stream failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
            executeWithResilience(fallbackCb, fallbackRetry, () -> {
                fallbackClient.streamChat(fallbackRequest, tracking);
                return null;
            }, "fallback");
        }
    }

    public String primaryModel() {
        return primaryClient.modelName();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * A mid-stream interruption passes through unwrapped so callers can tell
     * it apart from a provider that never answered.
     */
    private <T> T executeWithResilience(CircuitBreaker cb,
                                        Retry retry,
                                        Supplier<T> call,
                                        String label) {
        Supplier<T> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (LlmClient.LlmStreamInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    /**
     * Fills in the primary provider's model only when the caller did not pick
     * one. The fallback always runs its own configured model.
     */
    private ChatRequest withModel(ChatRequest original, String modelName) {
        if (original.model() != null && !original.model().isBlank()) {
            return original;
        }
        return original.toBuilder().model(modelName).build();
    }
}
