package com.openforge.physiomate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.physiomate.llm.model.ChatRequest;
import com.openforge.physiomate.llm.model.ChatResponse;
import com.openforge.physiomate.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless HTTP client for one OpenAI-compatible provider.
 *
 *  chat(): synchronous, waits for the full response.
 *                  Used by the research sub-agent.
 *
 *  streamChat(): SSE streaming, hands every parsed chunk to the caller.
 *                  Used by the TurnController, which does its own delta
 *                  accumulation so it can emit progress while the model
 *                  is still talking.
 *
 * Both are blocking; the agent runs each invocation on its own pool thread.
 */
@Slf4j
public class LlmClient implements ChatModel {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(withDefaultModel(request), false);
        log.debug("[LlmClient:{}] → chat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<String> httpResponse;
        try {
            httpResponse = httpClient.send(buildHttpRequest(requestBody, false),
                    HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling provider [%s]".formatted(config.name()), e);
        }
        return parseFullResponse(httpResponse);
    }

    /**
     * Streaming chat completion via SSE.
     *
     * A failure before the first chunk is delivered surfaces as
     * {@link LlmException} and may be retried by the router. A failure after
     * that point surfaces as {@link LlmStreamInterruptedException}: the caller
     * has already acted on partial output, so a replay would duplicate it.
     */
    @Override
    public void streamChat(ChatRequest request, Consumer<StreamingChunk> chunkConsumer) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }

        String requestBody = serialize(withDefaultModel(request), true);
        log.debug("[LlmClient:{}] → streamChat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(
                    buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted opening stream to provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            closeQuietly(httpResponse.body());
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = snippet(httpResponse.body());
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet));
        }

        try (Stream<String> lines = httpResponse.body()) {
            readStream(lines, chunkConsumer);
        }
    }

    /** The model name configured for this provider (e.g. "gpt-4o"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── SSE parsing ──────────────────────────────────────────────────────────

    /**
     * Reads SSE lines until "[DONE]" or end of stream and forwards each parsed
     * chunk. Comment lines, event-name lines and blank separators are skipped;
     * a frame that fails to parse is logged and dropped.
     */
    void readStream(Stream<String> lines, Consumer<StreamingChunk> chunkConsumer) {
        boolean delivered = false;
        Iterator<String> it = lines.iterator();
        try {
            while (it.hasNext()) {
                String line = it.next();
                if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) continue;

                String json = line.substring(SSE_DATA_PREFIX.length()).trim();
                if (SSE_DONE.equals(json)) break;
                if (json.isEmpty()) continue;

                StreamingChunk chunk;
                try {
                    chunk = objectMapper.readValue(json, StreamingChunk.class);
                } catch (JsonProcessingException e) {
                    log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", config.name(), json);
                    continue;
                }
                delivered = true;
                chunkConsumer.accept(chunk);
            }
        } catch (UncheckedIOException e) {
            if (delivered) {
                throw new LlmStreamInterruptedException(
                        "Stream from provider [%s] broke mid-response".formatted(config.name()), e);
            }
            throw new LlmException("Stream from provider [%s] failed before first chunk"
                    .formatted(config.name()), e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatRequest withDefaultModel(ChatRequest request) {
        if (request.model() != null && !request.model().isBlank()) {
            return request;
        }
        return request.toBuilder().model(config.model()).build();
    }

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Accept", streaming ? "text/event-stream" : "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                // Streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(streaming ? config.timeoutSeconds() * 2L : config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), body), e);
        }
    }

    private String serialize(ChatRequest request, boolean stream) {
        try {
            ObjectNode node = objectMapper.valueToTree(request);
            if (stream) {
                node.put("stream", true);
            }
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String snippet(Stream<String> lines) {
        if (lines == null) return "";
        try (lines) {
            StringBuilder sb = new StringBuilder();
            lines.limit(20).forEach(line -> {
                if (sb.length() >= 2048) return;
                if (sb.length() > 0) sb.append('\n');
                sb.append(line);
            });
            return sb.toString();
        } catch (UncheckedIOException e) {
            return "(unreadable body: " + e.getMessage() + ")";
        }
    }

    private static void closeQuietly(Stream<String> lines) {
        if (lines != null) {
            lines.close();
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }

    /** The stream delivered at least one chunk before failing; never replay it. */
    public static class LlmStreamInterruptedException extends LlmException {
        public LlmStreamInterruptedException(String message, Throwable cause) { super(message, cause); }
    }
}
