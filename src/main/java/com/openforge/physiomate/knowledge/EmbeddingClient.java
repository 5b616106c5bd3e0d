package com.openforge.physiomate.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Embeds search queries through the OpenAI-compatible /embeddings endpoint.
 *
 * Same shape as LlmClient: the shared HttpClient plus Jackson, blocking on
 * the caller's thread.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    /**
     * Embeds a search query, with the configured query prefix applied.
     *
     * @return vector of {@link EmbeddingProperties#dimensions()} floats
     */
    public List<Float> embedQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Cannot embed a blank query");
        }
        String prefix = props.queryPrefix() == null ? "" : props.queryPrefix();
        String input  = prefix + query.strip();
        if (input.length() > MAX_INPUT_CHARS) {
            input = input.substring(0, MAX_INPUT_CHARS);
        }

        String body = serialize(EmbeddingRequest.of(input, props.model(), props.dimensions()));
        log.debug("[Embed] → POST /embeddings model={} input-length={}", props.model(), input.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted calling embedding API", e);
        }
        return parseResponse(response);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Float> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            List<Float> vector = objectMapper.readValue(body, EmbeddingResponse.class).firstEmbedding();
            log.debug("[Embed] ← vector dim={}", vector.size());
            return vector;
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response", e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
