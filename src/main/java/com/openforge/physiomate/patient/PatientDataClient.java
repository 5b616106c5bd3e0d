package com.openforge.physiomate.patient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads patient data from the Convex deployment through its HTTP query API.
 *
 *   POST {convexUrl}/api/query
 *   { "path": "muscles:getByBody", "args": { "bodyId": "..." }, "format": "json" }
 *
 *   ← { "status": "success", "value": [...] }
 *   ← { "status": "error", "errorMessage": "..." }
 */
@Slf4j
@Component
@EnableConfigurationProperties(PatientDataProperties.class)
public class PatientDataClient {

    static final String MUSCLES_BY_BODY = "muscles:getByBody";

    private final HttpClient            httpClient;
    private final ObjectMapper          objectMapper;
    private final PatientDataProperties props;

    public PatientDataClient(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             PatientDataProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    /** All tracked muscles of a body; empty when the body has none. */
    public List<MuscleState> musclesByBody(String bodyId) {
        JsonNode value = query(MUSCLES_BY_BODY, Map.of("bodyId", bodyId));
        List<MuscleState> muscles = new ArrayList<>();
        if (value == null || !value.isArray()) return muscles;
        for (JsonNode row : value) {
            try {
                muscles.add(objectMapper.treeToValue(row, MuscleState.class));
            } catch (JsonProcessingException e) {
                log.warn("[Convex] Skipping unreadable muscle row: {}", e.getOriginalMessage());
            }
        }
        return muscles;
    }

    /**
     * Runs a Convex query function and returns its value.
     *
     * @throws PatientDataException when the deployment is not configured,
     *         unreachable, or answers with an error
     */
    public JsonNode query(String path, Map<String, ?> args) {
        if (!props.configured()) {
            throw new PatientDataException("agent.patient.convex-url is not set");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("path", path);
        payload.set("args", objectMapper.valueToTree(args));
        payload.put("format", "json");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(props.convexUrl()) + "/api/query"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();

        log.debug("[Convex] → query {} args={}", path, args);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PatientDataException("Network error querying " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PatientDataException("Interrupted querying " + path, e);
        }
        return parseResponse(path, response);
    }

    private JsonNode parseResponse(String path, HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new PatientDataException("Convex returned HTTP %d for %s: %s"
                    .formatted(response.statusCode(), path, response.body()));
        }
        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new PatientDataException("Unreadable Convex response for " + path, e);
        }
        if (!"success".equals(body.path("status").asText())) {
            throw new PatientDataException("Convex query %s failed: %s"
                    .formatted(path, body.path("errorMessage").asText("unknown error")));
        }
        return body.get("value");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class PatientDataException extends RuntimeException {
        public PatientDataException(String message) { super(message); }
        public PatientDataException(String message, Throwable cause) { super(message, cause); }
    }
}
