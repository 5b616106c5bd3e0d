package com.openforge.physiomate.workout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Illustrates exercises through the OpenAI-compatible /images/generations
 * endpoint. A missing picture never fails a plan: every problem is logged
 * and reported as an empty result.
 */
@Slf4j
@Component
public class ExerciseImageClient {

    private final HttpClient               httpClient;
    private final ObjectMapper             objectMapper;
    private final WorkoutProperties.Images props;

    public ExerciseImageClient(HttpClient httpClient, ObjectMapper objectMapper, WorkoutProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = properties.images();
    }

    public boolean enabled() {
        return props.enabled() && props.baseUrl() != null && !props.baseUrl().isBlank();
    }

    /** @return URL of the generated picture, or empty when generation failed */
    public Optional<String> illustrate(String exerciseName) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new ImageRequest(prompt(exerciseName), props.model(), props.size(), 1));
        } catch (JsonProcessingException e) {
            log.warn("[Images] Cannot serialize request for '{}': {}", exerciseName, e.getOriginalMessage());
            return Optional.empty();
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/images/generations"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("[Images] HTTP {} for '{}': {}", response.statusCode(), exerciseName, response.body());
                return Optional.empty();
            }
            JsonNode url = objectMapper.readTree(response.body()).path("data").path(0).path("url");
            if (!url.isTextual() || url.asText().isBlank()) {
                log.warn("[Images] No image URL in response for '{}'", exerciseName);
                return Optional.empty();
            }
            return Optional.of(url.asText());
        } catch (IOException e) {
            log.warn("[Images] Generation failed for '{}': {}", exerciseName, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Images] Interrupted while illustrating '{}'", exerciseName);
            return Optional.empty();
        }
    }

    static String prompt(String exerciseName) {
        return "A simple, clean illustration showing proper form for the exercise: " + exerciseName
                + ". Show a figure performing the exercise with good posture. Minimal background, fitness style.";
    }

    record ImageRequest(String prompt, String model, String size, int n) {}
}
