package com.openforge.physiomate.workout;

import com.openforge.physiomate.config.AppConfig;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExerciseImageClientTest {

    private final HttpClient httpClient = mock(HttpClient.class);

    private ExerciseImageClient client(boolean enabled, String baseUrl) {
        return new ExerciseImageClient(httpClient, new AppConfig().objectMapper(), new WorkoutProperties(0.5, 4096,
                new WorkoutProperties.Images(enabled, baseUrl, "sk-test", "dall-e-3", "1024x1024", 30)));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(response);
    }

    @Test
    void returnsFirstImageUrl() throws Exception {
        respond(200, "{\"created\":1,\"data\":[{\"url\":\"https://img.example.com/squat.png\"}]}");

        Optional<String> url = client(true, "https://api.example.com/v1").illustrate("Goblet squat");

        assertEquals(Optional.of("https://img.example.com/squat.png"), url);
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertEquals("https://api.example.com/v1/images/generations", captor.getValue().uri().toString());
        assertEquals("Bearer sk-test", captor.getValue().headers().firstValue("Authorization").orElseThrow());
    }

    @Test
    void httpErrorGivesNoImage() throws Exception {
        respond(500, "{\"error\":\"overloaded\"}");

        assertTrue(client(true, "https://api.example.com/v1").illustrate("Plank").isEmpty());
    }

    @Test
    void missingUrlGivesNoImage() throws Exception {
        respond(200, "{\"data\":[{\"b64_json\":\"AAAA\"}]}");

        assertTrue(client(true, "https://api.example.com/v1").illustrate("Plank").isEmpty());
    }

    @Test
    void networkFailureGivesNoImage() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new IOException("connection refused"));

        assertTrue(client(true, "https://api.example.com/v1").illustrate("Plank").isEmpty());
    }

    @Test
    void needsBothTheFlagAndAnEndpoint() {
        assertTrue(client(true, "https://api.example.com/v1").enabled());
        assertFalse(client(false, "https://api.example.com/v1").enabled());
        assertFalse(client(true, " ").enabled());
    }

    @Test
    void promptNamesTheExercise() {
        assertTrue(ExerciseImageClient.prompt("Nordic curl").contains("exercise: Nordic curl."));
    }
}
