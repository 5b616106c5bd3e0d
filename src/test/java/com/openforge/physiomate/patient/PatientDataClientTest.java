package com.openforge.physiomate.patient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.physiomate.config.AppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PatientDataClientTest {

    private final ObjectMapper mapper = new AppConfig().objectMapper();
    private HttpClient httpClient;
    private PatientDataClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new PatientDataClient(httpClient, mapper,
                new PatientDataProperties("https://patient-possum-187.convex.cloud/", 15));
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
    void readsMusclesOfABody() throws Exception {
        respond(200, """
                {"status":"success","value":[
                  {"meshId":"Deltoid_1","condition":"strained","pain":6,"strength":0.8,"mobility":0.7,"notes":"overhead"},
                  {"meshId":"Trapezius","condition":"healthy","pain":0,"strength":1,"mobility":1,"_id":"x1"}
                ]}""");

        List<MuscleState> muscles = client.musclesByBody("body-1");

        assertEquals(2, muscles.size());
        assertEquals("Deltoid_1", muscles.get(0).meshId());
        assertEquals(6.0, muscles.get(0).pain());
        assertEquals("overhead", muscles.get(0).notes());
        assertEquals("healthy", muscles.get(1).condition());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertEquals("https://patient-possum-187.convex.cloud/api/query", captor.getValue().uri().toString());
        assertEquals("POST", captor.getValue().method());
    }

    @Test
    void nullValueMeansNoMuscles() throws Exception {
        respond(200, "{\"status\":\"success\",\"value\":null}");

        assertTrue(client.musclesByBody("body-1").isEmpty());
    }

    @Test
    void errorStatusRaisesWithConvexMessage() throws Exception {
        respond(200, "{\"status\":\"error\",\"errorMessage\":\"Invalid argument bodyId\"}");

        PatientDataClient.PatientDataException e = assertThrows(PatientDataClient.PatientDataException.class,
                () -> client.query("muscles:getByBody", Map.of("bodyId", "bad")));
        assertEquals("Convex query muscles:getByBody failed: Invalid argument bodyId", e.getMessage());
    }

    @Test
    void httpFailureRaises() throws Exception {
        respond(500, "oops");

        assertThrows(PatientDataClient.PatientDataException.class, () -> client.musclesByBody("b"));
    }

    @Test
    void networkFailureRaises() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new IOException("connection refused"));

        assertThrows(PatientDataClient.PatientDataException.class, () -> client.musclesByBody("b"));
    }

    @Test
    void unconfiguredDeploymentFailsWithoutCallingOut() {
        PatientDataClient unconfigured = new PatientDataClient(httpClient, mapper,
                new PatientDataProperties("", 15));

        assertThrows(PatientDataClient.PatientDataException.class, () -> unconfigured.musclesByBody("b"));
        verifyNoInteractions(httpClient);
    }

    @Test
    void queryReturnsRawValue() throws Exception {
        respond(200, "{\"status\":\"success\",\"value\":{\"count\":3}}");

        JsonNode value = client.query("bodies:get", Map.of("id", "b1"));

        assertEquals(3, value.get("count").asInt());
    }
}
