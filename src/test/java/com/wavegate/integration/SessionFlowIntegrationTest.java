package com.wavegate.integration;

import com.wavegate.core.plan.CharacterDevelopmentPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the built-in character development plan end to end over the REST API, with the file
 * store in a temporary directory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"wavegate.gate.poll-interval=20ms", "wavegate.recovery.enabled=false"})
@DisplayName("Session flow over HTTP")
class SessionFlowIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_LIST =
            new ParameterizedTypeReference<>() {};

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void storePath(DynamicPropertyRegistry registry) {
        registry.add("wavegate.store.path", () -> dataDir.toString());
    }

    @Autowired
    private TestRestTemplate rest;

    private Map<String, Object> awaitCheckpoint(String id, int number) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            ResponseEntity<Map<String, Object>> response = rest.exchange(
                    "/api/v1/sessions/{id}/checkpoints/{n}", HttpMethod.GET, null, JSON, id, number);
            if (response.getStatusCode() == HttpStatus.OK
                    && "awaiting_approval".equals(response.getBody().get("status"))) {
                return response.getBody();
            }
            Thread.sleep(20);
        }
        return fail("checkpoint " + number + " never became ready");
    }

    private Map<String, Object> status(String id) {
        return rest.exchange("/api/v1/sessions/{id}/status", HttpMethod.GET, null, JSON, id).getBody();
    }

    @Test
    @DisplayName("start, approve every checkpoint, fetch the result")
    void fullSession() throws Exception {
        ResponseEntity<Map<String, Object>> started = rest.exchange("/api/v1/sessions", HttpMethod.POST,
                new HttpEntity<>(Map.of(
                        "mode", "fast", "input", Map.of("name", "Mira", "role", "cartographer"))),
                JSON);
        assertEquals(HttpStatus.ACCEPTED, started.getStatusCode());
        String id = (String) started.getBody().get("session_id");
        assertEquals("wave_1_started", started.getBody().get("status"));
        assertEquals(CharacterDevelopmentPlan.NAME, started.getBody().get("plan"));

        assertEquals(HttpStatus.NOT_FOUND, rest.exchange("/api/v1/sessions/{id}/result", HttpMethod.GET,
                null, JSON, id).getStatusCode());

        List<String> order = List.of("personality", "backstory_motivation", "voice_dialogue",
                "physical_description", "story_arc", "relationships", "final_consolidation");
        for (int n = 1; n <= order.size(); n++) {
            Map<String, Object> checkpoint = awaitCheckpoint(id, n);
            assertEquals(order.get(n - 1), checkpoint.get("task_name"));

            ResponseEntity<Map<String, Object>> approved = rest.exchange("/api/v1/sessions/{id}/approve",
                    HttpMethod.POST, new HttpEntity<>(Map.of("checkpoint_number", n)),
                    JSON, id);
            assertEquals(HttpStatus.OK, approved.getStatusCode());
            assertEquals(n, approved.getBody().get("approved_through"));
        }

        long deadline = System.currentTimeMillis() + 10_000;
        while (!"completed".equals(status(id).get("status")) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals("completed", status(id).get("status"));

        ResponseEntity<Map<String, Object>> late = rest.exchange("/api/v1/sessions/{id}/approve",
                HttpMethod.POST, new HttpEntity<>(Map.of("checkpoint_number", order.size())), JSON, id);
        assertEquals(HttpStatus.CONFLICT, late.getStatusCode());
        assertEquals("SESSION_NOT_ACTIVE", late.getBody().get("code"));

        ResponseEntity<Map<String, Object>> result = rest.exchange("/api/v1/sessions/{id}/result",
                HttpMethod.GET, null, JSON, id);
        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertTrue(((String) result.getBody().get("narrative")).contains("Mira"));

        ResponseEntity<List<Map<String, Object>>> checkpoints = rest.exchange(
                "/api/v1/sessions/{id}/checkpoints", HttpMethod.GET, null, JSON_LIST, id);
        assertEquals(7, checkpoints.getBody().size());
        assertTrue(Files.exists(dataDir.resolve(id).resolve("session.json")));
    }

    @Test
    @DisplayName("approving out of order is a 409 and leaves the session unchanged")
    void outOfOrder() throws Exception {
        String id = (String) rest.exchange("/api/v1/sessions", HttpMethod.POST,
                new HttpEntity<>(Map.of()), JSON).getBody().get("session_id");
        awaitCheckpoint(id, 1);

        ResponseEntity<Map<String, Object>> response = rest.exchange("/api/v1/sessions/{id}/approve",
                HttpMethod.POST, new HttpEntity<>(Map.of("checkpoint_number", 3)),
                JSON, id);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("OUT_OF_ORDER_APPROVAL", response.getBody().get("code"));
        assertEquals(0, status(id).get("approved_through"));
    }

    @Test
    @DisplayName("a batch starts the important sessions first and skips the minor ones")
    @SuppressWarnings("unchecked")
    void batch() throws Exception {
        ResponseEntity<Map<String, Object>> response = rest.exchange("/api/v1/sessions/batch", HttpMethod.POST,
                new HttpEntity<>(Map.of("sessions", List.of(
                        Map.of("input", Map.of("name", "Pell"), "priority", 1),
                        Map.of("mode", "fast", "input", Map.of("name", "Ivo")),
                        Map.of("mode", "deep", "input", Map.of("name", "Mira"), "priority", 5)))),
                JSON);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals(2, response.getBody().get("total_selected"));
        assertEquals(3, response.getBody().get("total_submitted"));
        var sessions = (List<Map<String, Object>>) response.getBody().get("sessions");
        assertEquals(List.of(5, 3), sessions.stream().map(s -> s.get("priority")).toList());
        assertEquals(List.of("deep", "fast"), sessions.stream().map(s -> s.get("mode")).toList());

        for (Map<String, Object> started : sessions) {
            awaitCheckpoint((String) started.get("session_id"), 1);
        }
    }

    @Test
    @DisplayName("unknown sessions are 404")
    void unknownSession() {
        ResponseEntity<Map<String, Object>> response = rest.exchange("/api/v1/sessions/{id}/status",
                HttpMethod.GET, null, JSON, "does-not-exist");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("SESSION_NOT_FOUND", response.getBody().get("code"));
    }
}
