package com.wavegate.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Nested
    @DisplayName("Session")
    class SessionTests {

        @Test
        @DisplayName("create starts in_progress at wave 0 with nothing approved")
        void create() {
            Session s = Session.create("S-1", "plan", SessionMode.FAST, 7, Map.of("name", "Ada"));

            assertEquals(SessionStatus.IN_PROGRESS, s.status());
            assertEquals(0, s.currentWave());
            assertEquals(0, s.currentCheckpoint());
            assertEquals(0, s.approvedThrough());
            assertEquals(7, s.totalCheckpoints());
            assertEquals("Ada", s.input().get("name"));
            assertNull(s.completedAt());
        }

        @Test
        @DisplayName("approved_through never decreases")
        void approvedThroughMonotonic() {
            Session s = Session.create("S-1", "plan", SessionMode.FAST, 7, null)
                    .withApprovedThrough(3)
                    .withApprovedThrough(2);
            assertEquals(3, s.approvedThrough());
        }

        @Test
        @DisplayName("completed and failed are terminal and stamp completed_at")
        void terminalTransitions() {
            Session base = Session.create("S-1", "plan", SessionMode.FAST, 7, null);

            Session done = base.completed();
            assertTrue(done.status().isTerminal());
            assertNotNull(done.completedAt());

            Session failed = base.failed("boom", "personality");
            assertEquals(SessionStatus.FAILED, failed.status());
            assertEquals("boom", failed.error());
            assertEquals("personality", failed.failedTask());
            assertNotNull(failed.completedAt());
        }

        @Test
        @DisplayName("input map is copied and unmodifiable")
        void inputImmutable() {
            var input = new java.util.HashMap<String, Object>();
            input.put("name", "Ada");
            Session s = Session.create("S-1", "plan", SessionMode.FAST, 7, input);
            input.put("name", "Bob");

            assertEquals("Ada", s.input().get("name"));
            assertThrows(UnsupportedOperationException.class, () -> s.input().put("x", 1));
        }

        @Test
        @DisplayName("nested input values are copied and unmodifiable")
        void nestedInputImmutable() {
            var tags = new java.util.ArrayList<Object>(List.of("brave"));
            Session s = Session.create("S-1", "plan", SessionMode.FAST, 7, Map.of("tags", tags));
            tags.add("reckless");

            @SuppressWarnings("unchecked")
            List<Object> stored = (List<Object>) s.input().get("tags");
            assertEquals(List.of("brave"), stored);
            assertThrows(UnsupportedOperationException.class, () -> stored.add("x"));
        }

        @Test
        @DisplayName("serializes with snake_case keys and survives a JSON round trip")
        void json() throws Exception {
            Session s = Session.create("S-1", "plan", SessionMode.DEEP, 3, Map.of("name", "Ada"))
                    .withCurrentWave(1).withCurrentCheckpoint(1);

            String json = objectMapper.writeValueAsString(s);
            assertTrue(json.contains("\"approved_through\":0"));
            assertTrue(json.contains("\"status\":\"in_progress\""));
            assertTrue(json.contains("\"mode\":\"deep\""));

            assertEquals(s, objectMapper.readValue(json, Session.class));
        }
    }

    @Nested
    @DisplayName("SessionMode")
    class SessionModeTests {

        @Test
        @DisplayName("parse is case-insensitive and defaults to balanced")
        void parse() {
            assertEquals(SessionMode.FAST, SessionMode.parse("FAST"));
            assertEquals(SessionMode.DEEP, SessionMode.parse(" deep "));
            assertEquals(SessionMode.BALANCED, SessionMode.parse(null));
            assertEquals(SessionMode.BALANCED, SessionMode.parse(""));
        }

        @Test
        @DisplayName("parse rejects unknown modes")
        void parseUnknown() {
            assertThrows(IllegalArgumentException.class, () -> SessionMode.parse("turbo"));
        }
    }

    @Nested
    @DisplayName("Checkpoint")
    class CheckpointTests {

        private Checkpoint checkpoint() {
            return new Checkpoint(2, "backstory_motivation", 1, CheckpointStatus.AWAITING_APPROVAL,
                    new CheckpointOutput("text", Map.of("k", "v")),
                    new CheckpointMetadata(Instant.now(), 1.0, 0.5), null, 0);
        }

        @Test
        @DisplayName("withFeedback appends feedback and changes status")
        void withFeedback() {
            Checkpoint rejected = checkpoint().withFeedback("more depth", CheckpointStatus.REJECTED);

            assertEquals(CheckpointStatus.REJECTED, rejected.status());
            assertEquals(List.of("more depth"), rejected.feedback());
            assertEquals("more depth", rejected.latestFeedback());
        }

        @Test
        @DisplayName("regenerated keeps number and feedback, bumps revision, awaits approval again")
        void regenerated() {
            Checkpoint rejected = checkpoint().withFeedback("more depth", CheckpointStatus.REJECTED);
            Checkpoint again = rejected.regenerated(new CheckpointOutput("better", Map.of()),
                    new CheckpointMetadata(Instant.now(), 2.0, 0.1));

            assertEquals(2, again.number());
            assertEquals(1, again.revision());
            assertEquals(CheckpointStatus.AWAITING_APPROVAL, again.status());
            assertEquals("better", again.output().narrative());
            assertEquals(List.of("more depth"), again.feedback());
        }

        @Test
        @DisplayName("JSON carries task_name and status wire names, not the approved helper")
        void json() throws Exception {
            String json = objectMapper.writeValueAsString(checkpoint().withStatus(CheckpointStatus.APPROVED));

            assertTrue(json.contains("\"task_name\":\"backstory_motivation\""));
            assertTrue(json.contains("\"status\":\"approved\""));
            assertFalse(json.contains("\"approved\":"));

            Checkpoint back = objectMapper.readValue(json, Checkpoint.class);
            assertTrue(back.isApproved());
        }
    }

    @Nested
    @DisplayName("SharedContext")
    class SharedContextTests {

        @Test
        @DisplayName("with increments the version and leaves the original untouched")
        void withIsCopyOnWrite() {
            SharedContext empty = SharedContext.empty();
            SharedContext one = empty.with("personality", Map.of("core_traits", List.of("loyal")));

            assertEquals(0, empty.getVersion());
            assertTrue(empty.getEntries().isEmpty());
            assertEquals(1, one.getVersion());
            assertTrue(one.contains("personality"));
        }

        @Test
        @DisplayName("a regenerated task replaces its entry")
        void replaceEntry() {
            SharedContext ctx = SharedContext.empty()
                    .with("personality", Map.of("v", 1))
                    .with("personality", Map.of("v", 2));

            assertEquals(Map.of("v", 2), ctx.get("personality").orElseThrow());
            assertEquals(1, ctx.getEntries().size());
        }

        @Test
        @DisplayName("snapshot only exposes the visible tasks")
        void snapshot() {
            SharedContext ctx = SharedContext.empty()
                    .with("personality", Map.of("v", 1))
                    .with("backstory_motivation", Map.of("v", 2))
                    .with("voice_dialogue", Map.of("v", 3));

            var view = ctx.snapshot(List.of("personality", "backstory_motivation"));

            assertEquals(List.of("personality", "backstory_motivation"), List.copyOf(view.keySet()));
            assertThrows(UnsupportedOperationException.class, () -> view.put("x", Map.of()));
        }

        @Test
        @DisplayName("entries read back from JSON are unmodifiable at every depth")
        void deeplyFrozen() throws Exception {
            String json = "{\"version\":1,\"entries\":{\"personality\":"
                    + "{\"traits\":{\"core\":\"calm\"},\"fears\":[\"heights\"]}}}";
            SharedContext ctx = objectMapper.readValue(json, SharedContext.class);

            var view = ctx.snapshot(List.of("personality"));
            Map<String, Object> personality = view.get("personality");

            assertThrows(UnsupportedOperationException.class, () -> personality.put("traits", "loud"));
            @SuppressWarnings("unchecked")
            Map<String, Object> traits = (Map<String, Object>) personality.get("traits");
            assertThrows(UnsupportedOperationException.class, () -> traits.put("core", "loud"));
            @SuppressWarnings("unchecked")
            List<Object> fears = (List<Object>) personality.get("fears");
            assertThrows(UnsupportedOperationException.class, () -> fears.add("water"));
        }

        @Test
        @DisplayName("survives a JSON round trip")
        void json() throws Exception {
            SharedContext ctx = SharedContext.empty().with("personality", Map.of("fears", List.of("heights")));

            SharedContext back = objectMapper.readValue(objectMapper.writeValueAsString(ctx), SharedContext.class);

            assertEquals(ctx, back);
        }
    }
}
