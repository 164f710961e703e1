package com.wavegate.dispatch.api;

import com.wavegate.core.engine.BatchEntry;
import com.wavegate.core.engine.BatchResult;
import com.wavegate.core.engine.BatchStarter;
import com.wavegate.core.engine.Decision;
import com.wavegate.core.engine.ResultNotAvailableException;
import com.wavegate.core.engine.SessionService;
import com.wavegate.core.gate.CheckpointNotFoundException;
import com.wavegate.core.gate.CheckpointStateException;
import com.wavegate.core.gate.OutOfOrderApprovalException;
import com.wavegate.core.gate.SessionNotActiveException;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.CheckpointMetadata;
import com.wavegate.core.model.CheckpointOutput;
import com.wavegate.core.model.CheckpointStatus;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SessionMode;
import com.wavegate.core.model.SessionStatus;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;
import com.wavegate.core.persistence.SessionNotFoundException;
import com.wavegate.core.plan.UnknownPlanException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final String ID = "4f1c2b8e-session";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionService sessionService;

    @MockitoBean
    private BatchStarter batchStarter;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static Session session(int approvedThrough) {
        return Session.create(ID, "character-development", SessionMode.BALANCED, 7, Map.of("name", "Mira"))
                .withCurrentWave(1)
                .withCurrentCheckpoint(approvedThrough + 1)
                .withApprovedThrough(approvedThrough);
    }

    private static Checkpoint checkpoint(int number, CheckpointStatus status) {
        return new Checkpoint(number, "personality", 1, status,
                new CheckpointOutput("Mira is curious.", Map.of("core_traits", List.of("curious"))),
                new CheckpointMetadata(Instant.parse("2026-01-01T00:00:00Z"), 2, 0.4), null, 0);
    }

    // ── POST /api/v1/sessions ────────────────────────────────────────

    @Test
    @DisplayName("POST /sessions returns 202 with session_id and wave_1_started")
    void startSession() throws Exception {
        when(sessionService.start(eq("character-development"), eq("balanced"), any())).thenReturn(session(0));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"plan":"character-development","mode":"balanced","input":{"name":"Mira"}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.session_id").value(ID))
                .andExpect(jsonPath("$.status").value("wave_1_started"))
                .andExpect(jsonPath("$.mode").value("balanced"))
                .andExpect(jsonPath("$.total_checkpoints").value(7));
    }

    @Test
    @DisplayName("POST /sessions without a body starts the default plan")
    void startSessionWithoutBody() throws Exception {
        when(sessionService.start(isNull(), isNull(), isNull())).thenReturn(session(0));

        mockMvc.perform(post("/api/v1/sessions"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.session_id").value(ID));
    }

    @Test
    @DisplayName("POST /sessions with invalid mode returns 400")
    void startSessionBadMode() throws Exception {
        when(sessionService.start(any(), eq("turbo"), any()))
                .thenThrow(new IllegalArgumentException("Invalid mode 'turbo'; expected fast, balanced or deep"));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"turbo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error", containsString("Invalid mode")));
    }

    @Test
    @DisplayName("POST /sessions with an unknown plan returns 400")
    void startSessionUnknownPlan() throws Exception {
        when(sessionService.start(eq("nope"), any(), any())).thenThrow(new UnknownPlanException("nope"));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan\":\"nope\"}"))
                .andExpect(status().isBadRequest());
    }

    // ── POST /api/v1/sessions/batch ──────────────────────────────────

    @Test
    @DisplayName("POST /sessions/batch returns the started sessions with selected and submitted totals")
    void startBatch() throws Exception {
        Session lead = Session.create("S-lead", "character-development", SessionMode.DEEP, 7, Map.of());
        Session support = Session.create("S-support", "character-development", SessionMode.FAST, 7, Map.of());
        when(batchStarter.start(anyList())).thenReturn(new BatchResult(List.of(
                new BatchResult.Started(lead, 5), new BatchResult.Started(support, 3)), 3));

        mockMvc.perform(post("/api/v1/sessions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessions":[
                                  {"mode":"fast","input":{"name":"Tam"}},
                                  {"mode":"deep","input":{"name":"Mira"},"priority":5},
                                  {"input":{"name":"Ox"},"priority":1}
                                ]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("batch_started"))
                .andExpect(jsonPath("$.total_selected").value(2))
                .andExpect(jsonPath("$.total_submitted").value(3))
                .andExpect(jsonPath("$.sessions[*].session_id", contains("S-lead", "S-support")))
                .andExpect(jsonPath("$.sessions[0].priority").value(5))
                .andExpect(jsonPath("$.sessions[0].mode").value("deep"))
                .andExpect(jsonPath("$.sessions[1].total_checkpoints").value(7));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<BatchEntry>> entries = ArgumentCaptor.forClass(List.class);
        verify(batchStarter).start(entries.capture());
        assertEquals(3, entries.getValue().size());
        assertEquals(5, entries.getValue().get(1).effectivePriority());
        assertEquals(BatchEntry.DEFAULT_PRIORITY, entries.getValue().get(0).effectivePriority());
        assertEquals("Ox", entries.getValue().get(2).input().get("name"));
    }

    @Test
    @DisplayName("POST /sessions/batch with an invalid entry returns 400")
    void startBatchInvalid() throws Exception {
        when(batchStarter.start(anyList()))
                .thenThrow(new IllegalArgumentException("Invalid priority 9; expected 1 to 5"));

        mockMvc.perform(post("/api/v1/sessions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessions\":[{\"priority\":9}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error", containsString("priority")));
    }

    @Test
    @DisplayName("POST /sessions/batch without a body hands an empty batch to the starter")
    void startBatchWithoutBody() throws Exception {
        when(batchStarter.start(List.of()))
                .thenThrow(new IllegalArgumentException("A batch needs at least one session"));

        mockMvc.perform(post("/api/v1/sessions/batch"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("at least one")));
    }

    // ── Status and inspection ────────────────────────────────────────

    @Test
    @DisplayName("GET /status returns position and progress in snake_case")
    void getStatus() throws Exception {
        when(sessionService.status(ID)).thenReturn(session(2));

        mockMvc.perform(get("/api/v1/sessions/{id}/status", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(ID))
                .andExpect(jsonPath("$.status").value("in_progress"))
                .andExpect(jsonPath("$.current_wave").value(1))
                .andExpect(jsonPath("$.current_checkpoint").value(3))
                .andExpect(jsonPath("$.approved_through").value(2))
                .andExpect(jsonPath("$.progress.completed").value(2))
                .andExpect(jsonPath("$.progress.total").value(7));
    }

    @Test
    @DisplayName("GET /status of a failed session exposes error and failed_task")
    void getStatusFailed() throws Exception {
        when(sessionService.status(ID)).thenReturn(session(2).failed("Task story_arc failed: boom", "story_arc"));

        mockMvc.perform(get("/api/v1/sessions/{id}/status", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.failed_task").value("story_arc"))
                .andExpect(jsonPath("$.error", containsString("boom")));
    }

    @Test
    @DisplayName("GET /status of an unknown session returns 404 SESSION_NOT_FOUND")
    void getStatusUnknown() throws Exception {
        when(sessionService.status("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/sessions/{id}/status", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /sessions lists stored sessions")
    void listSessions() throws Exception {
        when(sessionService.listSessions()).thenReturn(List.of(session(0), session(3)));

        mockMvc.perform(get("/api/v1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].approved_through").value(3));
    }

    @Test
    @DisplayName("GET /checkpoints/{n} returns the checkpoint without an approved flag")
    void getCheckpoint() throws Exception {
        when(sessionService.getCheckpoint(ID, 1)).thenReturn(checkpoint(1, CheckpointStatus.AWAITING_APPROVAL));

        mockMvc.perform(get("/api/v1/sessions/{id}/checkpoints/{n}", ID, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.number").value(1))
                .andExpect(jsonPath("$.task_name").value("personality"))
                .andExpect(jsonPath("$.status").value("awaiting_approval"))
                .andExpect(jsonPath("$.output.narrative").value("Mira is curious."))
                .andExpect(jsonPath("$.approved").doesNotExist());
    }

    @Test
    @DisplayName("GET /checkpoints/{n} before it exists returns 404 CHECKPOINT_NOT_FOUND")
    void getCheckpointMissing() throws Exception {
        when(sessionService.getCheckpoint(ID, 5)).thenThrow(new CheckpointNotFoundException(ID, 5));

        mockMvc.perform(get("/api/v1/sessions/{id}/checkpoints/{n}", ID, 5))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CHECKPOINT_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /checkpoints lists all checkpoints")
    void listCheckpoints() throws Exception {
        when(sessionService.listCheckpoints(ID)).thenReturn(List.of(
                checkpoint(1, CheckpointStatus.APPROVED), checkpoint(2, CheckpointStatus.AWAITING_APPROVAL)));

        mockMvc.perform(get("/api/v1/sessions/{id}/checkpoints", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].status").value("approved"));
    }

    @Test
    @DisplayName("GET /context returns the shared context entries")
    void getContext() throws Exception {
        when(sessionService.context(ID)).thenReturn(
                SharedContext.empty().with("personality", Map.of("core_traits", List.of("curious"))));

        mockMvc.perform(get("/api/v1/sessions/{id}/context", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.personality.core_traits[0]").value("curious"));
    }

    @Test
    @DisplayName("GET /result before completion returns 404 RESULT_NOT_AVAILABLE")
    void resultNotAvailable() throws Exception {
        when(sessionService.getTerminalArtifact(ID))
                .thenThrow(new ResultNotAvailableException(ID, SessionStatus.IN_PROGRESS));

        mockMvc.perform(get("/api/v1/sessions/{id}/result", ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("RESULT_NOT_AVAILABLE"));
    }

    @Test
    @DisplayName("GET /result of a completed session returns the artifact")
    void result() throws Exception {
        when(sessionService.getTerminalArtifact(ID)).thenReturn(new TerminalArtifact(ID,
                "Character profile of Mira", Map.of("name", "Mira"), Instant.parse("2026-01-01T00:10:00Z")));

        mockMvc.perform(get("/api/v1/sessions/{id}/result", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(ID))
                .andExpect(jsonPath("$.content.name").value("Mira"));
    }

    // ── Approve / reject ─────────────────────────────────────────────

    @Test
    @DisplayName("POST /approve returns the next checkpoint to look at")
    void approve() throws Exception {
        when(sessionService.approve(ID, 1))
                .thenReturn(new Decision(session(1), checkpoint(1, CheckpointStatus.APPROVED), false));

        mockMvc.perform(post("/api/v1/sessions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkpoint_number").value(1))
                .andExpect(jsonPath("$.next_checkpoint").value(2))
                .andExpect(jsonPath("$.status").value("continuing"))
                .andExpect(jsonPath("$.approved_through").value(1));
    }

    @Test
    @DisplayName("POST /approve without checkpoint_number returns 400")
    void approveMissingNumber() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("checkpoint_number")));

        verify(sessionService, never()).approve(anyString(), anyInt());
    }

    @Test
    @DisplayName("POST /approve out of order returns 409 OUT_OF_ORDER_APPROVAL")
    void approveOutOfOrder() throws Exception {
        when(sessionService.approve(ID, 3)).thenThrow(new OutOfOrderApprovalException(ID, 3, 2));

        mockMvc.perform(post("/api/v1/sessions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("OUT_OF_ORDER_APPROVAL"));
    }

    @Test
    @DisplayName("POST /approve on a finished session returns 409 SESSION_NOT_ACTIVE")
    void approveNotActive() throws Exception {
        when(sessionService.approve(ID, 3))
                .thenThrow(new SessionNotActiveException(ID, SessionStatus.FAILED, "boom"));

        mockMvc.perform(post("/api/v1/sessions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_ACTIVE"));
    }

    @Test
    @DisplayName("POST /approve while the checkpoint regenerates returns 409 CHECKPOINT_BUSY")
    void approveWhileRegenerating() throws Exception {
        when(sessionService.approve(ID, 1))
                .thenThrow(new CheckpointStateException(ID, 1, CheckpointStatus.REJECTED));

        mockMvc.perform(post("/api/v1/sessions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CHECKPOINT_BUSY"));
    }

    @Test
    @DisplayName("POST /reject reports regenerating with the same checkpoint next")
    void rejectRegenerating() throws Exception {
        Checkpoint rejected = checkpoint(1, CheckpointStatus.REJECTED).withFeedback("too generic",
                CheckpointStatus.REJECTED);
        when(sessionService.reject(ID, 1, "too generic"))
                .thenReturn(new Decision(session(0).withRegeneration(), rejected, true));

        mockMvc.perform(post("/api/v1/sessions/{id}/reject", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":1,\"feedback\":\"too generic\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("regenerating"))
                .andExpect(jsonPath("$.next_checkpoint").value(1))
                .andExpect(jsonPath("$.regenerations").value(1));
    }

    @Test
    @DisplayName("POST /reject under pass-through continues to the next checkpoint")
    void rejectPassThrough() throws Exception {
        Checkpoint passed = checkpoint(1, CheckpointStatus.APPROVED);
        when(sessionService.reject(ID, 1, "too generic"))
                .thenReturn(new Decision(session(1).withRegeneration(), passed, false));

        mockMvc.perform(post("/api/v1/sessions/{id}/reject", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":1,\"feedback\":\"too generic\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("continuing"))
                .andExpect(jsonPath("$.next_checkpoint").value(2));
    }

    @Test
    @DisplayName("POST /reject without feedback returns 400")
    void rejectWithoutFeedback() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/{id}/reject", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkpoint_number\":1,\"feedback\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("feedback")));

        verify(sessionService, never()).reject(anyString(), anyInt(), anyString());
    }

    // ── Events ───────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /events opens an SSE stream for a known session")
    void streamEvents() throws Exception {
        when(sessionService.status(ID)).thenReturn(session(0));
        when(sseStreamingService.createEmitter(ID)).thenReturn(new SseEmitter(60_000L));

        mockMvc.perform(get("/api/v1/sessions/{id}/events", ID).accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
    }

    @Test
    @DisplayName("GET /events for an unknown session returns 404 without opening a stream")
    void streamEventsUnknown() throws Exception {
        when(sessionService.status("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/sessions/{id}/events", "missing"))
                .andExpect(status().isNotFound());

        verify(sseStreamingService, never()).createEmitter(any());
    }
}
