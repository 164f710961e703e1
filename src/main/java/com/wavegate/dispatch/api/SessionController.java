package com.wavegate.dispatch.api;

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
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;
import com.wavegate.core.persistence.SessionNotFoundException;
import com.wavegate.core.persistence.StoreException;
import com.wavegate.core.plan.UnknownPlanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the session lifecycle: start, inspect, approve, reject.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionService sessionService;
    private final BatchStarter batchStarter;
    private final SseStreamingService sseStreamingService;

    public SessionController(SessionService sessionService, BatchStarter batchStarter,
                             SseStreamingService sseStreamingService) {
        this.sessionService = sessionService;
        this.batchStarter = batchStarter;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/sessions: Start a new session. Wave 1 runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> startSession(@RequestBody(required = false) SessionRequest request) {
        SessionRequest body = request != null ? request : new SessionRequest(null, null, null);
        Session session = sessionService.start(body.plan(), body.mode(), body.input());
        log.info("Accepted session {} ({}, {})", session.id(), session.plan(), session.mode().wireName());

        var response = new LinkedHashMap<String, Object>();
        response.put("session_id", session.id());
        response.put("status", "wave_1_started");
        response.put("plan", session.plan());
        response.put("mode", session.mode().wireName());
        response.put("total_checkpoints", session.totalCheckpoints());
        return ResponseEntity.accepted().body(response);
    }

    /**
     * POST /api/v1/sessions/batch: Start several sessions, highest priority first. Entries with
     * priority 4 or 5 always start, a configured number of priority-3 entries start, lower
     * priorities are skipped.
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> startBatch(@RequestBody(required = false) BatchSessionRequest request) {
        BatchResult result = batchStarter.start(request == null ? List.of() : request.toEntries());

        var started = result.started().stream().map(s -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("session_id", s.session().id());
            entry.put("plan", s.session().plan());
            entry.put("mode", s.session().mode().wireName());
            entry.put("priority", s.priority());
            entry.put("total_checkpoints", s.session().totalCheckpoints());
            return entry;
        }).toList();

        var response = new LinkedHashMap<String, Object>();
        response.put("sessions", started);
        response.put("total_selected", started.size());
        response.put("total_submitted", result.submitted());
        response.put("status", "batch_started");
        return ResponseEntity.accepted().body(response);
    }

    /**
     * GET /api/v1/sessions: List stored sessions, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions() {
        return ResponseEntity.ok(sessionService.listSessions().stream().map(SessionResponse::from).toList());
    }

    /**
     * GET /api/v1/sessions/{id}/status: Position, status and progress of a session.
     */
    @GetMapping("/{id}/status")
    public ResponseEntity<SessionResponse> getStatus(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.status(id)));
    }

    /**
     * GET /api/v1/sessions/{id}/checkpoints: All checkpoints created so far.
     */
    @GetMapping("/{id}/checkpoints")
    public ResponseEntity<List<Checkpoint>> listCheckpoints(@PathVariable String id) {
        return ResponseEntity.ok(sessionService.listCheckpoints(id));
    }

    /**
     * GET /api/v1/sessions/{id}/checkpoints/{n}: One checkpoint; 404 until it is created.
     */
    @GetMapping("/{id}/checkpoints/{number}")
    public ResponseEntity<Checkpoint> getCheckpoint(@PathVariable String id, @PathVariable int number) {
        return ResponseEntity.ok(sessionService.getCheckpoint(id, number));
    }

    /**
     * POST /api/v1/sessions/{id}/approve: Approve the next checkpoint.
     */
    @PostMapping("/{id}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable String id, @RequestBody DecisionRequest request) {
        if (request == null || request.checkpointNumber() == null) {
            return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "checkpoint_number is required");
        }
        Decision decision = sessionService.approve(id, request.checkpointNumber());
        return ResponseEntity.ok(decisionBody(decision, "continuing"));
    }

    /**
     * POST /api/v1/sessions/{id}/reject: Reject the next checkpoint with feedback.
     */
    @PostMapping("/{id}/reject")
    public ResponseEntity<Map<String, Object>> reject(@PathVariable String id, @RequestBody DecisionRequest request) {
        if (request == null || request.checkpointNumber() == null) {
            return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "checkpoint_number is required");
        }
        if (request.feedback() == null || request.feedback().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "feedback is required");
        }
        Decision decision = sessionService.reject(id, request.checkpointNumber(), request.feedback());
        return ResponseEntity.ok(decisionBody(decision, decision.regenerating() ? "regenerating" : "continuing"));
    }

    /**
     * GET /api/v1/sessions/{id}/result: Terminal artifact; 404 until the session completed.
     */
    @GetMapping("/{id}/result")
    public ResponseEntity<TerminalArtifact> getResult(@PathVariable String id) {
        return ResponseEntity.ok(sessionService.getTerminalArtifact(id));
    }

    /**
     * GET /api/v1/sessions/{id}/context: Current shared context.
     */
    @GetMapping("/{id}/context")
    public ResponseEntity<SharedContext> getContext(@PathVariable String id) {
        return ResponseEntity.ok(sessionService.context(id));
    }

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of session events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        sessionService.status(id);
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    // ── Error mapping ────────────────────────────────────────────────────

    @ExceptionHandler({SessionNotFoundException.class, CheckpointNotFoundException.class})
    ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        String code = e instanceof SessionNotFoundException ? "SESSION_NOT_FOUND" : "CHECKPOINT_NOT_FOUND";
        return error(HttpStatus.NOT_FOUND, code, e.getMessage());
    }

    @ExceptionHandler(ResultNotAvailableException.class)
    ResponseEntity<Map<String, Object>> resultNotAvailable(ResultNotAvailableException e) {
        return error(HttpStatus.NOT_FOUND, "RESULT_NOT_AVAILABLE", e.getMessage());
    }

    @ExceptionHandler(OutOfOrderApprovalException.class)
    ResponseEntity<Map<String, Object>> outOfOrder(OutOfOrderApprovalException e) {
        return error(HttpStatus.CONFLICT, "OUT_OF_ORDER_APPROVAL", e.getMessage());
    }

    @ExceptionHandler(SessionNotActiveException.class)
    ResponseEntity<Map<String, Object>> notActive(SessionNotActiveException e) {
        return error(HttpStatus.CONFLICT, "SESSION_NOT_ACTIVE", e.getMessage());
    }

    @ExceptionHandler(CheckpointStateException.class)
    ResponseEntity<Map<String, Object>> checkpointBusy(CheckpointStateException e) {
        return error(HttpStatus.CONFLICT, "CHECKPOINT_BUSY", e.getMessage());
    }

    @ExceptionHandler({UnknownPlanException.class, IllegalArgumentException.class})
    ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    ResponseEntity<Map<String, Object>> storeFailure(StoreException e) {
        log.error("Store failure: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR", e.getMessage());
    }

    private static Map<String, Object> decisionBody(Decision decision, String status) {
        var body = new LinkedHashMap<String, Object>();
        body.put("checkpoint_number", decision.checkpoint().number());
        body.put("next_checkpoint", decision.nextCheckpoint());
        body.put("status", status);
        body.put("approved_through", decision.session().approvedThrough());
        body.put("regenerations", decision.session().regenerations());
        return body;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
