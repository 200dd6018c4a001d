package io.github.drompincen.worktrack.agent.controller;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.protocol.api.AgentResponse;
import io.github.drompincen.worktrack.protocol.api.AgentStatusResponse;
import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.CheckInRequest;
import io.github.drompincen.worktrack.protocol.api.CheckOutRequest;
import io.github.drompincen.worktrack.protocol.api.RefreshRequest;
import io.github.drompincen.worktrack.runtime.capture.CaptureOrchestrator;
import io.github.drompincen.worktrack.runtime.capture.CaptureOutcome;
import io.github.drompincen.worktrack.runtime.session.CheckInResult;
import io.github.drompincen.worktrack.runtime.session.MemberIdentity;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleService;
import io.github.drompincen.worktrack.runtime.session.SessionState;
import io.github.drompincen.worktrack.runtime.session.SessionTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

/**
 * Loopback control surface of the desktop agent. Every command answers with
 * {@link AgentResponse}; failures carry the reason in {@code error}.
 */
@RestController
public class LocalControlController {

    private static final Logger log = LoggerFactory.getLogger(LocalControlController.class);

    private final SessionLifecycleService sessions;
    private final CaptureOrchestrator orchestrator;
    private final String version;

    public LocalControlController(SessionLifecycleService sessions,
                                  CaptureOrchestrator orchestrator,
                                  @Value("${worktrack.agent.version:1.0.0}") String version) {
        this.sessions = sessions;
        this.orchestrator = orchestrator;
        this.version = version;
    }

    @GetMapping("/status")
    public AgentStatusResponse status() {
        String sessionId = sessions.currentSession().map(WorkSessionDocument::getId).orElse(null);
        boolean hasCredential = sessions.identity()
                .map(m -> m.credential() != null && !m.credential().isBlank())
                .orElse(false);
        return new AgentStatusResponse(true, version, System.getProperty("os.name"), hasCredential,
                sessionId, sessions.getState() == SessionState.ON_BREAK,
                orchestrator.getCaptureCount(), orchestrator.isCaptureInProgress());
    }

    @PostMapping("/checkin")
    public ResponseEntity<AgentResponse> checkIn(@RequestBody CheckInRequest req) {
        if (req == null || isBlank(req.credential()) || isBlank(req.userId())) {
            return ResponseEntity.badRequest().body(AgentResponse.failure("credential and userId are required"));
        }
        sessions.signIn(new MemberIdentity(req.userId(), req.name(), req.credential()));
        CheckInResult result = sessions.resumeOrCheckIn();
        return ResponseEntity.ok(AgentResponse.success(result.session().getId(), result.resumed()));
    }

    @PostMapping("/checkout")
    public ResponseEntity<AgentResponse> checkOut(@RequestBody CheckOutRequest req) {
        if (req == null || isBlank(req.report())) {
            return ResponseEntity.badRequest().body(AgentResponse.failure("Report is required"));
        }
        WorkSessionDocument closed = sessions.checkOut(req.report().trim(), req.proofLink());
        return ResponseEntity.ok(AgentResponse.success(closed.getId(), false));
    }

    @PostMapping("/break")
    public ResponseEntity<AgentResponse> startBreak() {
        return ResponseEntity.ok(AgentResponse.success(sessions.startBreak().getId(), false));
    }

    @PostMapping("/resume")
    public ResponseEntity<AgentResponse> resumeWork() {
        return ResponseEntity.ok(AgentResponse.success(sessions.resumeWork().getId(), false));
    }

    @PostMapping("/refresh")
    public ResponseEntity<AgentResponse> refresh(@RequestBody RefreshRequest req) {
        if (req == null || isBlank(req.credential())) {
            return ResponseEntity.badRequest().body(AgentResponse.failure("credential is required"));
        }
        sessions.refreshCredential(req.credential());
        return ResponseEntity.ok(AgentResponse.success());
    }

    @PostMapping("/capture")
    public ResponseEntity<AgentResponse> capture() {
        CompletableFuture<CaptureOutcome> pending = orchestrator.performCapture(CaptureType.MANUAL);
        if (pending.isDone() && !pending.isCompletedExceptionally()) {
            CaptureOutcome outcome = pending.join();
            if (outcome.skipped()) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(AgentResponse.failure(outcome.skipReason()));
            }
        }
        return ResponseEntity.accepted().body(AgentResponse.success());
    }

    @ExceptionHandler(SessionTransitionException.class)
    public ResponseEntity<AgentResponse> transitionFailed(SessionTransitionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(AgentResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<AgentResponse> notSignedIn(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(AgentResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<AgentResponse> failed(Exception e) {
        log.error("Control command failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(AgentResponse.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
