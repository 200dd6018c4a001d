package io.github.drompincen.worktrack.gateway.controller;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.repository.WorkSessionRepository;
import io.github.drompincen.worktrack.protocol.api.BreakDto;
import io.github.drompincen.worktrack.protocol.api.OpenSessionView;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.protocol.api.WorkSessionDto;
import io.github.drompincen.worktrack.runtime.liveness.HeartbeatMonitor;
import io.github.drompincen.worktrack.runtime.liveness.LaunchRequest;
import io.github.drompincen.worktrack.runtime.liveness.ReconnectOutcome;
import io.github.drompincen.worktrack.runtime.liveness.SessionRemediationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/work-sessions")
public class WorkSessionController {

    private final WorkSessionRepository sessionRepository;
    private final HeartbeatMonitor heartbeatMonitor;
    private final SessionRemediationService remediation;

    public WorkSessionController(WorkSessionRepository sessionRepository,
                                 HeartbeatMonitor heartbeatMonitor,
                                 SessionRemediationService remediation) {
        this.sessionRepository = sessionRepository;
        this.heartbeatMonitor = heartbeatMonitor;
        this.remediation = remediation;
    }

    @GetMapping
    public List<WorkSessionDto> list(@RequestParam String userId) {
        return sessionRepository.findByUserIdOrderByCheckInTimeDesc(userId).stream()
                .map(WorkSessionController::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return sessionRepository.findById(id)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/open")
    public ResponseEntity<?> open(@RequestParam String userId) {
        return sessionRepository.findFirstByUserIdAndStatusInOrderByCheckInTimeDesc(userId,
                        EnumSet.of(SessionStatus.ACTIVE, SessionStatus.BREAK))
                .map(d -> ResponseEntity.ok(new OpenSessionView(toDto(d), heartbeatMonitor.evaluate(d))))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/force-close")
    public ResponseEntity<?> forceClose(@PathVariable String id) {
        return remediation.forceClose(id)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/reconnect")
    public ResponseEntity<?> reconnect(@PathVariable String id, @RequestBody LaunchRequest member) {
        if (sessionRepository.findById(id).isEmpty()) return ResponseEntity.notFound().build();
        if (member.credential() == null || member.credential().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "credential is required"));
        }
        ReconnectOutcome outcome = remediation.reconnect(member);
        return ResponseEntity.ok(Map.of("outcome", outcome.name()));
    }

    public static WorkSessionDto toDto(WorkSessionDocument d) {
        List<BreakDto> breaks = d.getBreaks().stream()
                .map(b -> new BreakDto(b.getStartTime(), b.getEndTime(), b.getDurationMinutes()))
                .collect(Collectors.toList());
        return new WorkSessionDto(d.getId(), d.getUserId(), d.getUserDisplayName(), d.getCheckInTime(),
                d.getCheckOutTime(), d.getStatus(), d.getSource(), breaks, d.getLastHeartbeat(),
                d.getDurationMinutes(), d.getBreakDurationMinutes(), d.getReport(),
                d.getAttachments() != null ? d.getAttachments() : List.of(),
                d.isFlagged(), d.getFlagReason(), d.getUpdatedAt());
    }
}
