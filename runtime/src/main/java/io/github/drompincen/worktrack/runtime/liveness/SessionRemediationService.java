package io.github.drompincen.worktrack.runtime.liveness;

import io.github.drompincen.worktrack.persistence.document.MemberPresenceDocument;
import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.repository.MemberPresenceRepository;
import io.github.drompincen.worktrack.persistence.repository.WorkSessionRepository;
import io.github.drompincen.worktrack.protocol.api.AgentResponse;
import io.github.drompincen.worktrack.protocol.api.CheckInRequest;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.runtime.session.SessionDurations;
import io.github.drompincen.worktrack.runtime.timer.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Remediation for a stale desktop session: reconnect to the agent or force the session closed.
 */
public class SessionRemediationService {

    private static final Logger log = LoggerFactory.getLogger(SessionRemediationService.class);

    public static final String FORCE_CLOSE_REPORT =
            "[Auto] Desktop app became unresponsive, session closed from browser";
    public static final String FORCE_CLOSE_REASON = "heartbeat stopped";
    public static final String REFRESH_TIMER = "credential-refresh";
    public static final Duration REFRESH_INTERVAL = Duration.ofMinutes(50);
    static final int FORCE_CLOSE_ATTEMPTS = 3;

    private final WorkSessionRepository sessionRepository;
    private final MemberPresenceRepository presenceRepository;
    private final AgentControlClient agentClient;
    private final LaunchHandshake handshake;
    private final TimerService timers;
    private final Clock clock;

    public SessionRemediationService(WorkSessionRepository sessionRepository,
                                     MemberPresenceRepository presenceRepository,
                                     AgentControlClient agentClient,
                                     LaunchHandshake handshake,
                                     TimerService timers,
                                     Clock clock) {
        this.sessionRepository = sessionRepository;
        this.presenceRepository = presenceRepository;
        this.agentClient = agentClient;
        this.handshake = handshake;
        this.timers = timers;
        this.clock = clock;
    }

    /**
     * Probe the agent and re-send credentials; when it does not answer, fall back to the
     * launch link. Never more than those two hops.
     */
    public ReconnectOutcome reconnect(LaunchRequest member) {
        if (agentClient.probe()) {
            AgentResponse response = agentClient.checkIn(
                    new CheckInRequest(member.credential(), member.userId(), member.name()));
            if (response.ok()) {
                log.info("Reconnected desktop agent for {}", member.userId());
                return ReconnectOutcome.RECONNECTED;
            }
            log.warn("Agent answered but refused check-in for {}: {}", member.userId(), response.error());
        }
        if (handshake.send(member)) {
            log.info("Agent unreachable for {}, launch link sent", member.userId());
            return ReconnectOutcome.HANDSHAKE_SENT;
        }
        log.warn("Reconnect failed for {}", member.userId());
        return ReconnectOutcome.FAILED;
    }

    /**
     * Closes the session as flagged. Durations come from whatever break data the document
     * holds, the open break counted up to now. Already completed sessions are returned as-is.
     * A concurrent write by the owning agent re-reads the session and tries again.
     */
    public Optional<WorkSessionDocument> forceClose(String sessionId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return tryForceClose(sessionId);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= FORCE_CLOSE_ATTEMPTS) throw e;
                log.info("Session {} changed during force close, retrying ({}/{})",
                        sessionId, attempt, FORCE_CLOSE_ATTEMPTS);
            }
        }
    }

    private Optional<WorkSessionDocument> tryForceClose(String sessionId) {
        Optional<WorkSessionDocument> found = sessionRepository.findById(sessionId);
        if (found.isEmpty()) return Optional.empty();
        WorkSessionDocument session = found.get();
        if (session.getStatus() == SessionStatus.COMPLETED) {
            log.info("Force close of {} ignored, already completed", sessionId);
            return found;
        }

        Instant now = clock.instant();
        long breakSeconds = SessionDurations.breakSecondsUntil(session.getBreaks(), now);
        var open = SessionDurations.openBreak(session.getBreaks());
        if (open != null) {
            SessionDurations.closeBreak(open, now);
        }
        Instant checkIn = session.getCheckInTime() != null ? session.getCheckInTime() : now;
        SessionDurations.Totals totals = SessionDurations.totals(checkIn, now, breakSeconds);

        session.setStatus(SessionStatus.COMPLETED);
        session.setCheckOutTime(now);
        session.setDurationMinutes(totals.durationMinutes());
        session.setBreakDurationMinutes(totals.breakDurationMinutes());
        session.setReport(FORCE_CLOSE_REPORT);
        session.setAttachments(List.of());
        session.setFlagged(true);
        session.setFlagReason(FORCE_CLOSE_REASON);
        session.setOpenFor(null);
        session.setUpdatedAt(now);
        WorkSessionDocument saved = sessionRepository.save(session);

        try {
            presenceRepository.save(new MemberPresenceDocument(saved.getUserId(), false, now));
        } catch (Exception e) {
            log.warn("Presence update after force close of {} failed: {}", sessionId, e.getMessage());
        }
        log.warn("Force closed session {} of {} after heartbeat loss ({} min)",
                sessionId, saved.getUserId(), totals.durationMinutes());
        return Optional.of(saved);
    }

    /** Re-sends a fresh credential to the agent every 50 minutes while a desktop session is live. */
    public void startCredentialRefresh(Supplier<String> credential) {
        timers.scheduleRepeating(REFRESH_TIMER, REFRESH_INTERVAL, REFRESH_INTERVAL, () -> {
            AgentResponse response = agentClient.refresh(credential.get());
            if (!response.ok()) {
                log.warn("Credential refresh rejected: {}", response.error());
            }
        });
    }

    public void stopCredentialRefresh() {
        timers.cancel(REFRESH_TIMER);
    }
}
