package io.github.drompincen.worktrack.runtime.liveness;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.stream.WorkSessionListener;
import io.github.drompincen.worktrack.protocol.api.LivenessDto;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.runtime.timer.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Classifies open sessions as live or stale from their heartbeat age.
 *
 * <p>Age is {@code now - lastHeartbeat}, or {@code now - checkInTime} when no beat was ever
 * written. A desktop session is stale once the age exceeds the threshold; browser sessions
 * have no heartbeat and are never stale. Sessions are re-evaluated on every change
 * notification and on a fixed poll, since the change stream itself can go quiet.
 */
public class HeartbeatMonitor implements WorkSessionListener {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);
    public static final String TIMER = "liveness-poll";
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofSeconds(120);
    public static final Duration DEFAULT_POLL = Duration.ofSeconds(30);

    private final TimerService timers;
    private final Clock clock;
    private final Duration staleAfter;
    private final Duration pollInterval;
    private final Map<String, WorkSessionDocument> watched = new ConcurrentHashMap<>();
    private final Map<String, Boolean> lastStale = new ConcurrentHashMap<>();
    private final List<LivenessListener> listeners = new CopyOnWriteArrayList<>();

    public HeartbeatMonitor(TimerService timers, Clock clock, Duration staleAfter, Duration pollInterval) {
        this.timers = timers;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.pollInterval = pollInterval;
    }

    public void addListener(LivenessListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LivenessListener listener) {
        listeners.remove(listener);
    }

    public void start() {
        timers.scheduleRepeating(TIMER, pollInterval, pollInterval, this::evaluateAll);
        log.info("Liveness poll every {}s, stale after {}s", pollInterval.toSeconds(), staleAfter.toSeconds());
    }

    public void stop() {
        timers.cancel(TIMER);
    }

    public void watch(WorkSessionDocument session) {
        onSessionChanged(session);
    }

    @Override
    public void onSessionChanged(WorkSessionDocument session) {
        if (session.getId() == null) return;
        if (session.getStatus() == null || !session.getStatus().isOpen()) {
            if (watched.remove(session.getId()) != null) {
                lastStale.remove(session.getId());
                publish(session, evaluate(session));
            }
            return;
        }
        watched.put(session.getId(), session);
        evaluateAndPublish(session);
    }

    public void evaluateAll() {
        for (WorkSessionDocument session : watched.values()) {
            evaluateAndPublish(session);
        }
    }

    public LivenessDto evaluate(WorkSessionDocument session) {
        Instant now = clock.instant();
        Instant reference = session.getLastHeartbeat() != null ? session.getLastHeartbeat() : session.getCheckInTime();
        long ageSeconds = reference == null ? 0 : Math.max(0, Duration.between(reference, now).getSeconds());
        boolean open = session.getStatus() != null && session.getStatus().isOpen();
        boolean stale = open && session.getSource() == SessionSource.DESKTOP
                && reference != null && Duration.between(reference, now).compareTo(staleAfter) > 0;
        return new LivenessDto(session.getId(), session.getSource(), stale, ageSeconds,
                session.getLastHeartbeat(), now);
    }

    public Optional<LivenessDto> liveness(String sessionId) {
        return Optional.ofNullable(watched.get(sessionId)).map(this::evaluate);
    }

    public List<WorkSessionDocument> watchedSessions() {
        return List.copyOf(watched.values());
    }

    private void evaluateAndPublish(WorkSessionDocument session) {
        LivenessDto liveness = evaluate(session);
        Boolean previous = lastStale.put(session.getId(), liveness.stale());
        if (previous == null || previous != liveness.stale()) {
            if (liveness.stale()) {
                log.warn("Session {} of {} is stale: no heartbeat for {}s",
                        session.getId(), session.getUserId(), liveness.ageSeconds());
            }
            publish(session, liveness);
        }
    }

    private void publish(WorkSessionDocument session, LivenessDto liveness) {
        for (LivenessListener listener : listeners) {
            try {
                listener.onLivenessChanged(session.getUserId(), liveness);
            } catch (Exception e) {
                log.error("Liveness listener failed for session {}", session.getId(), e);
            }
        }
    }
}
