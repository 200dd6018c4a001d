package io.github.drompincen.worktrack.runtime.liveness;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleListener;
import io.github.drompincen.worktrack.runtime.session.SessionState;
import io.github.drompincen.worktrack.runtime.timer.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Refreshes {@code lastHeartbeat} on the open desktop session. Only that field and
 * {@code updatedAt} are touched, so a beat never overwrites a concurrent checkout.
 */
public class HeartbeatPublisher implements SessionLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatPublisher.class);
    public static final String TIMER = "heartbeat";

    private final MongoTemplate mongoTemplate;
    private final TimerService timers;
    private final Duration interval;
    private final Clock clock;
    private volatile String sessionId;

    public HeartbeatPublisher(MongoTemplate mongoTemplate, TimerService timers, Duration interval, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.timers = timers;
        this.interval = interval;
        this.clock = clock;
    }

    @Override
    public void onSessionStateChanged(SessionState state, WorkSessionDocument session) {
        if (state.isOpen() && session != null && session.getSource() == SessionSource.DESKTOP) {
            if (!session.getId().equals(sessionId) || !timers.isScheduled(TIMER)) {
                sessionId = session.getId();
                timers.scheduleRepeating(TIMER, interval, interval, this::beat);
                log.info("Heartbeat every {}s for session {}", interval.toSeconds(), sessionId);
            }
        } else if (sessionId != null) {
            timers.cancel(TIMER);
            log.info("Heartbeat stopped for session {}", sessionId);
            sessionId = null;
        }
    }

    void beat() {
        String id = sessionId;
        if (id == null) return;
        Instant now = clock.instant();
        try {
            var result = mongoTemplate.updateFirst(
                    Query.query(Criteria.where("_id").is(id)
                            .and("status").in(List.of(SessionStatus.ACTIVE, SessionStatus.BREAK))),
                    // Leaves version alone so the owner's next save does not conflict with its own beat.
                    new Update().set("lastHeartbeat", now).set("updatedAt", now),
                    WorkSessionDocument.class);
            if (result.getMatchedCount() == 0) {
                log.warn("Heartbeat found no open session {}", id);
            } else {
                log.debug("Heartbeat written for session {}", id);
            }
        } catch (Exception e) {
            log.warn("Heartbeat failed for session {}: {}", id, e.getMessage());
        }
    }

    public String getSessionId() {
        return sessionId;
    }
}
