package io.github.drompincen.worktrack.runtime.liveness;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.protocol.api.LivenessDto;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.runtime.timer.ManualTimerService;
import io.github.drompincen.worktrack.runtime.timer.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeartbeatMonitorTest {

    private static final Instant NINE = Instant.parse("2026-01-05T09:00:00Z");

    private MutableClock clock;
    private ManualTimerService timers;
    private HeartbeatMonitor monitor;
    private final List<LivenessDto> published = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NINE);
        timers = new ManualTimerService(clock);
        monitor = new HeartbeatMonitor(timers, clock, HeartbeatMonitor.DEFAULT_STALE_AFTER, HeartbeatMonitor.DEFAULT_POLL);
        monitor.addListener((userId, liveness) -> published.add(liveness));
    }

    private static WorkSessionDocument desktop(Instant lastHeartbeat) {
        WorkSessionDocument doc = new WorkSessionDocument();
        doc.setId("w1");
        doc.setUserId("u1");
        doc.setStatus(SessionStatus.ACTIVE);
        doc.setSource(SessionSource.DESKTOP);
        doc.setCheckInTime(NINE);
        doc.setLastHeartbeat(lastHeartbeat);
        return doc;
    }

    @Test
    void staleOnlyStrictlyAfterHundredTwentySeconds() {
        WorkSessionDocument session = desktop(NINE);

        clock.set(NINE.plusSeconds(120));
        assertThat(monitor.evaluate(session).stale()).isFalse();

        clock.set(NINE.plusSeconds(121));
        LivenessDto liveness = monitor.evaluate(session);
        assertThat(liveness.stale()).isTrue();
        assertThat(liveness.ageSeconds()).isEqualTo(121);
    }

    @Test
    void missingHeartbeatFallsBackToCheckInTime() {
        WorkSessionDocument session = desktop(null);

        clock.set(NINE.plusSeconds(119));
        assertThat(monitor.evaluate(session).stale()).isFalse();
        clock.set(NINE.plusSeconds(300));
        assertThat(monitor.evaluate(session).stale()).isTrue();
    }

    @Test
    void browserSessionsAreNeverStale() {
        WorkSessionDocument session = desktop(null);
        session.setSource(SessionSource.BROWSER);
        clock.set(NINE.plus(Duration.ofHours(3)));

        assertThat(monitor.evaluate(session).stale()).isFalse();
    }

    @Test
    void pollDetectsStalenessWithoutNewChanges() {
        monitor.start();
        monitor.onSessionChanged(desktop(NINE));
        assertThat(published).hasSize(1);
        assertThat(published.get(0).stale()).isFalse();

        timers.advance(Duration.ofSeconds(90));
        assertThat(published).hasSize(1);

        timers.advance(Duration.ofSeconds(60));
        assertThat(published).hasSize(2);
        assertThat(published.get(1).stale()).isTrue();
    }

    @Test
    void freshHeartbeatClearsStaleAndCompletionStopsWatching() {
        clock.set(NINE.plusSeconds(200));
        monitor.onSessionChanged(desktop(NINE));
        assertThat(published.get(0).stale()).isTrue();

        monitor.onSessionChanged(desktop(NINE.plusSeconds(195)));
        assertThat(published.get(1).stale()).isFalse();

        WorkSessionDocument closed = desktop(NINE.plusSeconds(195));
        closed.setStatus(SessionStatus.COMPLETED);
        monitor.onSessionChanged(closed);
        assertThat(monitor.watchedSessions()).isEmpty();
        assertThat(monitor.liveness("w1")).isEmpty();
    }
}
