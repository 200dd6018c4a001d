package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.event.CaptureSignal;
import io.github.drompincen.worktrack.protocol.event.CaptureSignalType;
import io.github.drompincen.worktrack.runtime.session.MemberIdentity;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleService;
import io.github.drompincen.worktrack.runtime.session.SessionState;
import io.github.drompincen.worktrack.runtime.timer.ManualTimerService;
import io.github.drompincen.worktrack.runtime.timer.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CaptureOrchestratorTest {

    private static final Instant START = Instant.parse("2026-01-05T09:00:00Z");
    private static final MemberIdentity ANA = new MemberIdentity("u1", "Ana", "cred");
    private static final CaptureOutcome RECORDED =
            new CaptureOutcome(false, null, CaptureType.AUTO, "s", "c", false, null, false, "log-1");

    @Mock private CapturePipeline pipeline;
    @Mock private RemoteCommandPoller poller;
    @Mock private SessionLifecycleService sessions;

    private MutableClock clock;
    private ManualTimerService timers;
    private AutoCaptureScheduler autoScheduler;
    private ExecutorService executor;
    private CaptureOrchestrator orchestrator;
    private final List<CaptureSignal> signals = new CopyOnWriteArrayList<>();
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        timers = new ManualTimerService(clock);
        autoScheduler = new AutoCaptureScheduler(timers, CaptureSettings.defaults(), new Random(3), clock);
        executor = Executors.newSingleThreadExecutor();
        CaptureSignalPublisher publisher = new CaptureSignalPublisher();
        publisher.addListener(signals::add);
        orchestrator = new CaptureOrchestrator(pipeline, autoScheduler, poller, sessions, publisher, clock, executor);

        when(sessions.getState()).thenReturn(SessionState.ACTIVE);
        when(sessions.identity()).thenReturn(Optional.of(ANA));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private void blockPipeline() throws Exception {
        when(pipeline.run(any(), eq(ANA))).thenAnswer(inv -> {
            entered.countDown();
            release.await();
            return RECORDED;
        });
    }

    @Test
    void secondCaptureIsSkippedWhileFirstRuns() throws Exception {
        blockPipeline();
        CompletableFuture<CaptureOutcome> first = orchestrator.performCapture(CaptureType.MANUAL);
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        CaptureOutcome second = orchestrator.performCapture(CaptureType.REMOTE).get(1, TimeUnit.SECONDS);

        assertThat(second.skipped()).isTrue();
        assertThat(orchestrator.isCaptureInProgress()).isTrue();
        verify(pipeline, times(1)).run(any(), any());

        release.countDown();
        assertThat(first.get(2, TimeUnit.SECONDS).skipped()).isFalse();
        assertThat(orchestrator.getCaptureCount()).isEqualTo(1);
    }

    @Test
    void completedAttemptReleasesLockAndReschedulesFromFinishTime() throws Exception {
        when(pipeline.run(any(), any())).thenReturn(RECORDED);
        orchestrator.start();

        orchestrator.performCapture(CaptureType.MANUAL).get(2, TimeUnit.SECONDS);
        executor.submit(() -> {}).get(2, TimeUnit.SECONDS);

        assertThat(orchestrator.isCaptureInProgress()).isFalse();
        Instant next = autoScheduler.nextFireTime().orElseThrow();
        assertThat(next).isBetween(START.plusSeconds(120), START.plusSeconds(120).plus(Duration.ofMinutes(30)));
        assertThat(signals).extracting(CaptureSignal::type).contains(CaptureSignalType.COUNTDOWN_DONE);
    }

    @Test
    void autoFireWithLockHeldDefersByCooldown() throws Exception {
        blockPipeline();
        orchestrator.start();
        Instant firstFire = autoScheduler.nextFireTime().orElseThrow();
        orchestrator.performCapture(CaptureType.REMOTE);
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        timers.advance(Duration.between(clock.instant(), firstFire));

        assertThat(autoScheduler.nextFireTime()).contains(firstFire.plus(Duration.ofMinutes(2)));
        verify(pipeline, times(1)).run(any(), any());
    }

    @Test
    void captureRefusedWithoutActiveSession() throws Exception {
        when(sessions.getState()).thenReturn(SessionState.ON_BREAK);

        CaptureOutcome outcome = orchestrator.performCapture(CaptureType.MANUAL).get(1, TimeUnit.SECONDS);

        assertThat(outcome.skipped()).isTrue();
        assertThat(outcome.skipReason()).isEqualTo("no active session");
        verifyNoInteractions(pipeline);
    }

    @Test
    void stopTearsDownInFlightCaptureAndIsIdempotent() throws Exception {
        blockPipeline();
        orchestrator.start();
        CompletableFuture<CaptureOutcome> inFlight = orchestrator.performCapture(CaptureType.MANUAL);
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        orchestrator.stop();
        orchestrator.stop();

        assertThat(orchestrator.isCaptureInProgress()).isFalse();
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(timers.isScheduled(AutoCaptureScheduler.TIMER)).isFalse();
        assertThat(inFlight).isCompletedExceptionally();
        assertThat(signals).extracting(CaptureSignal::type).contains(CaptureSignalType.COUNTDOWN_DONE);
        verify(poller, atLeastOnce()).stop();
    }

    @Test
    void lifecycleStartsAndStopsTracking() {
        orchestrator.onSessionStateChanged(SessionState.ACTIVE, null);
        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(timers.isScheduled(AutoCaptureScheduler.TIMER)).isTrue();
        verify(poller).start(any(), any(), any());

        orchestrator.onSessionStateChanged(SessionState.ON_BREAK, null);
        assertThat(orchestrator.isRunning()).isTrue();

        orchestrator.onSessionStateChanged(SessionState.COMPLETED, null);
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(timers.isScheduled(AutoCaptureScheduler.TIMER)).isFalse();
    }
}
