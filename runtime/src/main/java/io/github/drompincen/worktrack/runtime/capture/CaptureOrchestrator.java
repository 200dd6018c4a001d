package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.event.CaptureSignalType;
import io.github.drompincen.worktrack.runtime.session.MemberIdentity;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleListener;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleService;
import io.github.drompincen.worktrack.runtime.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the capture lock, the auto-capture timer and the remote poller for the desktop agent.
 *
 * <p>Tracking starts when the session becomes active and stops when it closes. Captures
 * only run while the session is {@link SessionState#ACTIVE}. At most one pipeline runs at a
 * time; callers that find the lock held get a skipped outcome instead of queueing.
 */
public class CaptureOrchestrator implements SessionLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(CaptureOrchestrator.class);

    private final CaptureLock lock = new CaptureLock();
    private final CapturePipeline pipeline;
    private final AutoCaptureScheduler autoScheduler;
    private final RemoteCommandPoller poller;
    private final SessionLifecycleService sessions;
    private final CaptureSignalPublisher signals;
    private final Clock clock;
    private final ExecutorService pipelineExecutor;
    private final AtomicInteger captureCount = new AtomicInteger();

    private volatile boolean running;
    private volatile Future<?> inFlight;
    private volatile CompletableFuture<CaptureOutcome> inFlightResult;

    public CaptureOrchestrator(CapturePipeline pipeline,
                               AutoCaptureScheduler autoScheduler,
                               RemoteCommandPoller poller,
                               SessionLifecycleService sessions,
                               CaptureSignalPublisher signals,
                               Clock clock) {
        this(pipeline, autoScheduler, poller, sessions, signals, clock, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "capture-pipeline");
            t.setDaemon(true);
            return t;
        }));
    }

    CaptureOrchestrator(CapturePipeline pipeline,
                        AutoCaptureScheduler autoScheduler,
                        RemoteCommandPoller poller,
                        SessionLifecycleService sessions,
                        CaptureSignalPublisher signals,
                        Clock clock,
                        ExecutorService pipelineExecutor) {
        this.pipeline = pipeline;
        this.autoScheduler = autoScheduler;
        this.poller = poller;
        this.sessions = sessions;
        this.signals = signals;
        this.clock = clock;
        this.pipelineExecutor = pipelineExecutor;
    }

    @Override
    public void onSessionStateChanged(SessionState state, WorkSessionDocument session) {
        if (state.isOpen()) {
            start();
        } else {
            stop();
        }
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        autoScheduler.armFirst(this::onAutoFire);
        poller.start(this::activeUserId, lock, this::performCapture);
        log.info("Capture tracking started");
    }

    /** Cancels both timers and any in-flight pipeline, then clears the lock. Safe to repeat. */
    public synchronized void stop() {
        boolean wasRunning = running;
        running = false;
        autoScheduler.cancel();
        poller.stop();
        Future<?> pending = inFlight;
        if (pending != null) {
            pending.cancel(true);
        }
        CompletableFuture<CaptureOutcome> pendingResult = inFlightResult;
        if (pendingResult != null) {
            pendingResult.cancel(false);
        }
        boolean wasHeld = lock.isHeld();
        lock.forceRelease();
        if (wasHeld) {
            signals.publish(CaptureSignalType.COUNTDOWN_DONE, null, 0);
        }
        if (wasRunning) {
            log.info("Capture tracking stopped");
        }
    }

    public CompletableFuture<CaptureOutcome> performCapture(CaptureType type) {
        Optional<MemberIdentity> member = sessions.identity();
        if (sessions.getState() != SessionState.ACTIVE || member.isEmpty()) {
            return CompletableFuture.completedFuture(CaptureOutcome.skipped("no active session"));
        }
        Optional<String> token = lock.tryAcquire();
        if (token.isEmpty()) {
            log.debug("{} capture skipped, another capture is in progress", type);
            return CompletableFuture.completedFuture(CaptureOutcome.skipped("capture already in progress"));
        }

        CompletableFuture<CaptureOutcome> result = new CompletableFuture<>();
        inFlightResult = result;
        inFlight = pipelineExecutor.submit(() -> runPipeline(type, member.get(), token.get(), result));
        return result;
    }

    private void runPipeline(CaptureType type, MemberIdentity member, String token,
                             CompletableFuture<CaptureOutcome> result) {
        boolean completed = false;
        try {
            CaptureOutcome outcome = pipeline.run(type, member);
            captureCount.incrementAndGet();
            completed = true;
            result.complete(outcome);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("{} capture torn down before completion", type);
            result.completeExceptionally(e);
        } catch (Exception e) {
            log.error("{} capture failed", type, e);
            completed = true;
            result.completeExceptionally(e);
        } finally {
            lock.release(token);
            signals.publish(CaptureSignalType.COUNTDOWN_DONE, type, 0);
            if (completed && running) {
                autoScheduler.rescheduleAfterCompletion(clock.instant());
            }
        }
    }

    void onAutoFire() {
        if (!running) return;
        if (lock.isHeld()) {
            log.debug("Auto capture found the lock held, deferring");
            autoScheduler.deferByCooldown();
            return;
        }
        performCapture(CaptureType.AUTO).thenAccept(outcome -> {
            if (outcome.skipped() && running) {
                log.debug("Auto capture skipped ({}), deferring", outcome.skipReason());
                autoScheduler.deferByCooldown();
            }
        });
    }

    private Optional<String> activeUserId() {
        if (!running || sessions.getState() != SessionState.ACTIVE) return Optional.empty();
        return sessions.identity().map(MemberIdentity::userId);
    }

    public int getCaptureCount() {
        return captureCount.get();
    }

    public boolean isCaptureInProgress() {
        return lock.isHeld();
    }

    public boolean isRunning() {
        return running;
    }

    public AutoCaptureScheduler getAutoScheduler() {
        return autoScheduler;
    }

    public void shutdown() {
        stop();
        pipelineExecutor.shutdownNow();
    }
}
