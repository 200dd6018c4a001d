package io.github.drompincen.worktrack.runtime.guard;

import io.github.drompincen.worktrack.protocol.api.EmergencyCheckoutRequest;
import io.github.drompincen.worktrack.protocol.api.PresenceUpdateRequest;
import io.github.drompincen.worktrack.protocol.api.SessionMirror;
import io.github.drompincen.worktrack.runtime.session.SessionDurations;
import io.github.drompincen.worktrack.runtime.session.SessionMirrorSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Closes the mirrored session when the host process terminates without a checkout.
 *
 * <p>The mirror is pushed on every session transition. On termination the guard takes it
 * (so the write can fire only once), sends the flagged checkout and then a best-effort
 * presence write, each with its own request timeout, and gives up on both after the outer bound.
 */
public class CrashCheckoutGuard implements SessionMirrorSink {

    private static final Logger log = LoggerFactory.getLogger(CrashCheckoutGuard.class);

    public static final String REPORT = "[Auto] App closed without manual checkout";
    public static final String FLAG_REASON = "closed without manual checkout";
    public static final Duration OVERALL_BOUND = Duration.ofSeconds(6);
    public static final Duration SESSION_WRITE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration PRESENCE_WRITE_TIMEOUT = Duration.ofSeconds(3);

    private final AtomicReference<SessionMirror> mirror = new AtomicReference<>();
    private final EmergencyCheckoutTransport transport;
    private final Clock clock;
    private final Duration bound;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "crash-checkout-guard");
        t.setDaemon(true);
        return t;
    });

    public CrashCheckoutGuard(EmergencyCheckoutTransport transport, Clock clock) {
        this(transport, clock, OVERALL_BOUND);
    }

    CrashCheckoutGuard(EmergencyCheckoutTransport transport, Clock clock, Duration bound) {
        this.transport = transport;
        this.clock = clock;
        this.bound = bound;
    }

    @Override
    public void sync(SessionMirror snapshot) {
        mirror.set(snapshot);
    }

    public SessionMirror currentMirror() {
        return mirror.get();
    }

    public GuardResult onTermination() {
        SessionMirror snapshot = mirror.getAndSet(null);
        if (snapshot == null) {
            log.debug("No open session at shutdown");
            return GuardResult.NO_SESSION;
        }
        if (snapshot.credential() == null || snapshot.credential().isBlank()) {
            log.error("Session {} open at shutdown but no credential is available", snapshot.sessionId());
            return GuardResult.FAILED;
        }

        Instant now = clock.instant();
        SessionDurations.Totals totals = SessionDurations.totals(snapshot.checkInTime(), now,
                snapshot.cumulativeBreakSeconds());
        EmergencyCheckoutRequest body = new EmergencyCheckoutRequest(now, totals.durationMinutes(),
                totals.breakDurationMinutes(), REPORT, FLAG_REASON);
        log.warn("Emergency checkout of session {} ({} min)", snapshot.sessionId(), totals.durationMinutes());

        CompletableFuture<Boolean> work = CompletableFuture.supplyAsync(() -> write(snapshot, body, now), executor);
        try {
            boolean ok = work.get(bound.toMillis(), TimeUnit.MILLISECONDS);
            return ok ? GuardResult.COMPLETED : GuardResult.FAILED;
        } catch (TimeoutException e) {
            work.cancel(true);
            log.error("Emergency checkout of {} timed out after {}s", snapshot.sessionId(), bound.toSeconds());
            return GuardResult.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GuardResult.FAILED;
        } catch (ExecutionException e) {
            log.error("Emergency checkout of {} failed", snapshot.sessionId(), e.getCause());
            return GuardResult.FAILED;
        }
    }

    private boolean write(SessionMirror snapshot, EmergencyCheckoutRequest body, Instant now) {
        boolean completed;
        try {
            completed = transport.completeSession(snapshot.sessionId(), snapshot.credential(), body,
                    SESSION_WRITE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.error("Emergency session write failed: {}", e.getMessage());
            completed = false;
        }
        try {
            transport.markOffline(snapshot.userId(), snapshot.credential(),
                    new PresenceUpdateRequest(false, now), PRESENCE_WRITE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Presence write at shutdown failed: {}", e.getMessage());
        }
        if (completed) log.info("Emergency checkout of {} written", snapshot.sessionId());
        return completed;
    }
}
