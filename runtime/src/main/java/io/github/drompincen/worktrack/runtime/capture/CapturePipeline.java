package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.persistence.document.TrackerLogDocument;
import io.github.drompincen.worktrack.persistence.repository.TrackerLogRepository;
import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.event.CaptureSignal;
import io.github.drompincen.worktrack.protocol.event.CaptureSignalType;
import io.github.drompincen.worktrack.runtime.host.DesktopNotifier;
import io.github.drompincen.worktrack.runtime.session.MemberIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Countdown, then screen and camera in parallel, each uploaded on its own, then exactly one
 * evidence record. Locking and rescheduling belong to {@link CaptureOrchestrator}.
 */
public class CapturePipeline {

    private static final Logger log = LoggerFactory.getLogger(CapturePipeline.class);

    public static final String BOTH_FAILED_REASON = "Both camera and screen capture failed";
    static final String SCREEN_PREFIX = "screenshot";
    static final String CAMERA_PREFIX = "camera";

    private final CountdownProtocol countdown;
    private final ScreenCaptureSource screenSource;
    private final CameraCaptureSource cameraSource;
    private final PlaceholderImageRenderer placeholder;
    private final EvidenceStorage storage;
    private final TrackerLogRepository trackerLogRepository;
    private final CaptureSignalPublisher signals;
    private final DesktopNotifier notifier;
    private final Executor ioExecutor;
    private final Clock clock;

    public CapturePipeline(CountdownProtocol countdown,
                           ScreenCaptureSource screenSource,
                           CameraCaptureSource cameraSource,
                           PlaceholderImageRenderer placeholder,
                           EvidenceStorage storage,
                           TrackerLogRepository trackerLogRepository,
                           CaptureSignalPublisher signals,
                           DesktopNotifier notifier,
                           Executor ioExecutor,
                           Clock clock) {
        this.countdown = countdown;
        this.screenSource = screenSource;
        this.cameraSource = cameraSource;
        this.placeholder = placeholder;
        this.storage = storage;
        this.trackerLogRepository = trackerLogRepository;
        this.signals = signals;
        this.notifier = notifier;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
    }

    public CaptureOutcome run(CaptureType trigger, MemberIdentity member) throws InterruptedException {
        countdown.run(trigger);

        CompletableFuture<ScreenCaptureResult> screen = CompletableFuture.supplyAsync(this::captureScreen, ioExecutor);
        CompletableFuture<Optional<String>> screenUrl = screen.thenApplyAsync(result -> result.isPresent()
                ? storage.upload(result.jpeg(), SCREEN_PREFIX, member.userId())
                : Optional.<String>empty(), ioExecutor);
        CompletableFuture<Optional<String>> cameraUrl = CompletableFuture
                .supplyAsync(this::captureCamera, ioExecutor)
                .thenApplyAsync(jpeg -> jpeg != null
                        ? storage.upload(jpeg, CAMERA_PREFIX, member.userId())
                        : Optional.<String>empty(), ioExecutor);

        boolean permissionNeeded = await(screen, ScreenCaptureResult.failed()).permissionNeeded();
        if (permissionNeeded) {
            signals.publish(CaptureSignalType.PERMISSION_NEEDED, trigger, 0);
            notifier.notify("Screen recording permission needed",
                    "Grant screen recording access so captures include your screen.");
        }
        String shot = await(screenUrl, Optional.<String>empty()).orElse(null);
        String cam = await(cameraUrl, Optional.<String>empty()).orElse(null);

        boolean flagged = shot == null && cam == null;
        CaptureType type = flagged ? CaptureType.FLAGGED : trigger;

        TrackerLogDocument evidence = new TrackerLogDocument();
        evidence.setUserId(member.userId());
        evidence.setUserDisplayName(member.displayName());
        evidence.setScreenshotUrl(shot);
        evidence.setCameraImageUrl(cam);
        evidence.setType(type);
        evidence.setFlagged(flagged);
        evidence.setFlagReason(flagged ? BOTH_FAILED_REASON : null);
        evidence.setSource(SessionSource.DESKTOP);
        evidence.setTimestamp(clock.instant());
        TrackerLogDocument saved = trackerLogRepository.save(evidence);

        CaptureOutcome outcome = new CaptureOutcome(false, null, type, shot, cam, flagged,
                evidence.getFlagReason(), permissionNeeded, saved.getId());
        if (flagged) {
            log.warn("{} capture for {} produced no artifacts", trigger, member.userId());
        } else {
            log.info("{} capture for {} recorded (screen={}, camera={})",
                    trigger, member.userId(), shot != null, cam != null);
        }
        signals.publish(CaptureSignal.of(CaptureSignalType.CAPTURE_COMPLETED, type, detail(outcome)));
        return outcome;
    }

    private ScreenCaptureResult captureScreen() {
        try {
            return screenSource.capture();
        } catch (RuntimeException e) {
            log.warn("Screen capture failed: {}", e.getMessage());
            return ScreenCaptureResult.failed();
        }
    }

    private byte[] captureCamera() {
        try {
            return cameraSource.capture();
        } catch (CameraCaptureException e) {
            if (e.getFailure().isDeviceBusy()) {
                log.info("Camera busy ({}), using placeholder frame", e.getFailure());
                return placeholder.render();
            }
            log.warn("Camera capture failed ({}): {}", e.getFailure(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Camera capture failed: {}", e.getMessage());
            return null;
        }
    }

    private static <T> T await(CompletableFuture<T> future, T fallback) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Capture step failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return fallback;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static Map<String, Object> detail(CaptureOutcome outcome) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("flagged", outcome.flagged());
        detail.put("screenshotUrl", outcome.screenshotUrl());
        detail.put("cameraImageUrl", outcome.cameraImageUrl());
        detail.put("permissionNeeded", outcome.permissionNeeded());
        if (outcome.evidenceId() != null) detail.put("evidenceId", outcome.evidenceId());
        return detail;
    }
}
