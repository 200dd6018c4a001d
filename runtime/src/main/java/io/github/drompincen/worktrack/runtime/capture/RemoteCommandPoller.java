package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.persistence.document.CaptureCommandDocument;
import io.github.drompincen.worktrack.persistence.repository.CaptureCommandRepository;
import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.CommandStatus;
import io.github.drompincen.worktrack.runtime.timer.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Executes manager-requested captures. One pending command per cycle, oldest first.
 * A held lock, a skipped capture or a capture torn down by shutdown leaves the command pending
 * for the next cycle or the next agent start.
 */
public class RemoteCommandPoller {

    private static final Logger log = LoggerFactory.getLogger(RemoteCommandPoller.class);
    public static final String TIMER = "remote-poll";

    private final CaptureCommandRepository commandRepository;
    private final TimerService timers;
    private final CaptureSettings settings;
    private final Clock clock;

    public RemoteCommandPoller(CaptureCommandRepository commandRepository, TimerService timers,
                               CaptureSettings settings, Clock clock) {
        this.commandRepository = commandRepository;
        this.timers = timers;
        this.settings = settings;
        this.clock = clock;
    }

    public void start(Supplier<Optional<String>> activeUser, CaptureLock lock,
                      Function<CaptureType, CompletableFuture<CaptureOutcome>> capture) {
        timers.scheduleRepeating(TIMER, settings.pollInitialDelay(), settings.pollInterval(),
                () -> pollOnce(activeUser, lock, capture));
        log.info("Remote capture polling every {}s", settings.pollInterval().toSeconds());
    }

    public void stop() {
        timers.cancel(TIMER);
    }

    /** Returns the command handed to the pipeline this cycle, if any. */
    public Optional<CaptureCommandDocument> pollOnce(Supplier<Optional<String>> activeUser, CaptureLock lock,
                                                     Function<CaptureType, CompletableFuture<CaptureOutcome>> capture) {
        Optional<String> userId = activeUser.get();
        if (userId.isEmpty()) return Optional.empty();
        if (lock.isHeld()) {
            log.debug("Capture in progress, remote poll skipped");
            return Optional.empty();
        }
        List<CaptureCommandDocument> pending =
                commandRepository.findByUserIdAndStatusOrderByRequestedAtAsc(userId.get(), CommandStatus.PENDING);
        if (pending.isEmpty()) return Optional.empty();

        CaptureCommandDocument command = pending.get(0);
        CaptureType type = command.getType() == CaptureType.MANUAL ? CaptureType.MANUAL : CaptureType.REMOTE;
        log.info("Running {} capture for command {} requested by {}", type, command.getId(), command.getRequestedBy());
        capture.apply(type).whenComplete((outcome, error) -> {
            if (error == null && outcome.skipped()) {
                log.debug("Command {} left pending: {}", command.getId(), outcome.skipReason());
                return;
            }
            if (isTornDown(error)) {
                log.info("Command {} left pending, capture interrupted before completion", command.getId());
                return;
            }
            markCompleted(command);
        });
        return Optional.of(command);
    }

    private static boolean isTornDown(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof InterruptedException || cause instanceof CancellationException;
    }

    private void markCompleted(CaptureCommandDocument command) {
        try {
            command.setStatus(CommandStatus.COMPLETED);
            command.setCompletedAt(clock.instant());
            commandRepository.save(command);
        } catch (Exception e) {
            log.error("Failed to complete capture command {}", command.getId(), e);
        }
    }
}
