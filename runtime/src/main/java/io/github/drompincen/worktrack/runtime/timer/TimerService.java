package io.github.drompincen.worktrack.runtime.timer;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Named timers with replace-on-schedule semantics. Scheduling a name that is already
 * armed cancels the previous task first, so each name has a single next fire time.
 */
public interface TimerService {

    void schedule(String name, Duration delay, Runnable task);

    void scheduleRepeating(String name, Duration initialDelay, Duration period, Runnable task);

    /** Cancels the named timer. Unknown names are ignored. */
    void cancel(String name);

    boolean isScheduled(String name);

    Optional<Instant> nextFireTime(String name);

    void shutdown();
}
