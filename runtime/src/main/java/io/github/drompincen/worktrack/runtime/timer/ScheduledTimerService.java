package io.github.drompincen.worktrack.runtime.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;

public class ScheduledTimerService implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTimerService.class);

    private final Clock clock;
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "worktrack-timer");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public ScheduledTimerService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void schedule(String name, Duration delay, Runnable task) {
        cancel(name);
        ScheduledFuture<?> future = scheduler.schedule(guarded(name, task), delay.toMillis(), TimeUnit.MILLISECONDS);
        timers.put(name, future);
        log.debug("Timer {} armed in {}", name, delay);
    }

    @Override
    public void scheduleRepeating(String name, Duration initialDelay, Duration period, Runnable task) {
        cancel(name);
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(guarded(name, task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        timers.put(name, future);
        log.debug("Timer {} repeating every {} after {}", name, period, initialDelay);
    }

    @Override
    public void cancel(String name) {
        ScheduledFuture<?> future = timers.remove(name);
        if (future != null) {
            future.cancel(false);
            log.debug("Timer {} cancelled", name);
        }
    }

    @Override
    public boolean isScheduled(String name) {
        ScheduledFuture<?> future = timers.get(name);
        return future != null && !future.isDone();
    }

    @Override
    public Optional<Instant> nextFireTime(String name) {
        ScheduledFuture<?> future = timers.get(name);
        if (future == null || future.isDone()) return Optional.empty();
        return Optional.of(clock.instant().plusMillis(Math.max(0, future.getDelay(TimeUnit.MILLISECONDS))));
    }

    @Override
    public void shutdown() {
        timers.values().forEach(f -> f.cancel(false));
        timers.clear();
        scheduler.shutdownNow();
    }

    // A throwing task would silently kill a repeating schedule.
    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Timer {} task failed", name, e);
            }
        };
    }
}
