package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.runtime.timer.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Arms the auto-capture timer. The first fire lands 3-5 minutes after tracking starts;
 * each later fire is measured from when the previous attempt finished: cooldown plus a fresh
 * random jitter. A fire that finds the lock held is pushed back by exactly the cooldown.
 */
public class AutoCaptureScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoCaptureScheduler.class);
    public static final String TIMER = "auto-capture";

    private final TimerService timers;
    private final CaptureSettings settings;
    private final Random random;
    private final Clock clock;
    private volatile Runnable onFire;

    public AutoCaptureScheduler(TimerService timers, CaptureSettings settings, Random random, Clock clock) {
        this.timers = timers;
        this.settings = settings;
        this.random = random;
        this.clock = clock;
    }

    public void armFirst(Runnable fire) {
        this.onFire = fire;
        Duration delay = randomBetween(settings.firstDelayMin(), settings.firstDelayMax());
        timers.schedule(TIMER, delay, this::fire);
        log.info("First auto capture in {}s", delay.toSeconds());
    }

    public Instant rescheduleAfterCompletion(Instant finishedAt) {
        Instant next = finishedAt.plus(settings.cooldown())
                .plus(randomBetween(settings.jitterMin(), settings.jitterMax()));
        Duration delay = Duration.between(clock.instant(), next);
        timers.schedule(TIMER, delay.isNegative() ? Duration.ZERO : delay, this::fire);
        log.info("Next auto capture at {}", next);
        return next;
    }

    public void deferByCooldown() {
        timers.schedule(TIMER, settings.cooldown(), this::fire);
        log.debug("Auto capture deferred by {}", settings.cooldown());
    }

    public void cancel() {
        timers.cancel(TIMER);
        onFire = null;
    }

    public boolean isArmed() {
        return onFire != null;
    }

    public Optional<Instant> nextFireTime() {
        return timers.nextFireTime(TIMER);
    }

    private void fire() {
        Runnable callback = onFire;
        if (callback != null) {
            callback.run();
        }
    }

    private Duration randomBetween(Duration min, Duration max) {
        long lo = min.toMillis();
        long hi = max.toMillis();
        if (hi <= lo) return min;
        return Duration.ofMillis(random.nextLong(lo, hi + 1));
    }
}
