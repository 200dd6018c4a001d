package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.event.CaptureSignalType;

import java.time.Duration;

/**
 * Mandatory warning before a capture: a started signal with the full window, a tick every
 * second, pulses only at 3, 2 and 1. The window is a notice, it cannot be
 * cancelled by the user. Interruption is the only way out and propagates to the caller,
 * which owns emitting {@link CaptureSignalType#COUNTDOWN_DONE}.
 */
public class CountdownProtocol {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final Duration TICK = Duration.ofSeconds(1);

    private final CaptureSignalPublisher signals;
    private final int windowSeconds;
    private final Sleeper sleeper;

    public CountdownProtocol(CaptureSignalPublisher signals, int windowSeconds) {
        this(signals, windowSeconds, d -> Thread.sleep(d.toMillis()));
    }

    public CountdownProtocol(CaptureSignalPublisher signals, int windowSeconds, Sleeper sleeper) {
        if (windowSeconds < 0) throw new IllegalArgumentException("windowSeconds must be >= 0");
        this.signals = signals;
        this.windowSeconds = windowSeconds;
        this.sleeper = sleeper;
    }

    public void run(CaptureType captureType) throws InterruptedException {
        signals.publish(CaptureSignalType.COUNTDOWN_STARTED, captureType, windowSeconds);
        for (int remaining = windowSeconds - 1; remaining >= 0; remaining--) {
            sleeper.sleep(TICK);
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Countdown interrupted");
            }
            if (remaining == 0) break;
            signals.publish(CaptureSignalType.COUNTDOWN_TICK, captureType, remaining);
            if (remaining <= 3) {
                signals.publish(CaptureSignalType.COUNTDOWN_PULSE, captureType, remaining);
            }
        }
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }
}
