package io.github.drompincen.worktrack.runtime.capture;

import java.time.Duration;

/** Timing knobs for the capture orchestrator. */
public record CaptureSettings(
        int countdownSeconds,
        Duration firstDelayMin,
        Duration firstDelayMax,
        Duration cooldown,
        Duration jitterMin,
        Duration jitterMax,
        Duration pollInitialDelay,
        Duration pollInterval
) {
    public static CaptureSettings defaults() {
        return new CaptureSettings(60,
                Duration.ofMinutes(3), Duration.ofMinutes(5),
                Duration.ofMinutes(2),
                Duration.ofMinutes(10), Duration.ofMinutes(30),
                Duration.ofSeconds(5), Duration.ofSeconds(15));
    }
}
