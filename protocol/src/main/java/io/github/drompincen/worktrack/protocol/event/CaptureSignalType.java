package io.github.drompincen.worktrack.protocol.event;

public enum CaptureSignalType {
    COUNTDOWN_STARTED,
    COUNTDOWN_TICK,
    COUNTDOWN_PULSE,
    COUNTDOWN_DONE,
    PERMISSION_NEEDED,
    CAPTURE_COMPLETED
}
