package io.github.drompincen.worktrack.protocol.api;

public enum CaptureType {
    AUTO,
    MANUAL,
    REMOTE,
    FLAGGED
}
