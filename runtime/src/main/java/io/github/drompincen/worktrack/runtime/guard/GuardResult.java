package io.github.drompincen.worktrack.runtime.guard;

public enum GuardResult {
    NO_SESSION,
    COMPLETED,
    FAILED,
    TIMED_OUT
}
