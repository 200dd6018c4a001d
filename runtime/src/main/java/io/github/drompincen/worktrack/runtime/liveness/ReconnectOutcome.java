package io.github.drompincen.worktrack.runtime.liveness;

public enum ReconnectOutcome {
    /** The agent answered and accepted fresh credentials. */
    RECONNECTED,
    /** The agent was unreachable; the launch link was handed to the OS. */
    HANDSHAKE_SENT,
    FAILED
}
