package io.github.drompincen.worktrack.protocol.api;

public enum SessionStatus {
    ACTIVE,
    BREAK,
    COMPLETED;

    public boolean isOpen() {
        return this == ACTIVE || this == BREAK;
    }
}
