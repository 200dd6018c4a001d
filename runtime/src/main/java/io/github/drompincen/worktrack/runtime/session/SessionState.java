package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.protocol.api.SessionStatus;

public enum SessionState {
    NO_SESSION,
    ACTIVE,
    ON_BREAK,
    COMPLETED;

    public boolean isOpen() {
        return this == ACTIVE || this == ON_BREAK;
    }

    public static SessionState from(SessionStatus status) {
        if (status == null) return NO_SESSION;
        return switch (status) {
            case ACTIVE -> ACTIVE;
            case BREAK -> ON_BREAK;
            case COMPLETED -> COMPLETED;
        };
    }
}
