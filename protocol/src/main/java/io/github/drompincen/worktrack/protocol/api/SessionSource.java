package io.github.drompincen.worktrack.protocol.api;

/**
 * Which client process created a work session. A {@code DESKTOP} session owns
 * heartbeat and capture write authority.
 */
public enum SessionSource {
    BROWSER,
    DESKTOP
}
