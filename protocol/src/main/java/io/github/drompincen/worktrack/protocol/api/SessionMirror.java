package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

/**
 * Snapshot of the open session handed to the host process so it can close the
 * session on its own if the UI side goes away.
 */
public record SessionMirror(
        String credential,
        String userId,
        String sessionId,
        Instant checkInTime,
        long cumulativeBreakSeconds
) {}
