package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

public record PresenceUpdateRequest(
        boolean online,
        Instant lastActive
) {}
