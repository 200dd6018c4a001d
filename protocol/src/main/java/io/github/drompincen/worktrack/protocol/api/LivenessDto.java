package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

public record LivenessDto(
        String sessionId,
        SessionSource source,
        boolean stale,
        long ageSeconds,
        Instant lastHeartbeat,
        Instant evaluatedAt
) {}
