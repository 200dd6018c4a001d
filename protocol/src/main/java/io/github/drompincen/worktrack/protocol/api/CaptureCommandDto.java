package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

public record CaptureCommandDto(
        String id,
        String userId,
        CaptureType type,
        CommandStatus status,
        String requestedBy,
        Instant requestedAt,
        Instant completedAt
) {}
