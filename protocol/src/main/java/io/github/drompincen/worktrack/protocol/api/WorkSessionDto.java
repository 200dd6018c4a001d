package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;
import java.util.List;

public record WorkSessionDto(
        String id,
        String userId,
        String userDisplayName,
        Instant checkInTime,
        Instant checkOutTime,
        SessionStatus status,
        SessionSource source,
        List<BreakDto> breaks,
        Instant lastHeartbeat,
        Integer durationMinutes,
        Integer breakDurationMinutes,
        String report,
        List<String> attachments,
        boolean flagged,
        String flagReason,
        Instant updatedAt
) {}
