package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

public record BreakDto(
        Instant startTime,
        Instant endTime,
        Integer durationMinutes
) {}
