package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

public record EmergencyCheckoutRequest(
        Instant checkOutTime,
        int durationMinutes,
        int breakDurationMinutes,
        String report,
        String flagReason
) {}
