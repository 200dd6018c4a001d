package io.github.drompincen.worktrack.protocol.api;

import java.time.Instant;

public record TrackerLogDto(
        String id,
        String userId,
        String userDisplayName,
        String screenshotUrl,
        String cameraImageUrl,
        CaptureType type,
        boolean flagged,
        String flagReason,
        SessionSource source,
        Instant timestamp
) {}
