package io.github.drompincen.worktrack.protocol.api;

public record CreateCaptureCommandRequest(
        String userId,
        CaptureType type,
        String requestedBy
) {}
