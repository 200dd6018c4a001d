package io.github.drompincen.worktrack.protocol.api;

public record AgentStatusResponse(
        boolean running,
        String version,
        String platform,
        boolean hasCredential,
        String sessionId,
        boolean onBreak,
        int captureCount,
        boolean captureInProgress
) {}
