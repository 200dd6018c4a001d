package io.github.drompincen.worktrack.protocol.api;

public record CheckInRequest(
        String credential,
        String userId,
        String name
) {}
