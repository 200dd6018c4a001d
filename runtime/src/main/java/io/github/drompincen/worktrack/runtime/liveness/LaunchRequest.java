package io.github.drompincen.worktrack.runtime.liveness;

public record LaunchRequest(
        String credential,
        String userId,
        String name,
        String email,
        String photoUrl
) {}
