package io.github.drompincen.worktrack.protocol.api;

/** An open session together with its current heartbeat evaluation. */
public record OpenSessionView(
        WorkSessionDto session,
        LivenessDto liveness
) {}
