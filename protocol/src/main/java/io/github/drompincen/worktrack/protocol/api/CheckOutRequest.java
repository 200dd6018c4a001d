package io.github.drompincen.worktrack.protocol.api;

public record CheckOutRequest(
        String report,
        String proofLink
) {}
