package io.github.drompincen.worktrack.protocol.api;

public record RefreshRequest(String credential) {}
