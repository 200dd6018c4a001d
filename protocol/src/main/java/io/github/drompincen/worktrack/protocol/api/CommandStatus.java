package io.github.drompincen.worktrack.protocol.api;

public enum CommandStatus {
    PENDING,
    COMPLETED
}
