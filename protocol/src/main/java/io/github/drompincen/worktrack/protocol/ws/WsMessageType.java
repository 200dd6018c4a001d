package io.github.drompincen.worktrack.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_USER,
    UNSUBSCRIBE,

    // Server -> Client
    SESSION_UPDATE,
    LIVENESS_UPDATE,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
