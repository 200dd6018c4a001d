package io.github.drompincen.worktrack.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String userId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String userId, JsonNode payload) {
        return new WsMessage(type, userId, payload, Instant.now());
    }

    public static WsMessage error(String userId, JsonNode payload) {
        return of(WsMessageType.ERROR, userId, payload);
    }
}
