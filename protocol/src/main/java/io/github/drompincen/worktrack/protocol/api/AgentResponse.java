package io.github.drompincen.worktrack.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform reply of every desktop agent control endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResponse(
        boolean ok,
        String error,
        Boolean resumed,
        String sessionId
) {
    public static AgentResponse success() {
        return new AgentResponse(true, null, null, null);
    }

    public static AgentResponse success(String sessionId, boolean resumed) {
        return new AgentResponse(true, null, resumed ? Boolean.TRUE : null, sessionId);
    }

    public static AgentResponse failure(String error) {
        return new AgentResponse(false, error, null, null);
    }
}
