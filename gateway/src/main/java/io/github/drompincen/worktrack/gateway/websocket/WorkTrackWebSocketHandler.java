package io.github.drompincen.worktrack.gateway.websocket;

import io.github.drompincen.worktrack.gateway.controller.WorkSessionController;
import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.stream.WorkSessionChangeStreamTailer;
import io.github.drompincen.worktrack.persistence.stream.WorkSessionListener;
import io.github.drompincen.worktrack.protocol.api.LivenessDto;
import io.github.drompincen.worktrack.protocol.ws.WsMessage;
import io.github.drompincen.worktrack.protocol.ws.WsMessageType;
import io.github.drompincen.worktrack.runtime.liveness.HeartbeatMonitor;
import io.github.drompincen.worktrack.runtime.liveness.LivenessListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes session changes and liveness flips to dashboards subscribed to a member.
 */
@Component
public class WorkTrackWebSocketHandler extends TextWebSocketHandler
        implements WorkSessionListener, LivenessListener {

    private static final Logger log = LoggerFactory.getLogger(WorkTrackWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final WorkSessionChangeStreamTailer tailer;
    private final HeartbeatMonitor heartbeatMonitor;
    private final Map<String, Set<WebSocketSession>> userSubscriptions = new ConcurrentHashMap<>();

    public WorkTrackWebSocketHandler(ObjectMapper objectMapper, WorkSessionChangeStreamTailer tailer,
                                     HeartbeatMonitor heartbeatMonitor) {
        this.objectMapper = objectMapper;
        this.tailer = tailer;
        this.heartbeatMonitor = heartbeatMonitor;
    }

    @PostConstruct
    public void init() {
        tailer.addListener(this);
        heartbeatMonitor.addListener(this);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        userSubscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        var node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String userId = node.path("userId").asText();

        if (WsMessageType.SUBSCRIBE_USER.name().equals(type) && !userId.isBlank()) {
            userSubscriptions.computeIfAbsent(userId, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, WsMessage.of(WsMessageType.SUBSCRIBED, userId, null));
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type)) {
            var set = userSubscriptions.get(userId);
            if (set != null) set.remove(session);
            send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, userId, null));
        } else {
            send(session, WsMessage.error(userId.isBlank() ? null : userId,
                    objectMapper.valueToTree(Map.of("message", "Unsupported message: " + type))));
        }
    }

    @Override
    public void onSessionChanged(WorkSessionDocument session) {
        if (session.getUserId() == null) return;
        broadcast(session.getUserId(), WsMessage.of(WsMessageType.SESSION_UPDATE, session.getUserId(),
                objectMapper.valueToTree(WorkSessionController.toDto(session))));
    }

    @Override
    public void onLivenessChanged(String userId, LivenessDto liveness) {
        if (userId == null) return;
        broadcast(userId, WsMessage.of(WsMessageType.LIVENESS_UPDATE, userId, objectMapper.valueToTree(liveness)));
    }

    @Override
    public void onError(Throwable t) {
        log.error("Work session stream error in WebSocket handler", t);
    }

    private void broadcast(String userId, WsMessage message) {
        var subscribers = userSubscriptions.get(userId);
        if (subscribers == null || subscribers.isEmpty()) return;
        for (var ws : subscribers) {
            if (ws.isOpen()) send(ws, message);
        }
    }

    private void send(WebSocketSession ws, WsMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            synchronized (ws) {
                ws.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.warn("Could not push {} to {}: {}", message.type(), ws.getId(), e.getMessage());
        }
    }
}
