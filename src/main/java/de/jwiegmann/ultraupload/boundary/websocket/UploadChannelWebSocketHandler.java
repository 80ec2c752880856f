package de.jwiegmann.ultraupload.boundary.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.ultraupload.control.scan.UploadEvent;
import de.jwiegmann.ultraupload.control.scan.UploadEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Echtzeitkanal "upload": verteilt Scan- und Upload-Ereignisse an alle verbundenen Clients.
 */
@Slf4j(topic = "ultra.upload")
@Component
public class UploadChannelWebSocketHandler extends TextWebSocketHandler implements UploadEventPublisher {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public UploadChannelWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.debug("Upload channel subscriber connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        var node = objectMapper.readTree(message.getPayload());
        if ("subscribe".equals(node.path("type").asText())) {
            String channel = node.path("channel").asText(UploadEvent.CHANNEL);
            WebSocketSession target = sessions.getOrDefault(session.getId(), session);
            target.sendMessage(new TextMessage(objectMapper.writeValueAsString(
                    Map.of("type", "subscribed", "channel", channel))));
        }
    }

    @Override
    public void publish(UploadEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize upload event {}", event, e);
            return;
        }
        TextMessage message = new TextMessage(json);
        for (WebSocketSession session : sessions.values()) {
            if (!session.isOpen()) {
                sessions.remove(session.getId());
                continue;
            }
            try {
                session.sendMessage(message);
            } catch (IOException | RuntimeException e) {
                log.warn("Could not deliver {} to {}: {}", event.getState(), session.getId(), e.getMessage());
            }
        }
    }

    public int getSubscriberCount() {
        return sessions.size();
    }
}
