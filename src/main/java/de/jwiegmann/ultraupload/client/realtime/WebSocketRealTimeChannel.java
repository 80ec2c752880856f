package de.jwiegmann.ultraupload.client.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.ultraupload.control.scan.UploadEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Echtzeitkanal über den WebSocket-Endpunkt /ws/upload.
 */
@Slf4j(topic = "ultra.upload")
public class WebSocketRealTimeChannel implements RealTimeChannel {

    private final WebSocketClient client;
    private final String url;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;

    private volatile WebSocketSession session;

    public WebSocketRealTimeChannel(WebSocketClient client, String url, ObjectMapper objectMapper, Duration connectTimeout) {
        this.client = client;
        this.url = url;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void subscribe(String channel, Consumer<UploadEvent> listener) throws IOException {
        TextWebSocketHandler handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
                UploadEvent event = objectMapper.readValue(message.getPayload(), UploadEvent.class);
                if (event.getState() != null && channel.equals(event.getChannel())) {
                    listener.accept(event);
                }
            }

            @Override
            public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
                log.info("Real-time channel {} closed: {}", channel, status);
            }
        };

        try {
            session = client.execute(handler, url).get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(
                    Map.of("type", "subscribe", "channel", channel))));
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Could not connect to " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + url, e);
        }
    }

    @Override
    public void close() {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.close();
        } catch (IOException e) {
            log.warn("Could not close real-time channel: {}", e.getMessage());
        }
    }
}
