package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.boundary.websocket.UploadChannelWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String UPLOAD_CHANNEL_PATH = "/ws/upload";

    private final UploadChannelWebSocketHandler handler;

    public WebSocketConfig(UploadChannelWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, UPLOAD_CHANNEL_PATH).setAllowedOrigins("*");
    }
}
