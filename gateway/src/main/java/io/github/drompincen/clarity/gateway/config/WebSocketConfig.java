package io.github.drompincen.clarity.gateway.config;

import io.github.drompincen.clarity.gateway.websocket.RecallWebSocketHandler;
import io.github.drompincen.clarity.gateway.websocket.SessionIdHandshakeInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String SESSION_PATH = "/api/session/ws";

    private final RecallWebSocketHandler handler;
    private final SessionIdHandshakeInterceptor handshakeInterceptor;

    public WebSocketConfig(RecallWebSocketHandler handler, SessionIdHandshakeInterceptor handshakeInterceptor) {
        this.handler = handler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, SESSION_PATH)
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins("*");
    }
}
