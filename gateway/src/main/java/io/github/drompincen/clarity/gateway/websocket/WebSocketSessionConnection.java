package io.github.drompincen.clarity.gateway.websocket;

import io.github.drompincen.clarity.protocol.ws.CloseCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link SessionConnection} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator} because chunk streaming and tangent notifications
 * may write from different threads.
 */
public class WebSocketSessionConnection implements SessionConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionConnection.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketSessionConnection(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String frame) {
        if (!session.isOpen()) {
            log.debug("Dropping frame for closed connection {}", session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send frame on connection {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public void close(CloseCode code, String reason) {
        try {
            session.close(new CloseStatus(code.code(), reason));
        } catch (IOException e) {
            log.warn("Failed to close connection {} with {}: {}", session.getId(), code, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
