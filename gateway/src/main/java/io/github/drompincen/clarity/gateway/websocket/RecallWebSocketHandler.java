package io.github.drompincen.clarity.gateway.websocket;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Spring adapter for {@link SessionConnectionHandler}.
 */
@Component
public class RecallWebSocketHandler extends TextWebSocketHandler {

    private final SessionConnectionHandler handler;
    private final ConnectionRegistry registry;

    public RecallWebSocketHandler(SessionConnectionHandler handler, ConnectionRegistry registry) {
        this.handler = handler;
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Object sessionId = session.getAttributes().get(SessionIdHandshakeInterceptor.SESSION_ID_ATTRIBUTE);
        handler.onOpen(new WebSocketSessionConnection(session), sessionId instanceof String s ? s : null);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        handler.onMessage(connectionFor(session), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        handler.onError(connectionFor(session), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        handler.onClose(connectionFor(session), status.getCode());
    }

    // reuse the registered decorator so sends stay ordered
    private SessionConnection connectionFor(WebSocketSession session) {
        return registry.get(session.getId())
                .map(ConnectionRegistry.Entry::connection)
                .orElseGet(() -> new WebSocketSessionConnection(session));
    }
}
