package io.github.drompincen.clarity.gateway.websocket;

import io.github.drompincen.clarity.protocol.ws.SessionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Rejects the upgrade unless the request carries a well-formed {@code sessionId} query parameter,
 * which is then handed to the handler as a session attribute.
 */
@Component
public class SessionIdHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(SessionIdHandshakeInterceptor.class);

    public static final String SESSION_ID_ATTRIBUTE = "clarity.sessionId";
    static final String SESSION_ID_PARAM = "sessionId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String sessionId = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst(SESSION_ID_PARAM);
        if (!SessionIds.isValid(sessionId)) {
            log.warn("Rejected upgrade from {}: invalid sessionId '{}'", request.getRemoteAddress(), sessionId);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(SESSION_ID_ATTRIBUTE, sessionId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Handshake for {} failed: {}", request.getURI().getPath(), exception.getMessage());
        }
    }
}
