package io.github.drompincen.clarity.gateway.websocket;

import io.github.drompincen.clarity.protocol.ws.CloseCode;

/**
 * Transport-neutral view of one live client connection. Implementations must allow
 * {@link #send} from more than one thread.
 */
public interface SessionConnection {

    String id();

    void send(String frame);

    void close(CloseCode code, String reason);

    boolean isOpen();
}
