package io.github.drompincen.clarity.gateway.websocket;

import java.util.EnumSet;
import java.util.Set;

/** connecting -> initializing -> active <-> streaming -> closing -> closed; closed is reachable from anywhere. */
public enum ConnectionPhase {
    CONNECTING,
    INITIALIZING,
    ACTIVE,
    STREAMING,
    CLOSING,
    CLOSED;

    boolean canMoveTo(ConnectionPhase next) {
        if (next == CLOSED) return this != CLOSED;
        return successors().contains(next);
    }

    private Set<ConnectionPhase> successors() {
        return switch (this) {
            case CONNECTING -> EnumSet.of(INITIALIZING, CLOSING);
            case INITIALIZING -> EnumSet.of(ACTIVE, CLOSING);
            case ACTIVE -> EnumSet.of(STREAMING, CLOSING);
            case STREAMING -> EnumSet.of(ACTIVE, CLOSING);
            case CLOSING, CLOSED -> EnumSet.noneOf(ConnectionPhase.class);
        };
    }
}
