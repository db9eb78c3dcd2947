package io.github.drompincen.clarity.gateway.websocket;

/**
 * @param chunkSize    characters per {@code assistant_chunk}
 * @param chunkDelayMs pause between chunks, 0 for none
 */
public record ConnectionSettings(int maxConsecutiveErrors, long idleTimeoutMs, int chunkSize, long chunkDelayMs) {

    public ConnectionSettings {
        if (maxConsecutiveErrors < 1) throw new IllegalArgumentException("maxConsecutiveErrors must be at least 1");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be at least 1");
        if (chunkDelayMs < 0) throw new IllegalArgumentException("chunkDelayMs must not be negative");
    }

    public static ConnectionSettings defaults() {
        return new ConnectionSettings(5, 5 * 60 * 1000L, 20, 15);
    }
}
