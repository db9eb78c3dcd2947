package io.github.drompincen.clarity.protocol.ws;

/**
 * Close codes sent when the server ends a session connection. Values are fixed for client
 * compatibility; the custom ones live in the 4000-4999 range RFC 6455 leaves to applications.
 */
public enum CloseCode {
    NORMAL(1000),
    SESSION_ENDED(4000),
    SESSION_ABANDONED(4001),
    INVALID_SESSION(4002),
    TOO_MANY_ERRORS(4003),
    SERVER_SHUTDOWN(4004),
    IDLE_TIMEOUT(4005);

    private final int code;

    CloseCode(int code) {
        this.code = code;
    }

    public int code() { return code; }

    public static CloseCode fromCode(int code) {
        for (CloseCode closeCode : values()) {
            if (closeCode.code == code) return closeCode;
        }
        throw new IllegalArgumentException("Unknown close code: " + code);
    }
}
