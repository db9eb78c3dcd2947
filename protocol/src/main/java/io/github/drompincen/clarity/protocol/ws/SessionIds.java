package io.github.drompincen.clarity.protocol.ws;

public final class SessionIds {

    public static final String PREFIX = "sess_";

    private SessionIds() {}

    public static boolean isValid(String sessionId) {
        return sessionId != null
                && sessionId.startsWith(PREFIX)
                && sessionId.length() > PREFIX.length()
                && sessionId.chars().noneMatch(Character::isWhitespace);
    }
}
