package io.github.drompincen.clarity.protocol.ws;

import java.util.Optional;

public enum ClientMessageType {
    USER_MESSAGE("user_message"),
    LEAVE_SESSION("leave_session"),
    PING("ping"),
    ENTER_RABBITHOLE("enter_rabbithole"),
    EXIT_RABBITHOLE("exit_rabbithole"),
    DECLINE_RABBITHOLE("decline_rabbithole"),
    DISMISS_OVERLAY("dismiss_overlay");

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static Optional<ClientMessageType> fromWireName(String name) {
        for (ClientMessageType type : values()) {
            if (type.wireName.equals(name)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
