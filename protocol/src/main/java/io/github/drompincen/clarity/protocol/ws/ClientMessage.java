package io.github.drompincen.clarity.protocol.ws;

/**
 * Frames a client may send on a session connection. The set is closed: adding a variant
 * breaks every {@link Visitor} until it handles the new case.
 */
public sealed interface ClientMessage {

    ClientMessageType type();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitUserMessage(UserMessage message);
        R visitLeaveSession(LeaveSession message);
        R visitPing(Ping message);
        R visitEnterRabbithole(EnterRabbithole message);
        R visitExitRabbithole(ExitRabbithole message);
        R visitDeclineRabbithole(DeclineRabbithole message);
        R visitDismissOverlay(DismissOverlay message);
    }

    record UserMessage(String content) implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.USER_MESSAGE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitUserMessage(this); }
    }

    /** Pause the session, keeping recalled points. */
    record LeaveSession() implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.LEAVE_SESSION; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLeaveSession(this); }
    }

    record Ping() implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.PING; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPing(this); }
    }

    record EnterRabbithole(String rabbitholeEventId, String topic) implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.ENTER_RABBITHOLE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitEnterRabbithole(this); }
    }

    record ExitRabbithole() implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.EXIT_RABBITHOLE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitExitRabbithole(this); }
    }

    record DeclineRabbithole() implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.DECLINE_RABBITHOLE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDeclineRabbithole(this); }
    }

    /** Keep discussing after the completion overlay was shown. */
    record DismissOverlay() implements ClientMessage {
        public ClientMessageType type() { return ClientMessageType.DISMISS_OVERLAY; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDismissOverlay(this); }
    }
}
