package io.github.drompincen.clarity.protocol.ws;

/**
 * Outcome of parsing an inbound frame: exactly one of {@code message} and {@code error} is set.
 */
public record ParseResult(ClientMessage message, ServerMessage.ErrorPayload error) {

    public static ParseResult ok(ClientMessage message) {
        return new ParseResult(message, null);
    }

    public static ParseResult failed(ServerMessage.ErrorPayload error) {
        return new ParseResult(null, error);
    }

    public boolean isOk() {
        return message != null;
    }
}
