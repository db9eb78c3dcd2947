package io.github.drompincen.clarity.protocol.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.Optional;

/**
 * JSON codec for the session connection. Parsing never throws: every rejected frame comes back
 * as a recoverable {@link ServerMessage.ErrorPayload}.
 */
public class SessionProtocolCodec {

    private final ObjectMapper objectMapper;
    private final ObjectWriter serverWriter;

    public SessionProtocolCodec() {
        this(new ObjectMapper());
    }

    public SessionProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.serverWriter = objectMapper.writerFor(ServerMessage.class);
    }

    public ParseResult parseClientMessage(String raw) {
        JsonNode node;
        try {
            node = raw == null ? null : objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            node = null;
        }
        if (node == null || node.isMissingNode()) {
            return ParseResult.failed(ServerMessage.ErrorPayload.of(
                    WebSocketErrorCode.INVALID_MESSAGE_FORMAT, "Failed to parse message as JSON"));
        }
        if (!node.isObject() || !node.has("type")) {
            return ParseResult.failed(ServerMessage.ErrorPayload.of(
                    WebSocketErrorCode.INVALID_MESSAGE_FORMAT, "Message must be an object with a \"type\" field"));
        }

        JsonNode typeNode = node.get("type");
        Optional<ClientMessageType> type = typeNode.isTextual()
                ? ClientMessageType.fromWireName(typeNode.asText())
                : Optional.empty();
        if (type.isEmpty()) {
            String shown = typeNode.isTextual() ? typeNode.asText() : typeNode.toString();
            return ParseResult.failed(ServerMessage.ErrorPayload.of(
                    WebSocketErrorCode.UNKNOWN_MESSAGE_TYPE, "Unknown message type: " + shown));
        }

        return switch (type.get()) {
            case USER_MESSAGE -> {
                JsonNode content = node.get("content");
                if (content == null || !content.isTextual() || content.asText().trim().isEmpty()) {
                    yield ParseResult.failed(ServerMessage.ErrorPayload.of(WebSocketErrorCode.MISSING_CONTENT,
                            "user_message must include a non-empty \"content\" field"));
                }
                yield ParseResult.ok(new ClientMessage.UserMessage(content.asText()));
            }
            case ENTER_RABBITHOLE -> {
                JsonNode eventId = node.get("rabbitholeEventId");
                JsonNode topic = node.get("topic");
                if (eventId == null || !eventId.isTextual() || topic == null || !topic.isTextual()) {
                    yield ParseResult.failed(ServerMessage.ErrorPayload.of(WebSocketErrorCode.MISSING_CONTENT,
                            "enter_rabbithole must include \"rabbitholeEventId\" and \"topic\" fields"));
                }
                yield ParseResult.ok(new ClientMessage.EnterRabbithole(eventId.asText(), topic.asText()));
            }
            case LEAVE_SESSION -> ParseResult.ok(new ClientMessage.LeaveSession());
            case PING -> ParseResult.ok(new ClientMessage.Ping());
            case EXIT_RABBITHOLE -> ParseResult.ok(new ClientMessage.ExitRabbithole());
            case DECLINE_RABBITHOLE -> ParseResult.ok(new ClientMessage.DeclineRabbithole());
            case DISMISS_OVERLAY -> ParseResult.ok(new ClientMessage.DismissOverlay());
        };
    }

    public String serializeServerMessage(ServerMessage message) {
        try {
            return serverWriter.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            // records of strings, numbers and enums always serialize
            throw new IllegalStateException("Failed to serialize " + message.getClass().getSimpleName(), e);
        }
    }

    public ServerMessage.ErrorPayload errorPayload(WebSocketErrorCode code, String message, boolean recoverable) {
        return new ServerMessage.ErrorPayload(code, message != null ? message : code.description(), recoverable);
    }
}
