package io.github.drompincen.clarity.protocol.ws;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.drompincen.clarity.protocol.api.SessionCompletionSummary;

/**
 * Frames the server sends on a session connection. The {@code type} property is written by
 * Jackson from the registered subtype name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerMessage.SessionStarted.class, name = "session_started"),
        @JsonSubTypes.Type(value = ServerMessage.AssistantChunk.class, name = "assistant_chunk"),
        @JsonSubTypes.Type(value = ServerMessage.AssistantComplete.class, name = "assistant_complete"),
        @JsonSubTypes.Type(value = ServerMessage.PointRecalled.class, name = "point_recalled"),
        @JsonSubTypes.Type(value = ServerMessage.SessionComplete.class, name = "session_complete"),
        @JsonSubTypes.Type(value = ServerMessage.SessionCompleteOverlay.class, name = "session_complete_overlay"),
        @JsonSubTypes.Type(value = ServerMessage.SessionPaused.class, name = "session_paused"),
        @JsonSubTypes.Type(value = ServerMessage.RabbitholeDetected.class, name = "rabbithole_detected"),
        @JsonSubTypes.Type(value = ServerMessage.RabbitholeEntered.class, name = "rabbithole_entered"),
        @JsonSubTypes.Type(value = ServerMessage.RabbitholeExited.class, name = "rabbithole_exited"),
        @JsonSubTypes.Type(value = ServerMessage.ErrorPayload.class, name = "error"),
        @JsonSubTypes.Type(value = ServerMessage.Pong.class, name = "pong")
})
public sealed interface ServerMessage {

    record SessionStarted(String sessionId, String openingMessage, int totalPoints, int recalledCount)
            implements ServerMessage {}

    record AssistantChunk(String content, int chunkIndex) implements ServerMessage {}

    record AssistantComplete(String fullContent, int totalChunks) implements ServerMessage {}

    record PointRecalled(String pointId, int recalledCount, int totalPoints) implements ServerMessage {}

    record SessionComplete(SessionCompletionSummary summary) implements ServerMessage {}

    record SessionCompleteOverlay(int recalledCount, int totalPoints, String sessionId,
                                  String message, boolean canContinue) implements ServerMessage {}

    record SessionPaused(String sessionId, int recalledCount, int totalPoints) implements ServerMessage {}

    record RabbitholeDetected(String topic, String rabbitholeEventId) implements ServerMessage {}

    record RabbitholeEntered(String topic) implements ServerMessage {}

    record RabbitholeExited(String label, int pointsRecalledDuring, boolean completionPending)
            implements ServerMessage {}

    record ErrorPayload(WebSocketErrorCode code, String message, boolean recoverable) implements ServerMessage {

        public static ErrorPayload of(WebSocketErrorCode code) {
            return new ErrorPayload(code, code.description(), true);
        }

        public static ErrorPayload of(WebSocketErrorCode code, String message) {
            return new ErrorPayload(code, message, true);
        }

        public static ErrorPayload fatal(WebSocketErrorCode code, String message) {
            return new ErrorPayload(code, message != null ? message : code.description(), false);
        }
    }

    record Pong(long timestamp) implements ServerMessage {}
}
