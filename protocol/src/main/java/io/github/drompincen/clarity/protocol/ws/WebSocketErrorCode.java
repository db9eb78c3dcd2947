package io.github.drompincen.clarity.protocol.ws;

public enum WebSocketErrorCode {
    INVALID_SESSION_ID("The session ID is missing or invalid"),
    SESSION_NOT_FOUND("The specified session does not exist"),
    SESSION_NOT_ACTIVE("The session is not in an active state"),
    INVALID_MESSAGE_FORMAT("The message could not be parsed as valid JSON"),
    UNKNOWN_MESSAGE_TYPE("The message type is not recognized"),
    MISSING_CONTENT("The user_message is missing the content field"),
    SESSION_ENGINE_ERROR("An error occurred in the session engine"),
    LLM_ERROR("An error occurred while communicating with the LLM API"),
    INTERNAL_ERROR("An unexpected internal server error occurred");

    private final String description;

    WebSocketErrorCode(String description) {
        this.description = description;
    }

    public String description() { return description; }
}
