package io.github.drompincen.clarity.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    IN_PROGRESS("in_progress"),
    PAUSED("paused"),
    COMPLETED("completed"),
    ABANDONED("abandoned");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
