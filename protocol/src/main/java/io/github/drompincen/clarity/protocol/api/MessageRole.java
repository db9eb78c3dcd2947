package io.github.drompincen.clarity.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    USER("user", "Learner"),
    ASSISTANT("assistant", "Tutor"),
    SYSTEM("system", "System");

    private final String value;
    private final String label;

    MessageRole(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String value() { return value; }

    /** Speaker name used when a transcript is rendered into a prompt. */
    public String label() { return label; }
}
