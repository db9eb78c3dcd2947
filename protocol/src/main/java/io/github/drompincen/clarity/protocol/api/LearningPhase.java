package io.github.drompincen.clarity.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LearningPhase {
    NEW("new"),
    LEARNING("learning"),
    REVIEW("review"),
    RELEARNING("relearning");

    private final String value;

    LearningPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static LearningPhase fromValue(String value) {
        for (LearningPhase phase : values()) {
            if (phase.value.equalsIgnoreCase(value)) return phase;
        }
        throw new IllegalArgumentException("Unknown learning phase: " + value);
    }
}
