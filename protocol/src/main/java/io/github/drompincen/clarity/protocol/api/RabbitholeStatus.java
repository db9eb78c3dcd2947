package io.github.drompincen.clarity.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RabbitholeStatus {
    ACTIVE("active"),
    RETURNED("returned"),
    ABANDONED("abandoned");

    private final String value;

    RabbitholeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }
}
