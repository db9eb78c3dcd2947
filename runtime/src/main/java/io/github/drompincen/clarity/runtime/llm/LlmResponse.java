package io.github.drompincen.clarity.runtime.llm;

public record LlmResponse(String text) {

    public LlmResponse {
        text = text != null ? text : "";
    }
}
