package io.github.drompincen.clarity.runtime.llm;

import io.github.drompincen.clarity.protocol.api.MessageRole;

public record LlmMessage(MessageRole role, String content) {

    public static LlmMessage user(String content) {
        return new LlmMessage(MessageRole.USER, content);
    }

    public static LlmMessage assistant(String content) {
        return new LlmMessage(MessageRole.ASSISTANT, content);
    }
}
