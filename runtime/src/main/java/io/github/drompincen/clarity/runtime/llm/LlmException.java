package io.github.drompincen.clarity.runtime.llm;

/**
 * Upstream model failure: no provider configured, transport error or an empty completion.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
