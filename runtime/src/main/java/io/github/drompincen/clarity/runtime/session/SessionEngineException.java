package io.github.drompincen.clarity.runtime.session;

public class SessionEngineException extends RuntimeException {

    public SessionEngineException(String message) {
        super(message);
    }

    public SessionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
