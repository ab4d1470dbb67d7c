package com.autonomous.swarm.exception;

/**
 * Base type for session lifecycle and process I/O failures. These propagate to the caller.
 */
public class SessionException extends RuntimeException {

    private final String sessionId;

    public SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public SessionException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
