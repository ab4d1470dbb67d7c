package com.autonomous.swarm.exception;

/**
 * Thrown when writing to a session whose process has already been stopped or has exited.
 */
public class InactiveSessionException extends SessionException {

    public InactiveSessionException(String sessionId) {
        super(sessionId, "Session " + sessionId + " is no longer active");
    }
}
