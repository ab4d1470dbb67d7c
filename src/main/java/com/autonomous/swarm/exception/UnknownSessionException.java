package com.autonomous.swarm.exception;

public class UnknownSessionException extends SessionException {

    public UnknownSessionException(String sessionId) {
        super(sessionId, "Session " + sessionId + " not found");
    }
}
