package com.autonomous.swarm.exception;

public class SpawnException extends SessionException {

    public SpawnException(String message) {
        super(null, message);
    }

    public SpawnException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
