package com.autonomous.swarm.exception;

/**
 * Base type for decision oracle failures. Never thrown past the decision loop.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
