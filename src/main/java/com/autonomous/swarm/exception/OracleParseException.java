package com.autonomous.swarm.exception;

public class OracleParseException extends OracleException {

    public OracleParseException(String message) {
        super(message);
    }

    public OracleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
