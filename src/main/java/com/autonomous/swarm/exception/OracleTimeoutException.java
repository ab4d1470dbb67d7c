package com.autonomous.swarm.exception;

import java.time.Duration;

public class OracleTimeoutException extends OracleException {

    public OracleTimeoutException(Duration timeout) {
        super("Oracle call timed out after " + timeout.toSeconds() + "s");
    }
}
