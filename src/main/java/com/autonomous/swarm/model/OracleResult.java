package com.autonomous.swarm.model;

import com.autonomous.swarm.exception.OracleException;
import com.autonomous.swarm.exception.OracleParseException;

/**
 * Outcome of one oracle round trip: either a parsed decision or the failure that prevented one.
 */
public class OracleResult {
    private final CoordinationResponse response;
    private final OracleException error;

    private OracleResult(CoordinationResponse response, OracleException error) {
        this.response = response;
        this.error = error;
    }

    public static OracleResult decision(CoordinationResponse response) {
        return new OracleResult(response, null);
    }

    public static OracleResult failed(OracleException error) {
        return new OracleResult(null, error);
    }

    public boolean isDecision() {
        return response != null;
    }

    public boolean isParseFailure() {
        return error instanceof OracleParseException;
    }

    public CoordinationResponse getResponse() {
        return response;
    }

    public OracleException getError() {
        return error;
    }
}
