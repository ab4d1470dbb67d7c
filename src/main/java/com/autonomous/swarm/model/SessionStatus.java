package com.autonomous.swarm.model;

public enum SessionStatus {
    STARTING,
    ACTIVE,
    BLOCKED,
    COMPLETED,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}
