package com.autonomous.swarm.model;

public enum TaskStatus {
    ACTIVE,
    COMPLETED,
    ERROR,
    STOPPED
}
