package com.autonomous.swarm.model;

import java.util.Locale;

public enum SessionEventType {
    READY,
    BLOCKED,
    TURN_COMPLETE,
    LOGIN_REQUIRED,
    TOOL_RUNNING,
    ERROR,
    STOPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
