package com.autonomous.swarm.model;

import java.util.Locale;

public enum DecisionKind {
    AUTO_RESOLVED,
    RESPOND,
    ESCALATE,
    COMPLETE,
    IGNORE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DecisionKind of(CoordinationAction action) {
        return switch (action) {
            case RESPOND -> RESPOND;
            case ESCALATE -> ESCALATE;
            case COMPLETE -> COMPLETE;
            case IGNORE -> IGNORE;
        };
    }
}
