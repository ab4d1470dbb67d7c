package com.autonomous.swarm.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum CoordinationAction {
    RESPOND,
    ESCALATE,
    COMPLETE,
    IGNORE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CoordinationAction> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(action -> action.wireName().equals(value))
            .findFirst();
    }
}
