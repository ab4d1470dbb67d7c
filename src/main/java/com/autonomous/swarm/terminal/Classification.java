package com.autonomous.swarm.terminal;

import com.autonomous.swarm.model.PromptInfo;
import com.autonomous.swarm.model.PromptRule;
import lombok.Value;

/**
 * Result of examining recent session output.
 */
@Value
public class Classification {

    public enum Kind {
        NONE,
        BLOCKED,
        TURN_COMPLETE,
        READY,
        LOGIN_REQUIRED,
        TOOL_RUNNING
    }

    private static final Classification NONE = new Classification(Kind.NONE, null, null, null);

    Kind kind;
    PromptInfo promptInfo;
    /** The rule that matched a blocking prompt, if any. */
    PromptRule rule;
    /** Matched line for login and tool-running output. */
    String detail;

    public static Classification none() {
        return NONE;
    }

    public static Classification blocked(PromptInfo promptInfo, PromptRule rule) {
        return new Classification(Kind.BLOCKED, promptInfo, rule, null);
    }

    public static Classification of(Kind kind, String detail) {
        return new Classification(kind, null, null, detail);
    }

    public boolean is(Kind candidate) {
        return kind == candidate;
    }
}
