package com.autonomous.swarm.model;

/**
 * How much autonomy the coordinator has when an agent blocks on a prompt.
 */
public enum SupervisionLevel {
    /** The oracle decides and the decision is executed immediately. */
    AUTONOMOUS,
    /** The oracle's suggestion is queued until an operator confirms it. */
    CONFIRM,
    /** Broadcast only; nothing is sent to the agent. */
    NOTIFY
}
