package com.autonomous.swarm.service;

/**
 * Destination for operator-facing chat messages.
 */
public interface ChatMessageSink {

    /**
     * @param source short tag of what produced the message, e.g. {@code "swarm_coordinator"}
     */
    void send(String text, String source);
}
