package com.autonomous.swarm.terminal;

/**
 * Decides what a session is doing from the control-stripped tail of its output.
 * Implementations are per agent type and must be thread-safe.
 */
public interface OutputClassifier {

    Classification classify(String recentOutput);
}
