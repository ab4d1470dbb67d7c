package com.autonomous.swarm.process;

import java.io.IOException;
import java.util.List;

/**
 * A running agent process. Output and exit are reported through the callbacks given to
 * {@link AgentProcessFactory#spawn}.
 */
public interface AgentProcess {

    void write(String data) throws IOException;

    /**
     * Writes named keys ({@code "enter"}, {@code "down"}) or literal text, in order.
     */
    void writeKeys(List<String> keys) throws IOException;

    void kill();

    boolean isAlive();

    long pid();
}
