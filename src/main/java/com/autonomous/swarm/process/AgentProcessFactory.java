package com.autonomous.swarm.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

public interface AgentProcessFactory {

    /**
     * Starts {@code command} in {@code workdir}.
     *
     * @param onData receives output chunks in arrival order, on a reader thread
     * @param onExit receives the exit code once all output has been delivered
     * @throws IOException if the binary cannot be started
     */
    AgentProcess spawn(List<String> command,
                       Path workdir,
                       Map<String, String> env,
                       Consumer<String> onData,
                       IntConsumer onExit) throws IOException;
}
