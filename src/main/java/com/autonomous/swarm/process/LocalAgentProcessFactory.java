package com.autonomous.swarm.process;

import com.autonomous.swarm.terminal.KeyEncoder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Runs agents as plain child processes with stderr merged into stdout.
 */
@Slf4j
@Component
public class LocalAgentProcessFactory implements AgentProcessFactory {

    private static final int READ_BUFFER_SIZE = 4096;

    private final ExecutorService readers = Executors.newCachedThreadPool();

    @Override
    public AgentProcess spawn(List<String> command,
                              Path workdir,
                              Map<String, String> env,
                              Consumer<String> onData,
                              IntConsumer onExit) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workdir.toFile());
        pb.redirectErrorStream(true);
        if (env != null) {
            pb.environment().putAll(env);
        }

        Process process = pb.start();
        readers.submit(() -> pump(process, onData, onExit));
        log.debug("Started {} as pid {}", command.get(0), process.pid());
        return new LocalAgentProcess(process);
    }

    private void pump(Process process, Consumer<String> onData, IntConsumer onExit) {
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[READ_BUFFER_SIZE];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                onData.accept(new String(buffer, 0, read));
            }
        } catch (IOException e) {
            log.debug("Output stream of pid {} closed: {}", process.pid(), e.getMessage());
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = -1;
        }
        onExit.accept(exitCode);
    }

    @PreDestroy
    public void shutdown() {
        readers.shutdownNow();
    }

    static final class LocalAgentProcess implements AgentProcess {

        private final Process process;

        LocalAgentProcess(Process process) {
            this.process = process;
        }

        @Override
        public synchronized void write(String data) throws IOException {
            OutputStream stdin = process.getOutputStream();
            stdin.write(data.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }

        @Override
        public void writeKeys(List<String> keys) throws IOException {
            write(KeyEncoder.encodeAll(keys));
        }

        @Override
        public void kill() {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public long pid() {
            return process.pid();
        }
    }
}
