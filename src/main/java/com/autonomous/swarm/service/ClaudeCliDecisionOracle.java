package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.exception.OracleException;
import com.autonomous.swarm.exception.OracleTimeoutException;
import com.autonomous.swarm.model.TaskContextSummary;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the {@code claude} CLI in print mode for a decision.
 */
@Slf4j
@Service
public class ClaudeCliDecisionOracle implements DecisionOracle {

    @Value("${claude.code.path:claude}")
    private String claudeCodePath;

    @Value("${claude.code.model:sonnet}")
    private String model;

    private final SwarmProperties properties;
    private final ExecutorService outputReaders = Executors.newCachedThreadPool();

    public ClaudeCliDecisionOracle(SwarmProperties properties) {
        this.properties = properties;
    }

    @Override
    public String decide(TaskContextSummary task, String prompt) throws Exception {
        List<String> command = new ArrayList<>();
        command.add(claudeCodePath);
        command.add("--print");
        command.add("--model");
        command.add(model);
        command.add(prompt);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        log.debug("Requesting decision for {} from {}", task.getSessionId(), claudeCodePath);
        Duration timeout = properties.getOracle().getTimeout();
        Process process = pb.start();
        try {
            // drained separately so a CLI that never closes stdout cannot outlive the timeout
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process), outputReaders);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new OracleTimeoutException(timeout);
            }
            if (process.exitValue() != 0) {
                throw new OracleException("claude exited with code " + process.exitValue());
            }
            try {
                return output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new OracleTimeoutException(timeout);
            } catch (ExecutionException e) {
                throw new OracleException("Failed to read claude output: " + e.getCause().getMessage(), e.getCause());
            }
        } finally {
            if (process.isAlive()) {
                log.warn("Killing unfinished claude process for {}", task.getSessionId());
                process.destroyForcibly();
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    private static String readOutput(Process process) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }
}
