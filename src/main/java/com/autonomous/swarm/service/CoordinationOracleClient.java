package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.exception.OracleException;
import com.autonomous.swarm.exception.OracleTimeoutException;
import com.autonomous.swarm.model.CoordinationDecision;
import com.autonomous.swarm.model.OracleResult;
import com.autonomous.swarm.model.TaskContextSummary;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Narrow boundary around the {@link DecisionOracle}: builds the prompt, bounds the call by the
 * configured timeout and parses the reply. Failures come back as {@link OracleResult#failed}.
 */
@Slf4j
@Service
public class CoordinationOracleClient {

    private final DecisionOracle oracle;
    private final SwarmProperties properties;
    private final CoordinationResponseParser parser = new CoordinationResponseParser();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public CoordinationOracleClient(DecisionOracle oracle, SwarmProperties properties) {
        this.oracle = oracle;
        this.properties = properties;
    }

    public OracleResult requestBlockedDecision(TaskContextSummary task, String promptText, String recentOutput,
                                               List<CoordinationDecision> history) {
        return request(task, CoordinationPrompts.blockedPrompt(task, promptText, recentOutput, history));
    }

    public OracleResult requestTurnAssessment(TaskContextSummary task, String turnOutput,
                                              List<CoordinationDecision> history) {
        return request(task, CoordinationPrompts.turnCompletePrompt(task, turnOutput, history));
    }

    public OracleResult requestIdleAssessment(TaskContextSummary task, String recentOutput, long idleMinutes,
                                              int checkNumber, int maxChecks,
                                              List<CoordinationDecision> history) {
        return request(task, CoordinationPrompts.idleCheckPrompt(
            task, recentOutput, idleMinutes, checkNumber, maxChecks, history));
    }

    private OracleResult request(TaskContextSummary task, String prompt) {
        Duration timeout = properties.getOracle().getTimeout();
        Future<String> call = executor.submit(() -> oracle.decide(task, prompt));
        try {
            String raw = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return OracleResult.decision(parser.parse(raw));
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Oracle timed out for {}", task.getSessionId());
            return OracleResult.failed(new OracleTimeoutException(timeout));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.warn("Oracle call failed for {}: {}", task.getSessionId(), cause.getMessage());
            return OracleResult.failed(cause instanceof OracleException oracleException
                ? oracleException
                : new OracleException("Oracle call failed: " + cause.getMessage(), cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return OracleResult.failed(new OracleException("Interrupted waiting for oracle", e));
        } catch (OracleException e) {
            log.warn("Unusable oracle reply for {}: {}", task.getSessionId(), e.getMessage());
            return OracleResult.failed(e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
