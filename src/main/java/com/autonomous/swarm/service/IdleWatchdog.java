package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.exception.SessionException;
import com.autonomous.swarm.model.CoordinationAction;
import com.autonomous.swarm.model.CoordinationResponse;
import com.autonomous.swarm.model.DecisionKind;
import com.autonomous.swarm.model.OracleResult;
import com.autonomous.swarm.model.TaskContext;
import com.autonomous.swarm.model.TaskStatus;
import com.autonomous.swarm.terminal.OutputSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

import static com.autonomous.swarm.model.SwarmEvent.data;

/**
 * Periodically looks for active tasks that have gone quiet and asks the oracle what to do
 * with them. A task that stays idle past {@code swarm.idle.max-checks} is escalated.
 */
@Slf4j
@Service
public class IdleWatchdog {

    static final String IDLE_EVENT = "idle_watchdog";
    private static final int OUTPUT_LINES = 20;

    private final TaskRegistry registry;
    private final SessionManager sessionManager;
    private final CoordinationOracleClient oracleClient;
    private final DecisionLoop decisionLoop;
    private final SwarmEventBroadcaster broadcaster;
    private final ChatNotifier chat;
    private final SwarmProperties properties;

    public IdleWatchdog(TaskRegistry registry,
                        SessionManager sessionManager,
                        CoordinationOracleClient oracleClient,
                        DecisionLoop decisionLoop,
                        SwarmEventBroadcaster broadcaster,
                        ChatNotifier chat,
                        SwarmProperties properties) {
        this.registry = registry;
        this.sessionManager = sessionManager;
        this.oracleClient = oracleClient;
        this.decisionLoop = decisionLoop;
        this.broadcaster = broadcaster;
        this.chat = chat;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${swarm.idle.scan-interval-ms:60000}",
        initialDelayString = "${swarm.idle.scan-interval-ms:60000}")
    public void scanIdleSessions() {
        Instant now = Instant.now();
        Duration threshold = properties.getIdle().getThreshold();

        for (TaskContext ctx : registry.getAll()) {
            if (ctx.getStatus() != TaskStatus.ACTIVE) {
                continue;
            }
            Duration idle = Duration.between(ctx.getLastActivityAt(), now);
            if (idle.compareTo(threshold) < 0 || registry.isInFlight(ctx.getSessionId())
                || registry.isArbitrationQueued(ctx.getSessionId())) {
                continue;
            }
            try {
                checkSession(ctx, idle, now);
            } catch (SessionException e) {
                log.warn("Idle check for {} failed: {}", ctx.getSessionId(), e.getMessage());
            }
        }
    }

    private void checkSession(TaskContext ctx, Duration idle, Instant now) {
        String sessionId = ctx.getSessionId();
        String output = currentOutput(sessionId);

        // output can change without any classified event, e.g. spinners and build logs
        if (output != null && registry.updateLastSeenOutput(sessionId, output)) {
            ctx.setLastActivityAt(now);
            ctx.setIdleCheckCount(0);
            log.debug("\"{}\" has fresh output, not idle", ctx.getLabel());
            return;
        }

        int maxChecks = properties.getIdle().getMaxChecks();
        ctx.setIdleCheckCount(ctx.getIdleCheckCount() + 1);
        long idleMinutes = Math.round(idle.toMillis() / 60_000.0);
        log.info("\"{}\" idle for {}m (check {}/{})", ctx.getLabel(), idleMinutes, ctx.getIdleCheckCount(), maxChecks);

        if (ctx.getIdleCheckCount() > maxChecks) {
            // escalate once; later scans stay quiet until the task shows activity again
            if (ctx.getIdleCheckCount() == maxChecks + 1) {
                forceEscalate(ctx, idleMinutes, maxChecks);
            }
            return;
        }

        handleIdleCheck(ctx, output != null ? output : "", idleMinutes);
    }

    /**
     * Asks the oracle about one idle task and carries out its answer.
     */
    public void handleIdleCheck(TaskContext ctx, String recentOutput, long idleMinutes) {
        String sessionId = ctx.getSessionId();
        if (!registry.tryBeginDecision(sessionId)) {
            log.debug("Skipping idle check for {}: decision in flight", sessionId);
            return;
        }
        try {
            String promptText = "Session idle for " + idleMinutes + " minutes";
            OracleResult result = oracleClient.requestIdleAssessment(ctx.toSummary(),
                OutputSanitizer.cleanForDisplay(recentOutput), idleMinutes, ctx.getIdleCheckCount(),
                properties.getIdle().getMaxChecks(), ctx.getDecisions());

            if (!result.isDecision()) {
                String reasoning = "Idle check failed: " + result.getError().getMessage();
                ctx.recordDecision(DecisionLoop.entry(IDLE_EVENT, promptText, DecisionKind.ESCALATE, null, reasoning));
                broadcaster.broadcast("escalation", sessionId, data(
                    "reason", "idle_check_failed",
                    "idleMinutes", idleMinutes,
                    "reasoning", reasoning));
                chat.postIdleFailure(ctx.getLabel(), idleMinutes);
                return;
            }

            CoordinationResponse decision = result.getResponse();
            ctx.recordDecision(DecisionLoop.entry(IDLE_EVENT, promptText, decision));
            broadcaster.broadcast("idle_check_decision", sessionId, data(
                "action", decision.getAction().wireName(),
                "idleMinutes", idleMinutes,
                "idleCheckNumber", ctx.getIdleCheckCount(),
                "reasoning", decision.getReasoning()));

            if (decision.getAction() == CoordinationAction.IGNORE) {
                log.info("Idle check for \"{}\": still working, {}", ctx.getLabel(), decision.getReasoning());
            } else {
                chat.postIdleDecision(ctx.getLabel(), idleMinutes, decision);
            }
            decisionLoop.executeDecision(sessionId, decision);
        } finally {
            registry.endDecision(sessionId);
        }
    }

    private void forceEscalate(TaskContext ctx, long idleMinutes, int maxChecks) {
        String reasoning = "Force-escalated after " + maxChecks + " idle checks with no activity";
        log.info("Force-escalating \"{}\": {}", ctx.getLabel(), reasoning);
        ctx.recordDecision(DecisionLoop.entry(IDLE_EVENT, "Session idle for " + idleMinutes + " minutes",
            DecisionKind.ESCALATE, null, reasoning));
        broadcaster.broadcast("escalation", ctx.getSessionId(), data(
            "reason", "idle_timeout",
            "idleMinutes", idleMinutes,
            "idleCheckCount", ctx.getIdleCheckCount(),
            "reasoning", reasoning));
        chat.postIdleEscalation(ctx.getLabel(), idleMinutes);
    }

    private String currentOutput(String sessionId) {
        try {
            return sessionManager.getOutput(sessionId, OUTPUT_LINES);
        } catch (SessionException e) {
            log.debug("Cannot read output of {}: {}", sessionId, e.getMessage());
            return null;
        }
    }
}
