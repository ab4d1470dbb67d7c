package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.exception.SessionException;
import com.autonomous.swarm.model.BlockedEvent;
import com.autonomous.swarm.model.CoordinationAction;
import com.autonomous.swarm.model.CoordinationDecision;
import com.autonomous.swarm.model.CoordinationResponse;
import com.autonomous.swarm.model.DecisionKind;
import com.autonomous.swarm.model.OracleResult;
import com.autonomous.swarm.model.PendingDecision;
import com.autonomous.swarm.model.SupervisionLevel;
import com.autonomous.swarm.model.TaskContext;
import com.autonomous.swarm.model.TaskStatus;
import com.autonomous.swarm.model.TurnCompleteEvent;
import com.autonomous.swarm.terminal.OutputSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import static com.autonomous.swarm.model.SwarmEvent.data;

/**
 * Arbitrates blocked prompts and finished turns for supervised sessions.
 * <p>
 * At most one arbitration runs per session, enforced by {@link TaskRegistry#tryBeginDecision}.
 * Oracle failures become an {@code escalate} (blocked prompt) or {@code complete} (finished turn)
 * decision. Session I/O failures while executing a decision propagate to the caller.
 */
@Slf4j
@Service
public class DecisionLoop {

    static final String AUTO_RESOLVED_REASONING = "Handled by auto-response rules";
    static final String INVALID_BLOCKED_REASONING = "Oracle returned invalid coordination response";
    static final String INVALID_TURN_REASONING = "Oracle returned invalid response, defaulting to complete";
    static final String NOTIFY_REASONING = "Supervision level is notify, broadcasting only";

    private final SessionManager sessionManager;
    private final TaskRegistry registry;
    private final CoordinationOracleClient oracleClient;
    private final SwarmEventBroadcaster broadcaster;
    private final ChatNotifier chat;
    private final SwarmProperties properties;

    private volatile SupervisionLevel supervisionLevel;

    public DecisionLoop(SessionManager sessionManager,
                        TaskRegistry registry,
                        CoordinationOracleClient oracleClient,
                        SwarmEventBroadcaster broadcaster,
                        ChatNotifier chat,
                        SwarmProperties properties) {
        this.sessionManager = sessionManager;
        this.registry = registry;
        this.oracleClient = oracleClient;
        this.broadcaster = broadcaster;
        this.chat = chat;
        this.properties = properties;
        this.supervisionLevel = properties.getSupervisionLevel();
    }

    public SupervisionLevel getSupervisionLevel() {
        return supervisionLevel;
    }

    public void setSupervisionLevel(SupervisionLevel supervisionLevel) {
        this.supervisionLevel = supervisionLevel;
    }

    public void handleBlocked(String sessionId, TaskContext taskCtx, BlockedEvent event) {
        String promptText = event.promptText();
        String promptType = event.getPromptInfo() != null ? event.getPromptInfo().getType() : null;
        taskCtx.setLastActivityAt(Instant.now());

        if (event.isAutoResponded()) {
            taskCtx.setAutoResolvedCount(taskCtx.getAutoResolvedCount() + 1);
            taskCtx.recordDecision(entry("blocked", promptText, DecisionKind.AUTO_RESOLVED, null,
                AUTO_RESOLVED_REASONING));
            broadcaster.broadcast("blocked_auto_resolved", sessionId, data(
                "prompt", promptText,
                "promptType", promptType,
                "autoResolvedCount", taskCtx.getAutoResolvedCount()));
            chat.postAutoApproval(taskCtx.getLabel(), promptText, taskCtx.getAutoResolvedCount());
            return;
        }

        broadcaster.broadcast("blocked", sessionId, data(
            "prompt", promptText,
            "promptType", promptType,
            "supervisionLevel", supervisionLevel.name().toLowerCase(Locale.ROOT)));

        int maxAutoResponses = properties.getMaxAutoResponses();
        if (taskCtx.getAutoResolvedCount() >= maxAutoResponses) {
            String reasoning = "Escalating after " + maxAutoResponses + " consecutive auto-responses";
            log.info("{} for {}", reasoning, sessionId);
            taskCtx.recordDecision(entry("blocked", promptText, DecisionKind.ESCALATE, null, reasoning));
            broadcaster.broadcast("escalation", sessionId, data(
                "prompt", promptText,
                "reason", "max_auto_responses_exceeded",
                "reasoning", reasoning));
            chat.postEscalation(taskCtx.getLabel(), reasoning);
            return;
        }

        switch (supervisionLevel) {
            case AUTONOMOUS -> decideAutonomously(sessionId, taskCtx, promptText);
            case CONFIRM -> queueForConfirmation(sessionId, taskCtx, promptText);
            case NOTIFY -> taskCtx.recordDecision(
                entry("blocked", promptText, DecisionKind.ESCALATE, null, NOTIFY_REASONING));
        }
    }

    public void handleTurnComplete(String sessionId, TaskContext taskCtx, TurnCompleteEvent event) {
        if (!registry.tryBeginDecision(sessionId)) {
            log.debug("Skipping turn assessment for {}: decision in flight", sessionId);
            return;
        }
        try {
            taskCtx.setLastActivityAt(Instant.now());
            String turnOutput = OutputSanitizer.cleanForDisplay(event.getResponse());
            if (turnOutput.isEmpty()) {
                turnOutput = OutputSanitizer.cleanForDisplay(recentOutput(sessionId));
            }

            OracleResult result = oracleClient.requestTurnAssessment(
                taskCtx.toSummary(), turnOutput, taskCtx.getDecisions());
            CoordinationResponse decision;
            if (result.isDecision()) {
                decision = result.getResponse();
            } else {
                log.warn("Turn assessment for {} failed ({}), completing", sessionId, result.getError().getMessage());
                decision = CoordinationResponse.of(CoordinationAction.COMPLETE, INVALID_TURN_REASONING);
            }

            log.info("Turn assessment for \"{}\": {}", taskCtx.getLabel(), decision.getAction().wireName());
            taskCtx.recordDecision(entry("turn_complete", "Agent finished a turn", decision));
            broadcaster.broadcast("turn_assessment", sessionId, data(
                "action", decision.getAction().wireName(),
                "reasoning", decision.getReasoning()));

            if (decision.getAction() == CoordinationAction.RESPOND) {
                chat.postTurnContinuation(taskCtx.getLabel(), decision.describeResponse());
            } else if (decision.getAction() == CoordinationAction.ESCALATE) {
                chat.postTurnEscalation(taskCtx.getLabel(), decision.getReasoning());
            }

            executeDecision(sessionId, decision);
        } finally {
            registry.endDecision(sessionId);
        }
    }

    /**
     * Carries out a decision against the session.
     *
     * @throws SessionException if the session cannot be written to or stopped
     */
    public void executeDecision(String sessionId, CoordinationResponse decision) {
        switch (decision.getAction()) {
            case RESPOND -> {
                if (decision.isUseKeys() && decision.getKeys() != null) {
                    sessionManager.sendKeys(sessionId, decision.getKeys());
                } else if (decision.getResponse() != null) {
                    sessionManager.send(sessionId, decision.getResponse());
                }
            }
            case COMPLETE -> completeTask(sessionId, decision);
            case ESCALATE -> broadcaster.broadcast("escalation", sessionId,
                data("reasoning", decision.getReasoning()));
            case IGNORE -> log.debug("Ignoring event for {}: {}", sessionId, decision.getReasoning());
        }
    }

    /**
     * Resolves a decision queued under {@link SupervisionLevel#CONFIRM}. An approved override is
     * always sent as a {@code respond}.
     *
     * @throws IllegalStateException if nothing is pending for the session
     */
    public void confirmDecision(String sessionId, boolean approved, CoordinationResponse override) {
        PendingDecision pending = registry.removePending(sessionId)
            .orElseThrow(() -> new IllegalStateException("No pending decision for session " + sessionId));
        Optional<TaskContext> taskCtx = registry.get(sessionId);

        if (!approved) {
            taskCtx.ifPresent(ctx -> ctx.recordDecision(entry("blocked", pending.getPromptText(),
                DecisionKind.ESCALATE, null, "Human rejected the suggested action")));
            broadcaster.broadcast("confirmation_rejected", sessionId, data("prompt", pending.getPromptText()));
            return;
        }

        CoordinationResponse decision = override == null ? pending.getSuggestion() : CoordinationResponse.builder()
            .action(CoordinationAction.RESPOND)
            .response(override.getResponse())
            .useKeys(override.isUseKeys())
            .keys(override.getKeys())
            .reasoning("Human-approved (with override)")
            .build();
        taskCtx.ifPresent(ctx -> {
            ctx.recordDecision(entry("blocked", pending.getPromptText(), DecisionKind.of(decision.getAction()),
                decision.describeResponse(), "Human-approved: " + decision.getReasoning()));
            ctx.setAutoResolvedCount(0);
        });

        executeDecision(sessionId, decision);
        broadcaster.broadcast("confirmation_approved", sessionId, data(
            "action", decision.getAction().wireName(),
            "response", decision.getResponse(),
            "useKeys", decision.isUseKeys(),
            "keys", decision.getKeys()));
    }

    private void decideAutonomously(String sessionId, TaskContext taskCtx, String promptText) {
        if (!registry.tryBeginDecision(sessionId)) {
            log.debug("Skipping duplicate decision for {}: decision in flight", sessionId);
            return;
        }
        try {
            OracleResult result = oracleClient.requestBlockedDecision(
                taskCtx.toSummary(), promptText, recentOutput(sessionId), taskCtx.getDecisions());

            if (!result.isDecision()) {
                String reasoning = failureReasoning(result);
                taskCtx.recordDecision(entry("blocked", promptText, DecisionKind.ESCALATE, null, reasoning));
                broadcaster.broadcast("escalation", sessionId, data(
                    "prompt", promptText,
                    "reason", result.isParseFailure() ? "invalid_oracle_response" : "oracle_failure",
                    "reasoning", reasoning));
                chat.postEscalation(taskCtx.getLabel(), reasoning);
                return;
            }

            CoordinationResponse decision = result.getResponse();
            if (decision.getAction() == CoordinationAction.RESPOND) {
                taskCtx.setAutoResolvedCount(Math.max(0, taskCtx.getAutoResolvedCount() - 1));
            }
            log.info("Decision for \"{}\": {}", taskCtx.getLabel(), decision.getAction().wireName());
            taskCtx.recordDecision(entry("blocked", promptText, decision));
            broadcaster.broadcast("coordination_decision", sessionId, data(
                "action", decision.getAction().wireName(),
                "response", decision.getResponse(),
                "useKeys", decision.isUseKeys(),
                "keys", decision.getKeys(),
                "reasoning", decision.getReasoning()));
            chat.postDecision(taskCtx.getLabel(), decision);

            executeDecision(sessionId, decision);
        } finally {
            registry.endDecision(sessionId);
        }
    }

    private void queueForConfirmation(String sessionId, TaskContext taskCtx, String promptText) {
        if (!registry.tryBeginDecision(sessionId)) {
            log.debug("Skipping duplicate confirmation for {}: decision in flight", sessionId);
            return;
        }
        try {
            String output = recentOutput(sessionId);
            OracleResult result = oracleClient.requestBlockedDecision(
                taskCtx.toSummary(), promptText, output, taskCtx.getDecisions());
            CoordinationResponse suggestion = result.isDecision()
                ? result.getResponse()
                : CoordinationResponse.of(CoordinationAction.ESCALATE, failureReasoning(result) + ", needs human review");

            registry.putPending(PendingDecision.builder()
                .sessionId(sessionId)
                .promptText(promptText)
                .recentOutput(output)
                .suggestion(suggestion)
                .createdAt(Instant.now())
                .build());
            broadcaster.broadcast("pending_confirmation", sessionId, data(
                "prompt", promptText,
                "suggestedAction", suggestion.getAction().wireName(),
                "suggestedResponse", suggestion.describeResponse(),
                "reasoning", suggestion.getReasoning()));
        } finally {
            registry.endDecision(sessionId);
        }
    }

    private void completeTask(String sessionId, CoordinationResponse decision) {
        Optional<TaskContext> taskCtx = registry.get(sessionId);
        taskCtx.ifPresent(ctx -> ctx.setStatus(TaskStatus.COMPLETED));
        broadcaster.broadcast("task_complete", sessionId, data("reasoning", decision.getReasoning()));

        String label = taskCtx.map(TaskContext::getLabel).orElse(sessionId);
        chat.postCompletion(label, recentOutput(sessionId));

        try {
            sessionManager.stop(sessionId);
        } finally {
            registry.remove(sessionId);
        }
        log.info("Completed \"{}\": {}", label, decision.getReasoning());
    }

    private String recentOutput(String sessionId) {
        try {
            return sessionManager.getOutput(sessionId);
        } catch (SessionException e) {
            log.debug("No output for {}: {}", sessionId, e.getMessage());
            return "";
        }
    }

    private static String failureReasoning(OracleResult result) {
        if (result.isParseFailure()) {
            return INVALID_BLOCKED_REASONING;
        }
        return "Oracle unavailable: " + result.getError().getMessage();
    }

    static CoordinationDecision entry(String event, String promptText, CoordinationResponse response) {
        return entry(event, promptText, DecisionKind.of(response.getAction()),
            response.describeResponse(), response.getReasoning());
    }

    static CoordinationDecision entry(String event, String promptText, DecisionKind kind,
                                      String response, String reasoning) {
        return CoordinationDecision.builder()
            .timestamp(Instant.now())
            .event(event)
            .promptText(promptText)
            .decision(kind)
            .response(response)
            .reasoning(reasoning)
            .build();
    }
}
