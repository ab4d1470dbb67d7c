package com.autonomous.swarm.service;

import com.autonomous.swarm.model.CoordinationDecision;
import com.autonomous.swarm.model.DecisionKind;
import com.autonomous.swarm.model.TaskContextSummary;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationPromptsTest {

    private final TaskContextSummary task =
        new TaskContextSummary("session-1", "claude", "fix-login", "Fix the login redirect", "/work/app");

    @Test
    void shouldDescribeBlockedPromptWithTaskAndOptions() {
        String prompt = CoordinationPrompts.blockedPrompt(task, "Allow edit of App.java? (y/n)", "diff...", List.of());

        assertTrue(prompt.contains("fix-login"));
        assertTrue(prompt.contains("Fix the login redirect"));
        assertTrue(prompt.contains("Allow edit of App.java? (y/n)"));
        assertTrue(prompt.contains("respond|complete|escalate|ignore"));
        assertFalse(prompt.contains("Previous decisions"));
    }

    @Test
    void shouldKeepOnlyTailOfLongOutput() {
        String output = "A".repeat(5000) + "END";

        String prompt = CoordinationPrompts.turnCompletePrompt(task, output, List.of());

        assertTrue(prompt.contains("END"));
        assertFalse(prompt.contains("A".repeat(CoordinationPrompts.OUTPUT_CHARS)));
    }

    @Test
    void shouldShowLastFewNonAutomaticDecisions() {
        List<CoordinationDecision> history = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            history.add(decision(DecisionKind.RESPOND, "reason-" + i));
        }
        history.add(decision(DecisionKind.AUTO_RESOLVED, "rule-based"));

        String prompt = CoordinationPrompts.blockedPrompt(task, "Continue?", "", history);

        assertTrue(prompt.contains("Previous decisions"));
        assertFalse(prompt.contains("reason-2"));
        for (int i = 3; i <= 7; i++) {
            assertTrue(prompt.contains("reason-" + i));
        }
        assertFalse(prompt.contains("rule-based"));
    }

    @Test
    void shouldFilterAutoResolvedFromHistory() {
        List<CoordinationDecision> relevant = CoordinationPrompts.relevantHistory(List.of(
            decision(DecisionKind.AUTO_RESOLVED, "a"),
            decision(DecisionKind.ESCALATE, "b"),
            decision(DecisionKind.AUTO_RESOLVED, "c")));

        assertEquals(1, relevant.size());
        assertEquals("b", relevant.get(0).getReasoning());
    }

    @Test
    void shouldNumberIdleChecks() {
        String prompt = CoordinationPrompts.idleCheckPrompt(task, "", 7, 2, 3, List.of());

        assertTrue(prompt.contains("7 minutes"));
        assertTrue(prompt.contains("Idle check 2 of 3"));
    }

    private static CoordinationDecision decision(DecisionKind kind, String reasoning) {
        return CoordinationDecision.builder()
            .timestamp(Instant.now())
            .event("blocked")
            .promptText("Continue?")
            .decision(kind)
            .response(kind == DecisionKind.RESPOND ? "y" : null)
            .reasoning(reasoning)
            .build();
    }
}
