package com.autonomous.swarm.service;

import com.autonomous.swarm.model.CoordinationDecision;
import com.autonomous.swarm.model.DecisionKind;
import com.autonomous.swarm.model.TaskContextSummary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the oracle prompts for blocked prompts, finished turns and idle sessions.
 */
public final class CoordinationPrompts {

    static final int HISTORY_SIZE = 5;
    static final int OUTPUT_CHARS = 3000;

    private static final String REPLY_FORMAT =
        "Reply with ONLY a JSON object:\n"
            + "{\"action\": \"respond|complete|escalate|ignore\", \"response\": \"...\", "
            + "\"useKeys\": false, \"keys\": [], \"reasoning\": \"...\"}";

    private CoordinationPrompts() {
    }

    public static String blockedPrompt(TaskContextSummary task, String promptText, String recentOutput,
                                       List<CoordinationDecision> history) {
        StringBuilder prompt = header(task, "is blocked and waiting for input.");
        appendHistory(prompt, history);
        appendOutput(prompt, "Recent terminal output", recentOutput);
        prompt.append("The agent is showing this prompt:\n\"").append(promptText).append("\"\n\n");
        prompt.append("Options:\n");
        prompt.append("1. \"respond\": unblock the agent. For text prompts set \"response\" to the text to send. ")
            .append("For menus that need special keys set \"useKeys\": true and \"keys\" to the sequence, ")
            .append("e.g. [\"enter\"] or [\"down\",\"enter\"].\n");
        prompt.append("2. \"complete\": the original task is finished and the agent is back at its idle prompt.\n");
        prompt.append("3. \"escalate\": the prompt needs human judgment (design choices, unclear requirements, ")
            .append("security-sensitive actions). Do not answer it yourself.\n");
        prompt.append("4. \"ignore\": the prompt is not actually blocking.\n\n");
        prompt.append("Guidelines:\n");
        prompt.append("- Approve tool permission prompts and yes/no confirmations that serve the original task.\n");
        prompt.append("- Escalate choices that could reasonably go either way.\n");
        prompt.append("- If a pull request was just created, do not complete yet: ask the agent to verify its ")
            .append("test plan first.\n");
        prompt.append("- When in doubt, escalate.\n\n");
        prompt.append(REPLY_FORMAT);
        return prompt.toString();
    }

    public static String turnCompletePrompt(TaskContextSummary task, String turnOutput,
                                            List<CoordinationDecision> history) {
        StringBuilder prompt = header(task, "finished a turn and is back at its idle prompt.");
        appendHistory(prompt, history);
        appendOutput(prompt, "Output from this turn", turnOutput);
        prompt.append("Decide whether the OVERALL task is done. Agents work in several turns, ")
            .append("so one finished turn rarely means the task is finished.\n\n");
        prompt.append("Options:\n");
        prompt.append("1. \"respond\": more work is needed. Set \"response\" to the next instruction. ")
            .append("This is the usual case.\n");
        prompt.append("2. \"complete\": every objective of the original task has visible evidence in the output.\n");
        prompt.append("3. \"escalate\": something looks wrong or you cannot tell.\n\n");
        prompt.append("Guidelines:\n");
        prompt.append("- Check each objective of the original task against the output before completing.\n");
        prompt.append("- If the agent only read or analysed code, ask it to do the work.\n");
        prompt.append("- If tests failed or were not run, ask it to fix or run them.\n");
        prompt.append("- In a git checkout, changes must be committed, pushed and opened as a pull request, ")
            .append("and the pull request's test plan verified, before the task is complete.\n");
        prompt.append("- Keep follow-up instructions short and specific.\n\n");
        prompt.append(REPLY_FORMAT);
        return prompt.toString();
    }

    public static String idleCheckPrompt(TaskContextSummary task, String recentOutput, long idleMinutes,
                                         int checkNumber, int maxChecks, List<CoordinationDecision> history) {
        StringBuilder prompt = header(task,
            "has produced no new output for " + idleMinutes + " minutes.");
        prompt.append("Idle check ").append(checkNumber).append(" of ").append(maxChecks)
            .append(" (the session is escalated to a human after ").append(maxChecks).append(").\n");
        appendHistory(prompt, history);
        appendOutput(prompt, "Recent terminal output", recentOutput);
        prompt.append("Options:\n");
        prompt.append("1. \"complete\": the task is done and the agent is back at its prompt.\n");
        prompt.append("2. \"respond\": the agent looks stuck or is waiting on an undetected question. ")
            .append("Send a nudge or an answer.\n");
        prompt.append("3. \"escalate\": something looks wrong. A human should look.\n");
        prompt.append("4. \"ignore\": the agent is still working (building, running tests) and will produce ")
            .append("output soon.\n\n");
        prompt.append("On later checks prefer \"escalate\" over \"ignore\" when unsure.\n\n");
        prompt.append(REPLY_FORMAT);
        return prompt.toString();
    }

    /**
     * The decisions shown to the oracle: the last few that were not rule-based auto responses.
     */
    static List<CoordinationDecision> relevantHistory(List<CoordinationDecision> decisions) {
        List<CoordinationDecision> manual = decisions.stream()
            .filter(d -> d.getDecision() != DecisionKind.AUTO_RESOLVED)
            .collect(Collectors.toList());
        return manual.subList(Math.max(0, manual.size() - HISTORY_SIZE), manual.size());
    }

    private static StringBuilder header(TaskContextSummary task, String situation) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You coordinate a group of coding agents. A ").append(task.getAgentType())
            .append(" agent (\"").append(task.getLabel()).append("\", session ").append(task.getSessionId())
            .append(") ").append(situation).append("\n\n");
        prompt.append("Original task: \"").append(task.getOriginalTask()).append("\"\n");
        prompt.append("Working directory: ").append(task.getWorkdir()).append("\n");
        return prompt;
    }

    private static void appendHistory(StringBuilder prompt, List<CoordinationDecision> history) {
        List<CoordinationDecision> relevant = relevantHistory(history);
        if (relevant.isEmpty()) {
            return;
        }
        prompt.append("\nPrevious decisions for this session:\n");
        for (int i = 0; i < relevant.size(); i++) {
            CoordinationDecision d = relevant.get(i);
            prompt.append("  ").append(i + 1).append(". [").append(d.getEvent()).append("] prompt=\"")
                .append(d.getPromptText() != null ? d.getPromptText() : "").append("\" -> ")
                .append(d.getDecision().wireName());
            if (d.getResponse() != null) {
                prompt.append(" (\"").append(d.getResponse()).append("\")");
            }
            prompt.append(": ").append(d.getReasoning()).append("\n");
        }
    }

    private static void appendOutput(StringBuilder prompt, String title, String output) {
        String text = output != null ? output : "";
        String tail = text.length() > OUTPUT_CHARS ? text.substring(text.length() - OUTPUT_CHARS) : text;
        prompt.append("\n").append(title).append(":\n---\n").append(tail).append("\n---\n\n");
    }
}
