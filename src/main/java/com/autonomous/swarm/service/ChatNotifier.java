package com.autonomous.swarm.service;

import com.autonomous.swarm.model.CoordinationResponse;
import com.autonomous.swarm.terminal.OutputSanitizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Formats operator messages and hands them to the configured {@link ChatMessageSink}.
 * Delivery runs on a background thread so a slow chat backend never holds up a decision.
 */
@Slf4j
@Service
public class ChatNotifier {

    static final String SOURCE = "swarm-coordinator";

    @Autowired(required = false)
    private ChatMessageSink sink;

    private final ExecutorService sender = Executors.newSingleThreadExecutor();

    public ChatNotifier() {
    }

    ChatNotifier(ChatMessageSink sink) {
        this.sink = sink;
    }

    public void postAutoApproval(String label, String promptText, int autoResolvedCount) {
        // 1st, 2nd, then every 5th
        if (autoResolvedCount <= 2 || autoResolvedCount % 5 == 0) {
            post(String.format("[%s] Approved: %s", label, excerpt(promptText, 120)));
        }
    }

    public void postDecision(String label, CoordinationResponse decision) {
        switch (decision.getAction()) {
            case RESPOND -> post(String.format("[%s] %s: %s",
                label, describeRespond(decision, "Responded"), excerpt(decision.getReasoning(), 150)));
            case ESCALATE -> postEscalation(label, decision.getReasoning());
            default -> {
            }
        }
    }

    public void postEscalation(String label, String reasoning) {
        post(String.format("[%s] Needs your attention: %s", label, reasoning));
    }

    public void postTurnContinuation(String label, String followUp) {
        post(String.format("[%s] Turn done, continuing: %s", label, excerpt(followUp, 120)));
    }

    public void postTurnEscalation(String label, String reasoning) {
        post(String.format("[%s] Turn finished, needs your attention: %s", label, reasoning));
    }

    public void postCompletion(String label, String transcript) {
        String summary = OutputSanitizer.extractCompletionSummary(transcript);
        if (summary.isEmpty()) {
            post(String.format("Finished \"%s\".", label));
        } else {
            post(String.format("Finished \"%s\".%n%n%s", label, summary));
        }
    }

    public void postIdleDecision(String label, long idleMinutes, CoordinationResponse decision) {
        switch (decision.getAction()) {
            case RESPOND -> post(String.format("[%s] Idle for %dm: %s",
                label, idleMinutes, describeRespond(decision, "Nudged")));
            case ESCALATE -> post(String.format("[%s] Idle for %dm, needs your attention: %s",
                label, idleMinutes, decision.getReasoning()));
            default -> {
            }
        }
    }

    public void postIdleEscalation(String label, long idleMinutes) {
        post(String.format("[%s] Session has been idle for %d minutes with no progress. Needs your attention.",
            label, idleMinutes));
    }

    public void postIdleFailure(String label, long idleMinutes) {
        post(String.format("[%s] Session idle for %dm and its status could not be determined. Needs your attention.",
            label, idleMinutes));
    }

    public void postLoginRequired(String label, String instructions) {
        post(String.format("[%s] The agent needs you to log in: %s", label, instructions));
    }

    public void postToolRunning(String label, String toolDescription, String devServerUrl) {
        String urlSuffix = devServerUrl != null ? " Dev server: " + devServerUrl + "." : "";
        post(String.format("[%s] Running %s.%s The agent is working outside the terminal, letting it finish.",
            label, toolDescription, urlSuffix));
    }

    public void postError(String label, String message) {
        post(String.format("\"%s\" hit an error: %s", label, OutputSanitizer.cleanForDisplay(message)));
    }

    public void post(String text) {
        ChatMessageSink target = sink;
        if (target == null) {
            log.info("[chat] {}", text);
            return;
        }
        sender.execute(() -> {
            try {
                target.send(text, SOURCE);
            } catch (RuntimeException e) {
                log.warn("Failed to send chat message: {}", e.getMessage());
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        sender.shutdown();
    }

    private static String describeRespond(CoordinationResponse decision, String textVerb) {
        if (decision.isUseKeys() && decision.getKeys() != null) {
            return "Sent keys: " + String.join(", ", decision.getKeys());
        }
        if (decision.getResponse() != null) {
            return textVerb + " " + excerpt(decision.getResponse(), 100);
        }
        return textVerb;
    }

    static String excerpt(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
