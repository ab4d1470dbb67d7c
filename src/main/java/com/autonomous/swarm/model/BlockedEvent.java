package com.autonomous.swarm.model;

import lombok.Value;

/**
 * The process is showing an interactive prompt and waiting for input.
 */
@Value
public class BlockedEvent {
    PromptInfo promptInfo;
    boolean autoResponded;

    public String promptText() {
        if (promptInfo == null) {
            return "";
        }
        if (promptInfo.getPrompt() != null) {
            return promptInfo.getPrompt();
        }
        return promptInfo.getInstructions() != null ? promptInfo.getInstructions() : "";
    }
}
