package com.autonomous.swarm.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Launch command and output patterns for one agent type, loaded from YAML.
 */
@Data
public class AgentAdapterConfig {
    private String agentType;
    private List<String> aliases = new ArrayList<>();
    private List<String> command = new ArrayList<>();
    private Map<String, String> env = new HashMap<>();

    // Output classification
    private List<String> readyPatterns = new ArrayList<>();
    private List<String> turnCompletePatterns = new ArrayList<>();
    private List<String> loginPatterns = new ArrayList<>();
    private List<String> toolRunningPatterns = new ArrayList<>();
    private List<PromptRule> promptRules = new ArrayList<>();
}
