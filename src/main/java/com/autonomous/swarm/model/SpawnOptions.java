package com.autonomous.swarm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpawnOptions {
    private String name;
    private String agentType;   // shell | claude | codex | gemini | aider, aliases accepted
    private String workdir;
    private String initialTask;
    private Map<String, String> env;
}
