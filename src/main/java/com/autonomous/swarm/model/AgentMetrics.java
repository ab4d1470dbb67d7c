package com.autonomous.swarm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMetrics {
    private String agentType;
    private long spawned;
    private long completed;
    private long totalCompletionMs;

    public double getAverageCompletionMs() {
        return completed == 0 ? 0.0 : (double) totalCompletionMs / completed;
    }
}
