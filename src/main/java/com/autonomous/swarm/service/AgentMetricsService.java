package com.autonomous.swarm.service;

import com.autonomous.swarm.model.AgentMetrics;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per agent type counters for spawned sessions and completed turns. In memory only.
 */
@Service
public class AgentMetricsService {

    private final Map<String, AgentMetrics> metrics = new ConcurrentHashMap<>();

    public void recordSpawn(String agentType) {
        metrics.compute(agentType, (type, current) -> {
            AgentMetrics updated = current != null ? current : empty(type);
            updated.setSpawned(updated.getSpawned() + 1);
            return updated;
        });
    }

    public void recordCompletion(String agentType, long durationMs) {
        metrics.compute(agentType, (type, current) -> {
            AgentMetrics updated = current != null ? current : empty(type);
            updated.setCompleted(updated.getCompleted() + 1);
            updated.setTotalCompletionMs(updated.getTotalCompletionMs() + Math.max(durationMs, 0));
            return updated;
        });
    }

    public List<AgentMetrics> getAll() {
        return metrics.values().stream()
            .map(m -> AgentMetrics.builder()
                .agentType(m.getAgentType())
                .spawned(m.getSpawned())
                .completed(m.getCompleted())
                .totalCompletionMs(m.getTotalCompletionMs())
                .build())
            .sorted(Comparator.comparing(AgentMetrics::getAgentType))
            .collect(Collectors.toList());
    }

    public String formatSummary() {
        if (metrics.isEmpty()) {
            return "No agents spawned yet";
        }
        return getAll().stream()
            .map(m -> String.format("%s: %d spawned, %d turns, avg %.1fs",
                m.getAgentType(), m.getSpawned(), m.getCompleted(), m.getAverageCompletionMs() / 1000.0))
            .collect(Collectors.joining("\n"));
    }

    private static AgentMetrics empty(String agentType) {
        return AgentMetrics.builder().agentType(agentType).build();
    }
}
