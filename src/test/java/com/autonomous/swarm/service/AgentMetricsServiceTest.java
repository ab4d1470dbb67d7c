package com.autonomous.swarm.service;

import com.autonomous.swarm.model.AgentMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentMetricsServiceTest {

    private AgentMetricsService metricsService;

    @BeforeEach
    void setUp() {
        metricsService = new AgentMetricsService();
    }

    @Test
    void shouldReportNothingBeforeFirstSpawn() {
        assertTrue(metricsService.getAll().isEmpty());
        assertEquals("No agents spawned yet", metricsService.formatSummary());
    }

    @Test
    void shouldAggregatePerAgentType() {
        metricsService.recordSpawn("codex");
        metricsService.recordSpawn("claude");
        metricsService.recordSpawn("claude");
        metricsService.recordCompletion("claude", 2000);
        metricsService.recordCompletion("claude", 4000);

        List<AgentMetrics> all = metricsService.getAll();

        assertEquals(2, all.size());
        assertEquals("claude", all.get(0).getAgentType());
        assertEquals(2, all.get(0).getSpawned());
        assertEquals(2, all.get(0).getCompleted());
        assertEquals(3000.0, all.get(0).getAverageCompletionMs(), 0.001);
        assertEquals(0.0, all.get(1).getAverageCompletionMs(), 0.001);
    }

    @Test
    void shouldFormatSummaryLines() {
        metricsService.recordSpawn("claude");
        metricsService.recordCompletion("claude", 1500);

        assertEquals("claude: 1 spawned, 1 turns, avg 1.5s", metricsService.formatSummary());
    }

    @Test
    void shouldHandOutCopies() {
        metricsService.recordSpawn("claude");

        metricsService.getAll().get(0).setSpawned(99);

        assertEquals(1, metricsService.getAll().get(0).getSpawned());
    }
}
