package com.autonomous.swarm.integration;

import com.autonomous.swarm.model.DecisionKind;
import com.autonomous.swarm.model.SpawnOptions;
import com.autonomous.swarm.model.TaskContext;
import com.autonomous.swarm.process.AgentProcess;
import com.autonomous.swarm.process.AgentProcessFactory;
import com.autonomous.swarm.service.AdapterConfigLoaderService;
import com.autonomous.swarm.service.DecisionOracle;
import com.autonomous.swarm.service.SessionManager;
import com.autonomous.swarm.service.SwarmCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringBootTest(properties = {
    "swarm.idle.scan-interval-ms=3600000",
    "swarm.initial-task-settle-delay=0ms",
    "swarm.adapters.path=target/no-adapter-overrides"
})
class EndToEndFlowTest {

    @Autowired
    private SwarmCoordinator coordinator;

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private AdapterConfigLoaderService adapterConfigLoaderService;

    @MockBean
    private DecisionOracle oracle;

    @MockBean
    private AgentProcessFactory processFactory;

    @TempDir
    Path tempDir;

    private final AgentProcess process = mock(AgentProcess.class);
    private final AtomicReference<Consumer<String>> output = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        when(processFactory.spawn(anyList(), any(), anyMap(), any(), any())).thenAnswer(invocation -> {
            output.set(invocation.getArgument(3));
            return process;
        });
    }

    @Test
    void shouldLoadBuiltInAdapters() {
        assertTrue(adapterConfigLoaderService.getSupportedAgentTypes().contains("claude"));
        assertEquals("shell", adapterConfigLoaderService.normalizeAgentType("bash"));
    }

    @Test
    void shouldAnswerBlockedPromptWithOracleDecision() throws Exception {
        when(oracle.decide(any(), anyString()))
            .thenReturn("{\"action\":\"respond\",\"response\":\"y\",\"reasoning\":\"overwriting is part of the task\"}");
        String sessionId = spawnReadySession("Regenerate the config");

        output.get().accept("Overwrite config.json? (y/n)\n");

        verify(process, timeout(5000)).write("y\n");
        TaskContext ctx = coordinator.getTaskContext(sessionId).orElseThrow();
        assertTrue(ctx.getDecisions().stream().anyMatch(d -> d.getDecision() == DecisionKind.RESPOND));
    }

    @Test
    void shouldAutoRespondToTrustPromptWithoutOracle() throws Exception {
        String sessionId = spawnReadySession(null);

        output.get().accept("Do you trust the files in this folder?\n");

        verify(process, timeout(5000)).writeKeys(List.of("enter"));
        TaskContext ctx = coordinator.getTaskContext(sessionId).orElseThrow();
        for (int i = 0; i < 50 && ctx.getAutoResolvedCount() == 0; i++) {
            Thread.sleep(100);
        }
        assertEquals(1, ctx.getAutoResolvedCount());
        verify(oracle, never()).decide(any(), anyString());
    }

    @Test
    void shouldStopSessionWhenTurnCompletesTask() throws Exception {
        when(oracle.decide(any(), anyString()))
            .thenReturn("{\"action\":\"complete\",\"reasoning\":\"tests pass and PR is open\"}");
        String sessionId = spawnReadySession(null);

        sessionManager.send(sessionId, "Fix the login bug");
        output.get().accept("Fixed redirect in LoginController\nAll tests pass\n>\n");

        verify(process, timeout(5000)).kill();
        assertTrue(sessionManager.getSession(sessionId).isEmpty());
        assertEquals("", sessionManager.getOutput(sessionId));
    }

    private String spawnReadySession(String initialTask) {
        String sessionId = coordinator.spawnTask(SpawnOptions.builder()
            .agentType("claude-code")
            .workdir(tempDir.toString())
            .initialTask(initialTask)
            .build(), "e2e");
        output.get().accept("Welcome to Claude\n");
        return sessionId;
    }
}
