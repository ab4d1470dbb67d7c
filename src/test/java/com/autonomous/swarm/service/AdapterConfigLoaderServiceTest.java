package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.model.AgentAdapterConfig;
import com.autonomous.swarm.model.PromptRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdapterConfigLoaderServiceTest {

    @TempDir
    Path tempDir;

    private AdapterConfigLoaderService adapterConfigLoaderService;

    @BeforeEach
    void setUp() {
        adapterConfigLoaderService = new AdapterConfigLoaderService(new SwarmProperties());
        adapterConfigLoaderService.setConfigPath(tempDir.toString());
    }

    @Test
    void shouldLoadBuiltInAdapters() {
        adapterConfigLoaderService.loadConfigs();

        assertTrue(adapterConfigLoaderService.getSupportedAgentTypes()
            .containsAll(List.of("aider", "claude", "codex", "gemini", "shell")));
        AgentAdapterConfig claude = adapterConfigLoaderService.getConfig("claude").orElseThrow();
        assertFalse(claude.getReadyPatterns().isEmpty());
        assertFalse(claude.getPromptRules().isEmpty());
    }

    @Test
    void shouldNormalizeAliases() {
        adapterConfigLoaderService.loadConfigs();

        assertEquals("claude", adapterConfigLoaderService.normalizeAgentType("claude-code"));
        assertEquals("codex", adapterConfigLoaderService.normalizeAgentType("OpenAI"));
        assertEquals("shell", adapterConfigLoaderService.normalizeAgentType(" bash "));
        assertEquals("claude", adapterConfigLoaderService.normalizeAgentType("something-else"));
        assertEquals("claude", adapterConfigLoaderService.normalizeAgentType(null));
    }

    @Test
    void shouldOverrideBuiltInFromConfigDirectory() throws IOException {
        writeYaml("claude.yaml",
            "agent_type: claude\n"
                + "command: [my-claude, --verbose]\n"
                + "ready_patterns:\n"
                + "  - \"ready\"\n");

        adapterConfigLoaderService.loadConfigs();

        AgentAdapterConfig claude = adapterConfigLoaderService.getConfig("claude").orElseThrow();
        assertEquals(List.of("my-claude", "--verbose"), claude.getCommand());
        assertEquals(List.of("ready"), claude.getReadyPatterns());
    }

    @Test
    void shouldLoadCustomAdapterWithPromptRules() throws IOException {
        writeYaml("mock.yml",
            "agent_type: Mock\n"
                + "aliases: [fake]\n"
                + "command: [mock-agent]\n"
                + "env:\n"
                + "  MOCK_MODE: \"1\"\n"
                + "prompt_rules:\n"
                + "  - pattern: \"Continue\\\\?\"\n"
                + "    type: question\n"
                + "    response: \"y\"\n"
                + "    auto_respond: true\n"
                + "    once: true\n"
                + "    description: Continue prompt\n");

        adapterConfigLoaderService.loadConfigs();

        AgentAdapterConfig mock = adapterConfigLoaderService.getConfig("fake").orElseThrow();
        assertEquals("mock", mock.getAgentType());
        assertEquals("1", mock.getEnv().get("MOCK_MODE"));
        PromptRule rule = mock.getPromptRules().get(0);
        assertEquals("Continue\\?", rule.getPattern());
        assertTrue(rule.isAutoRespond());
        assertTrue(rule.isOnce());
        assertEquals("y", rule.getResponse());
    }

    @Test
    void shouldSkipAdapterWithoutCommand() throws IOException {
        writeYaml("broken.yaml", "agent_type: broken\n");

        adapterConfigLoaderService.loadConfigs();

        assertFalse(adapterConfigLoaderService.getSupportedAgentTypes().contains("broken"));
    }

    @Test
    void shouldIgnoreMissingConfigDirectory() {
        adapterConfigLoaderService.setConfigPath(tempDir.resolve("nope").toString());

        adapterConfigLoaderService.loadConfigs();

        assertTrue(adapterConfigLoaderService.getConfig("claude").isPresent());
    }

    private void writeYaml(String name, String content) throws IOException {
        File file = tempDir.resolve(name).toFile();
        try (FileWriter writer = new FileWriter(file)) {
            writer.write(content);
        }
    }
}
