package com.autonomous.swarm.service;

import com.autonomous.swarm.config.SwarmProperties;
import com.autonomous.swarm.model.AgentAdapterConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads agent adapter definitions. Built-ins come from {@code adapters/*.yaml} on the classpath,
 * files in {@code swarm.adapters.path} replace them by agent type.
 */
@Slf4j
@Service
public class AdapterConfigLoaderService {

    static final String DEFAULT_AGENT_TYPE = "claude";
    private static final String BUILT_IN_LOCATION = "classpath*:adapters/*.yaml";

    private String configPath;

    private final Map<String, AgentAdapterConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public AdapterConfigLoaderService(SwarmProperties properties) {
        this.configPath = properties.getAdapters().getPath();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadConfigs() {
        configs.clear();
        aliases.clear();
        loadBuiltIns();
        loadOverrides();
        log.info("Loaded adapters for agent types {}", getSupportedAgentTypes());
    }

    private void loadBuiltIns() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(BUILT_IN_LOCATION);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(yamlMapper.readValue(in, AgentAdapterConfig.class), resource.getFilename());
                } catch (IOException e) {
                    log.warn("Failed to load built-in adapter {}: {}", resource.getFilename(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan built-in adapters: {}", e.getMessage());
        }
    }

    private void loadOverrides() {
        if (configPath == null) {
            return;
        }
        File configDir = new File(configPath);
        if (!configDir.exists() || !configDir.isDirectory()) {
            log.debug("Adapter override directory not found: {}", configPath);
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return;
        }

        for (File file : yamlFiles) {
            try {
                register(yamlMapper.readValue(file, AgentAdapterConfig.class), file.getName());
            } catch (IOException e) {
                log.warn("Failed to load adapter from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    private void register(AgentAdapterConfig config, String source) {
        if (config.getAgentType() == null || config.getCommand().isEmpty()) {
            log.warn("Ignoring adapter {}: agent_type and command are required", source);
            return;
        }
        String type = config.getAgentType().toLowerCase(Locale.ROOT).trim();
        config.setAgentType(type);
        configs.put(type, config);
        aliases.put(type, type);
        for (String alias : config.getAliases()) {
            aliases.put(alias.toLowerCase(Locale.ROOT).trim(), type);
        }
        log.debug("Registered adapter {} from {}", type, source);
    }

    /**
     * Maps user input such as {@code "claude-code"} or {@code "bash"} to a known agent type.
     * Unknown or blank input falls back to {@code claude}.
     */
    public String normalizeAgentType(String input) {
        if (input == null || input.isBlank()) {
            return DEFAULT_AGENT_TYPE;
        }
        return aliases.getOrDefault(input.toLowerCase(Locale.ROOT).trim(), DEFAULT_AGENT_TYPE);
    }

    public Optional<AgentAdapterConfig> getConfig(String agentType) {
        return Optional.ofNullable(configs.get(normalizeAgentType(agentType)));
    }

    public Set<String> getSupportedAgentTypes() {
        return new TreeSet<>(configs.keySet());
    }
}
