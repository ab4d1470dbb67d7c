package com.autonomous.swarm.config;

import com.autonomous.swarm.model.SupervisionLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "swarm")
@Data
public class SwarmProperties {

    /** Consecutive auto-resolved prompts allowed before a blocked prompt is force-escalated. */
    private int maxAutoResponses = 10;

    private int maxLogLines = 1000;
    private int recentOutputLines = 50;
    private SupervisionLevel supervisionLevel = SupervisionLevel.AUTONOMOUS;
    private String defaultWorkdir = System.getProperty("user.dir");

    private Duration unregisteredBufferWindow = Duration.ofSeconds(2);
    private Duration toolNotificationInterval = Duration.ofSeconds(30);
    private Duration initialTaskSettleDelay = Duration.ofMillis(300);

    private Idle idle = new Idle();
    private Oracle oracle = new Oracle();
    private Adapters adapters = new Adapters();

    @Data
    public static class Idle {
        private Duration threshold = Duration.ofMinutes(3);
        private int maxChecks = 3;
        private long scanIntervalMs = 60_000;
    }

    @Data
    public static class Oracle {
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Adapters {
        private String path = "config/adapters";
    }
}
