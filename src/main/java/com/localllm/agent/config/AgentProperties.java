package com.localllm.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Strongly-typed configuration for the orchestration core.
 * Bound from application.yml under the "agent" prefix.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private Providers providers = new Providers();
    private Supervisor supervisor = new Supervisor();
    private Resilience resilience = new Resilience();
    private Session session = new Session();
    private Turn turn = new Turn();

    @Data
    public static class Providers {
        private String configPath = "./mcp_config.json";
        /** Off in tests that want an empty registry. */
        private boolean includeBuiltIns = true;
    }

    @Data
    public static class Supervisor {
        /** Immediate connect attempts before a provider is reported unavailable. */
        private int connectAttempts = 1;
        private Duration probeInterval = Duration.ofSeconds(30);
        private Duration reconnectBaseDelay = Duration.ofSeconds(2);
        private Duration reconnectMaxDelay = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Resilience {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
    }

    @Data
    public static class Session {
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration reconnectGrace = Duration.ofSeconds(60);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofSeconds(15);
        /** Messages kept in Redis per conversation. */
        private int historyLimit = 100;
        private Duration historyTtl = Duration.ofHours(24);
    }

    @Data
    public static class Turn {
        private int maxIterations = 10;
    }
}
