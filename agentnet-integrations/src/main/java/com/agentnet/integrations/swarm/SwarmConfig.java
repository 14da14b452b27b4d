package com.agentnet.integrations.swarm;

import java.util.Map;

/**
 * @param maxAgents requested swarm size cap; zero or less means the configured maximum
 */
public record SwarmConfig(String name, int maxAgents, Map<String, Object> settings) {

    public SwarmConfig {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static SwarmConfig named(String name) {
        return new SwarmConfig(name, 0, Map.of());
    }
}
