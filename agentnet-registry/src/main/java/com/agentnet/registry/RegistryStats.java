package com.agentnet.registry;

import java.util.Map;

/**
 * Point-in-time counters of the registry.
 */
public record RegistryStats(int totalAgents, Map<AgentStatus, Integer> byStatus,
        Map<String, Integer> bySystem, int capabilityCount) {

    public int count(AgentStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public double ratio(AgentStatus status) {
        return totalAgents == 0 ? 0.0 : (double) count(status) / totalAgents;
    }
}
