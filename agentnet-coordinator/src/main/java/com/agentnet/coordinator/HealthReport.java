package com.agentnet.coordinator;

import com.agentnet.integrations.SystemIntegration;

import java.util.Map;

public record HealthReport(CoordinationStatus coordinationStatus, Map<String, SystemIntegration> systemHealth,
        AgentHealth agentHealth, NetworkPerformanceMetrics networkMetrics, NetworkHealthSummary healthSummary,
        long timestamp) {

    public HealthReport {
        systemHealth = Map.copyOf(systemHealth);
    }

    public record AgentHealth(int total, int active, int idle, int busy, int error, int offline) {
    }
}
