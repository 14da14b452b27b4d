package com.agentnet.integrations;

import java.util.Map;

/**
 * Snapshot of one subsystem integration as reported by its adapter.
 */
public record SystemIntegration(String systemName, IntegrationStatus integrationStatus, int activeAgents,
        double coordinationOverheadMs, double successRate, long lastHealthCheck, long errorCount,
        Map<String, Object> metadata) {

    public SystemIntegration {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isConnected() {
        return integrationStatus == IntegrationStatus.CONNECTED;
    }
}
