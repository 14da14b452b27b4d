package com.agentnet.coordinator;

import com.agentnet.coordinator.intelligence.IntelligenceInsights;
import com.agentnet.integrations.SystemIntegration;
import com.agentnet.registry.AgentInfo;
import com.agentnet.registry.AgentStatus;

import java.util.Map;

/**
 * Snapshot of the coordinator's view of the network. The agent map mirrors the
 * registry as of the last refresh.
 */
public record NetworkState(Map<String, AgentInfo> activeAgents, Map<String, SystemIntegration> systemIntegrations,
        NetworkPerformanceMetrics performanceMetrics, CoordinationStatus coordinationStatus,
        IntelligenceInsights intelligenceInsights, long createdAt, long lastUpdated) {

    public NetworkState {
        activeAgents = Map.copyOf(activeAgents);
        systemIntegrations = Map.copyOf(systemIntegrations);
    }

    public long countAgents(AgentStatus status) {
        return activeAgents.values().stream().filter(a -> a.getStatus() == status).count();
    }

    public NetworkHealthSummary healthSummary() {
        int connected = (int) systemIntegrations.values().stream().filter(SystemIntegration::isConnected).count();
        return new NetworkHealthSummary(systemIntegrations.size(), connected, activeAgents.size(),
                (int) countAgents(AgentStatus.ACTIVE), coordinationStatus,
                performanceMetrics.networkEfficiency(), performanceMetrics.uptimePercentage());
    }
}
