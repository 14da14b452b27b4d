package com.agentnet.coordinator;

public record NetworkHealthSummary(int totalSystems, int connectedSystems, int totalAgents, int activeAgents,
        CoordinationStatus coordinationStatus, double networkEfficiency, double uptimePercentage) {
}
