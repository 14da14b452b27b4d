package com.agentnet.coordinator;

/**
 * Network totals and averages computed on each health check.
 *
 * @param networkEfficiency share of registered agents that are Active, 1.0 for an empty network
 * @param successRate       mean adapter success rate, 1.0 without adapters
 * @param uptimePercentage  share of health checks that were neither Critical nor Offline
 */
public record NetworkPerformanceMetrics(int totalAgents, int activeAgents, double averageCoordinationOverheadMs,
        double networkEfficiency, double successRate, double uptimePercentage, long coordinationCount,
        long lastUpdated) {

    public static NetworkPerformanceMetrics initial(long now) {
        return new NetworkPerformanceMetrics(0, 0, 0.0, 1.0, 1.0, 100.0, 0, now);
    }

    public double errorRate() {
        return 1.0 - successRate;
    }
}
