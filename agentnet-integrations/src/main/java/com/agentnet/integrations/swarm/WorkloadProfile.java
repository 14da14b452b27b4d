package com.agentnet.integrations.swarm;

/**
 * Shape of the work a swarm is being sized for.
 *
 * @param complexity      low, medium or high
 * @param parallelization share of the work that can run in parallel, in [0, 1]
 */
public record WorkloadProfile(String complexity, double parallelization, double durationHours) {

    public static WorkloadProfile defaults() {
        return new WorkloadProfile("medium", 0.8, 1.0);
    }
}
