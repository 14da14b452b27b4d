package com.agentnet.integrations.swarm;

import java.util.List;
import java.util.Map;

/**
 * Result of deploying one swarm.
 */
public record SwarmDeployment(boolean success, String swarmId, List<DeploymentTarget> targets,
        Map<DeploymentTarget, List<String>> distribution, int deployedAgents, long executionTimeMs,
        String error) {

    public static SwarmDeployment failed(String swarmId, long elapsedMs, String error) {
        return new SwarmDeployment(false, swarmId, List.of(), Map.of(), 0, elapsedMs, error);
    }
}
