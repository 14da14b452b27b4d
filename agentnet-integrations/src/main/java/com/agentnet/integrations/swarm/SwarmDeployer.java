package com.agentnet.integrations.swarm;

import java.util.List;

/**
 * Places agents of a swarm on a deployment target. Implementations may block;
 * {@link SwarmAdapter} bounds a whole deployment by the swarm timeout.
 */
public interface SwarmDeployer {

    void deploy(String swarmId, DeploymentTarget target, List<String> agentIds) throws Exception;

    default void terminate(String swarmId) throws Exception {
    }

    /**
     * Accepts every deployment without doing anything.
     */
    static SwarmDeployer noop() {
        return (swarmId, target, agentIds) -> {
        };
    }
}
