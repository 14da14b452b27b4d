package com.agentnet.integrations.consensus;

import java.util.List;

/**
 * How a conflict was settled.
 *
 * @param resolution chosen option id for consensus, {@code first_come_first_served} otherwise
 * @param winner     winning agent for simple resolution, null for consensus
 */
public record ConflictEscalation(boolean success, Method method, String resolution, String winner,
        String sessionId, List<String> affectedAgents, ConflictComplexity complexity, String error) {

    public enum Method {
        CONSENSUS,
        SIMPLE
    }
}
