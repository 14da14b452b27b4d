package com.agentnet.integrations.consensus;

import java.util.Map;

/**
 * Result of one consensus session.
 *
 * @param decision   selected option, null without consensus
 * @param confidence mean participant confidence, 0 without consensus
 */
public record ConsensusDecision(boolean success, String sessionId, boolean consensusAchieved,
        DecisionOption decision, double confidence, Map<String, Double> participantConfidence,
        Map<String, Integer> voteDistribution, int participants, long executionTimeMs, String error) {

    public static ConsensusDecision failed(String sessionId, int participants, long elapsedMs, String error) {
        return new ConsensusDecision(false, sessionId, false, null, 0.0, Map.of(), Map.of(), participants,
                elapsedMs, error);
    }
}
