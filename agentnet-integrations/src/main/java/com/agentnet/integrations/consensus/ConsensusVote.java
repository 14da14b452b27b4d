package com.agentnet.integrations.consensus;

import java.util.Map;

/**
 * Raw output of a {@link ConsensusEngine}. {@code selectedOption} is null when no
 * consensus was reached.
 */
public record ConsensusVote(DecisionOption selectedOption, Map<String, Integer> voteDistribution,
        boolean consensusAchieved) {

    public ConsensusVote {
        voteDistribution = voteDistribution == null ? Map.of() : Map.copyOf(voteDistribution);
    }

    public static ConsensusVote noConsensus() {
        return new ConsensusVote(null, Map.of(), false);
    }
}
