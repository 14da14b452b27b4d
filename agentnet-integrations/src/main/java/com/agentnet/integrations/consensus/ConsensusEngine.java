package com.agentnet.integrations.consensus;

import com.agentnet.registry.AgentInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The voting mechanism behind {@link ConsensusAdapter}. Implementations may block;
 * the adapter bounds each call by the consensus timeout.
 */
@FunctionalInterface
public interface ConsensusEngine {

    ConsensusVote vote(Map<String, Object> context, List<AgentInfo> participants,
            List<DecisionOption> options) throws Exception;

    /**
     * Selects the first option, with votes spread evenly over all options.
     */
    static ConsensusEngine firstOption() {
        return (context, participants, options) -> {
            if (options.isEmpty()) {
                return ConsensusVote.noConsensus();
            }
            Map<String, Integer> distribution = new LinkedHashMap<>();
            for (DecisionOption option : options) {
                distribution.put(option.optionId(), participants.size() / options.size());
            }
            return new ConsensusVote(options.get(0), distribution, true);
        };
    }
}
