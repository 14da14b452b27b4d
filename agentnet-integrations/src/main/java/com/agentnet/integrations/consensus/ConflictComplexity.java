package com.agentnet.integrations.consensus;

import java.util.Locale;
import java.util.Set;

/**
 * Whether a conflict is simple enough for first-come-first-served or needs a vote.
 */
public record ConflictComplexity(boolean requiresConsensus, String level, int involvedSystems,
        int involvedAgents) {

    private static final Set<String> ESCALATING_SEVERITIES = Set.of("high", "critical");

    public static ConflictComplexity classify(ConflictData conflict) {
        int systems = conflict.systems().size();
        int agents = conflict.agents().size();
        boolean consensus = systems > 1
                || agents > 2
                || ESCALATING_SEVERITIES.contains(conflict.severity().toLowerCase(Locale.ROOT));
        return new ConflictComplexity(consensus, consensus ? "high" : "low", systems, agents);
    }
}
