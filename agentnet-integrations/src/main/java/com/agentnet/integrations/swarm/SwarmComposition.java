package com.agentnet.integrations.swarm;

import java.util.List;
import java.util.Map;

public record SwarmComposition(int optimalSize, List<String> selectedAgents, Map<String, Double> agentScores,
        ExpectedPerformance expectedPerformance) {

    /**
     * @param efficiency          capped at 1.0
     * @param completionTimeHours infinite when no agent was selected
     */
    public record ExpectedPerformance(double efficiency, double completionTimeHours,
            double averageAgentPerformance, double parallelizationBenefit) {
    }
}
