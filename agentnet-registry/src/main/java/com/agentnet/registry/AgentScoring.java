package com.agentnet.registry;

import java.util.Map;
import java.util.Set;

/**
 * Ranking heuristics used by discovery and capability matching.
 * The constants are heuristic and tunable.
 */
public final class AgentScoring {

    public static final double BASE_SCORE = 0.5;
    public static final int SCORE_WINDOW = 10;
    public static final double MIN_CPU_FACTOR = 0.1;
    public static final double CAPABILITY_BONUS_PER_CAP = 0.05;
    public static final double MAX_CAPABILITY_BONUS = 0.2;

    private static final Map<AgentStatus, Double> STATUS_WEIGHTS = Map.of(
            AgentStatus.ACTIVE, 1.0,
            AgentStatus.IDLE, 0.8,
            AgentStatus.BUSY, 0.6,
            AgentStatus.ERROR, 0.2,
            AgentStatus.OFFLINE, 0.0);

    private AgentScoring() {
    }

    /**
     * Discovery score in [0, 1]: recent performance, scaled by status and CPU headroom.
     */
    public static double score(AgentInfo agent) {
        double score = BASE_SCORE;
        var recent = agent.recentMetricMean(SCORE_WINDOW);
        if (recent.isPresent()) {
            score = (score + recent.getAsDouble()) / 2;
        }
        score *= statusWeight(agent.getStatus());
        ResourceUsage usage = agent.getResourceUsage();
        if (usage != null) {
            score *= Math.max(MIN_CPU_FACTOR, 1.0 - usage.cpuPercent() / 100.0);
        }
        return clamp(score);
    }

    public static double statusWeight(AgentStatus status) {
        return STATUS_WEIGHTS.getOrDefault(status, 0.0);
    }

    /**
     * Preferred-capability match score: 1.0 for meeting the requirements, plus the
     * fraction of preferred capabilities held, plus a small bonus for breadth.
     */
    public static double capabilityMatchScore(AgentInfo agent, Set<String> preferred) {
        long matches = preferred.stream().filter(agent::hasCapability).count();
        double preferredFraction = (double) matches / Math.max(1, preferred.size());
        double breadth = Math.min(MAX_CAPABILITY_BONUS,
                CAPABILITY_BONUS_PER_CAP * agent.getCapabilities().size());
        return 1.0 + preferredFraction + breadth;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
