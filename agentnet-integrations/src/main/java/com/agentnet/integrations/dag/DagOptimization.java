package com.agentnet.integrations.dag;

import java.util.List;

/**
 * Structure analysis of a task graph plus advisory recommendations.
 *
 * @param depth                    number of batches
 * @param parallelizationPotential share of tasks with no prerequisites
 * @param bottlenecks              tasks that more than two other tasks depend on
 * @param historicalSuccessRate    share of completed runs in the supplied history, 1.0 without history
 */
public record DagOptimization(int totalTasks, int totalDependencies, int depth, double parallelizationPotential,
        List<String> bottlenecks, double historicalSuccessRate, double averageExecutionTimeMs,
        int totalAgents, int activeAgents, List<OptimizationRecommendation> recommendations,
        double expectedImprovement) {
}
