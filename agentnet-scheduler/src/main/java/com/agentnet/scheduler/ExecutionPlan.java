package com.agentnet.scheduler;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated, acyclic task graph with its batches and agent assignments.
 */
public record ExecutionPlan(String dagId, DagDefinition definition, Map<String, Set<String>> dependencyGraph,
        List<List<String>> batches, Map<String, String> assignments, long estimatedDurationMs) {

    public ExecutionPlan {
        batches = batches.stream().map(List::copyOf).toList();
        assignments = Map.copyOf(assignments);
    }

    public int totalTasks() {
        return definition.getTasks().size();
    }

    /**
     * Widest batch, i.e. the most tasks that can run at once.
     */
    public int maxParallelism() {
        return batches.stream().mapToInt(List::size).max().orElse(0);
    }
}
