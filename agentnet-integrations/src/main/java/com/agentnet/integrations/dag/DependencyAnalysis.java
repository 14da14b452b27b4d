package com.agentnet.integrations.dag;

import com.agentnet.scheduler.CycleReport;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batching of a bare dependency map, without running anything.
 */
public record DependencyAnalysis(Map<String, Set<String>> dependencyGraph, List<List<String>> batches,
        CycleReport cycleReport, int maxParallelism, int totalTasks) {
}
