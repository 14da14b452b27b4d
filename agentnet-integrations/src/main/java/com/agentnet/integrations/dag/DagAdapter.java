package com.agentnet.integrations.dag;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException;
import com.agentnet.common.error.CyclicDependencyException;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.integrations.AbstractIntegrationAdapter;
import com.agentnet.integrations.AdapterOutcome;
import com.agentnet.integrations.CoordinationRequest;
import com.agentnet.registry.AgentInfo;
import com.agentnet.registry.AgentStatus;
import com.agentnet.scheduler.CycleReport;
import com.agentnet.scheduler.DagDefinition;
import com.agentnet.scheduler.DagExecution;
import com.agentnet.scheduler.DagTask;
import com.agentnet.scheduler.DependencyGraphs;
import com.agentnet.scheduler.DependencyScheduler;
import com.agentnet.scheduler.ExecutionPlan;
import com.agentnet.scheduler.ExecutionResult;
import com.agentnet.scheduler.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs task graphs for the coordinator through a {@link DependencyScheduler}.
 */
@Slf4j
public class DagAdapter extends AbstractIntegrationAdapter {

    public static final String SYSTEM_NAME = "dag";
    public static final String DAG_PARAMETER = "dag";

    static final int BOTTLENECK_DEPENDENTS = 2;
    static final double PARALLELISM_THRESHOLD = 0.5;
    static final double PARALLELISM_BENEFIT = 0.2;
    static final double UTILIZATION_BENEFIT = 0.15;
    static final double MAX_IMPROVEMENT = 0.5;

    private final DependencyScheduler scheduler;

    public DagAdapter(AgentNetworkConfig config, DependencyScheduler scheduler) {
        super(SYSTEM_NAME, config);
        this.scheduler = scheduler;
    }

    @Override
    protected void disconnect() {
        for (DagExecution execution : scheduler.getActiveExecutions()) {
            scheduler.cancelExecution(execution.getDagId());
        }
    }

    // =========================================================================
    // Execution
    // =========================================================================

    public ExecutionResult coordinateParallelExecution(DagDefinition definition, List<AgentInfo> agents,
            Duration timeout) {
        return coordinateParallelExecution("dag-" + UUID.randomUUID().toString().substring(0, 8),
                definition, agents, timeout);
    }

    /**
     * Plan and run a task graph on the given agents.
     *
     * @throws AgentNetworkException if the graph is invalid or cyclic, or no agents were given
     */
    public ExecutionResult coordinateParallelExecution(String dagId, DagDefinition definition,
            List<AgentInfo> agents, Duration timeout) {
        long started = System.currentTimeMillis();
        ExecutionPlan plan;
        try {
            plan = scheduler.plan(dagId, definition, agents);
        } catch (AgentNetworkException e) {
            recordFailure(started, e);
            throw e;
        }

        int engaged = Set.copyOf(plan.assignments().values()).size();
        agentsEngaged(engaged);
        try {
            ExecutionResult result = scheduler.execute(plan, timeout);
            recordOperation("dag_execution_time", System.currentTimeMillis() - started, result.isSuccess());
            if (!result.isSuccess()) {
                recordError(result.getError());
            }
            return result;
        } catch (AgentNetworkException e) {
            recordFailure(started, e);
            throw e;
        } finally {
            agentsEngaged(-engaged);
        }
    }

    private void recordFailure(long started, AgentNetworkException e) {
        recordOperation("dag_execution_time", System.currentTimeMillis() - started, false);
        recordError(e.getMessage());
    }

    @Override
    protected AdapterOutcome doCoordinate(CoordinationRequest request) {
        DagDefinition definition = request.parameter(DAG_PARAMETER, DagDefinition.class)
                .orElseGet(() -> DagDefinition.of(
                        List.of(DagTask.of(request.taskId(), request.taskType())), Map.of()));

        ExecutionResult result;
        try {
            result = coordinateParallelExecution(request.taskId(), definition, request.agents(), request.timeout());
        } catch (AgentNetworkException e) {
            return AdapterOutcome.failure(SYSTEM_NAME, e.getKind(), e.getMessage());
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("dagId", result.getDagId());
        output.put("status", result.getStatus().name());
        output.put("completedTasks", result.getCompletedTasks());
        output.put("failedTasks", result.getFailedTasks());
        output.put("batches", result.getBatches().size());
        output.put("executionTimeMs", result.getExecutionTimeMs());
        List<String> agentsUsed = result.getTaskResults().stream()
                .map(TaskResult::assignedAgent)
                .filter(Objects::nonNull)
                .distinct()
                .toList();

        if (result.isSuccess()) {
            return AdapterOutcome.success(SYSTEM_NAME, output, agentsUsed);
        }
        return new AdapterOutcome(SYSTEM_NAME, false, output, agentsUsed, 0,
                AgentNetworkException.ErrorKind.EXECUTION_FAILURE, result.getError());
    }

    // =========================================================================
    // Analysis
    // =========================================================================

    /**
     * Batch a bare dependency map. Every task mentioned as a key or a target is a node.
     *
     * @throws CyclicDependencyException if the map has a cycle
     */
    public DependencyAnalysis handleDagDependencies(Map<String, Set<String>> dependencies) {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        dependencies.forEach((task, prerequisites) -> {
            graph.computeIfAbsent(task, k -> new LinkedHashSet<>()).addAll(prerequisites);
            prerequisites.forEach(p -> graph.computeIfAbsent(p, k -> new LinkedHashSet<>()));
        });

        CycleReport cycles = DependencyGraphs.detectCycles(graph);
        if (cycles.hasCycles()) {
            log.warn("Dependency analysis found cycles: {}", cycles.cycles());
            throw new CyclicDependencyException(cycles.cycles());
        }
        List<List<String>> batches = DependencyGraphs.topologicalBatches(graph);
        int maxParallelism = batches.stream().mapToInt(List::size).max().orElse(0);
        return new DependencyAnalysis(graph, batches, cycles, maxParallelism, graph.size());
    }

    /**
     * Advisory analysis of a task graph against past runs and the available agents.
     */
    public DagOptimization optimizeDagPerformance(DagDefinition definition, List<ExecutionResult> history,
            List<AgentInfo> agents) {
        DependencyGraphs.validate(definition);
        Map<String, Set<String>> graph = DependencyGraphs.buildDependencyGraph(definition);
        CycleReport cycles = DependencyGraphs.detectCycles(graph);
        if (cycles.hasCycles()) {
            throw new CyclicDependencyException(cycles.cycles());
        }

        int totalTasks = graph.size();
        long tasksWithDeps = graph.values().stream().filter(deps -> !deps.isEmpty()).count();
        double potential = totalTasks == 0 ? 1.0 : 1.0 - (double) tasksWithDeps / totalTasks;
        List<String> bottlenecks = DependencyGraphs.dependentCounts(graph).entrySet().stream()
                .filter(e -> e.getValue() > BOTTLENECK_DEPENDENTS)
                .map(Map.Entry::getKey)
                .toList();
        int depth = DependencyGraphs.topologicalBatches(graph).size();

        List<ExecutionResult> runs = history == null ? List.of() : history;
        double successRate = runs.isEmpty() ? 1.0
                : (double) runs.stream().filter(ExecutionResult::isSuccess).count() / runs.size();
        double avgTime = runs.stream().mapToLong(ExecutionResult::getExecutionTimeMs).average().orElse(0.0);

        List<AgentInfo> pool = agents == null ? List.of() : agents;
        int activeAgents = (int) pool.stream().filter(a -> a.getStatus() == AgentStatus.ACTIVE).count();

        List<OptimizationRecommendation> recommendations = new ArrayList<>();
        double improvement = 0.0;
        if (potential > PARALLELISM_THRESHOLD) {
            recommendations.add(new OptimizationRecommendation("increase_parallelism",
                    "Increase parallel task execution", PARALLELISM_BENEFIT));
            improvement += PARALLELISM_BENEFIT;
        }
        if (activeAgents < pool.size()) {
            recommendations.add(new OptimizationRecommendation("utilize_more_agents",
                    "Utilize more available agents", UTILIZATION_BENEFIT));
            improvement += UTILIZATION_BENEFIT;
        }

        log.info("DAG optimization produced {} recommendation(s)", recommendations.size());
        return new DagOptimization(totalTasks, definition.totalDependencies(), depth, potential, bottlenecks,
                successRate, avgTime, pool.size(), activeAgents, recommendations,
                Math.min(improvement, MAX_IMPROVEMENT));
    }

    // =========================================================================
    // Health
    // =========================================================================

    @Override
    protected Map<String, Object> integrationMetadata() {
        return Map.of("activeDagExecutions", scheduler.getActiveExecutions().size(),
                "executionHistory", scheduler.getExecutionHistory().size());
    }

    @Override
    protected List<HealthIndicator> extraHealthIndicators() {
        int active = scheduler.getActiveExecutions().size();
        return List.of(new HealthIndicator("dag_executions",
                scheduler.isShutdown() ? ModuleStatus.UNHEALTHY : ModuleStatus.HEALTHY,
                "Active DAG executions: " + active,
                Map.of("active", active, "maxParallelTasks", scheduler.getMaxParallelTasks())));
    }

    public DependencyScheduler getScheduler() {
        return scheduler;
    }
}
