package com.agentnet.scheduler;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException;
import com.agentnet.common.error.CyclicDependencyException;
import com.agentnet.registry.AgentInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plans and runs task graphs on registered agents.
 * <p>
 * Batches run strictly in order. The tasks of one batch fan out on a fixed
 * worker pool of {@code maxParallelTasks} threads and fan back in before the next
 * batch starts. Cancellation and timeouts interrupt the tasks still running; a
 * task executor that ignores interruption keeps its worker until it returns.
 */
@Slf4j
public class DependencyScheduler implements AutoCloseable {

    static final long ESTIMATED_TASK_MS = 1000;
    static final double PARALLEL_SPEEDUP = 0.5;
    private static final long POLL_INTERVAL_MS = 50;

    private final AgentNetworkConfig config;
    private final TaskExecutor taskExecutor;
    private final ExecutorService workers;
    private final Map<String, DagExecution> activeExecutions = new ConcurrentHashMap<>();
    private final Deque<ExecutionResult> history = new ArrayDeque<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DependencyScheduler(AgentNetworkConfig config) {
        this(config, TaskExecutor.noop());
    }

    public DependencyScheduler(AgentNetworkConfig config, TaskExecutor taskExecutor) {
        this.config = config;
        this.taskExecutor = taskExecutor;
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getMaxParallelTasks(), r -> {
            Thread t = new Thread(r, "dag-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // =========================================================================
    // Graph operations
    // =========================================================================

    public void validateGraph(DagDefinition definition) {
        DependencyGraphs.validate(definition);
    }

    public Map<String, Set<String>> buildDependencyGraph(DagDefinition definition) {
        return DependencyGraphs.buildDependencyGraph(definition);
    }

    public CycleReport detectCycles(Map<String, Set<String>> graph) {
        return DependencyGraphs.detectCycles(graph);
    }

    public List<List<String>> topologicalBatches(Map<String, Set<String>> graph) {
        return DependencyGraphs.topologicalBatches(graph);
    }

    public Map<String, String> assignAgents(List<DagTask> tasks, List<AgentInfo> candidates) {
        return DependencyGraphs.assignAgents(
                tasks.stream().map(DagTask::id).toList(),
                candidates.stream().map(AgentInfo::getId).toList());
    }

    // =========================================================================
    // Planning
    // =========================================================================

    /**
     * Validate, cycle-check, batch and assign. Nothing is recorded if this throws.
     *
     * @param candidates agents in preference order, usually registry score order
     * @throws CyclicDependencyException if the graph has a cycle
     * @throws AgentNetworkException     on invalid input or when there are tasks but no agents
     */
    public ExecutionPlan plan(String dagId, DagDefinition definition, List<AgentInfo> candidates) {
        validateGraph(definition);
        Map<String, Set<String>> graph = buildDependencyGraph(definition);

        CycleReport cycles = detectCycles(graph);
        if (cycles.hasCycles()) {
            log.warn("DAG {} rejected, cycles: {}", dagId, cycles.cycles());
            throw new CyclicDependencyException(cycles.cycles());
        }

        List<List<String>> batches = topologicalBatches(graph);
        List<DagTask> tasks = definition.getTasks();
        Map<String, String> assignments = assignAgents(tasks, candidates == null ? List.of() : candidates);
        if (!tasks.isEmpty() && assignments.isEmpty()) {
            throw AgentNetworkException.noAgents("No agents available for DAG " + dagId);
        }

        ExecutionPlan plan = new ExecutionPlan(dagId, definition, graph, batches, assignments,
                estimateDurationMs(tasks.size(), assignments.size()));
        log.debug("DAG {} planned: {} task(s) in {} batch(es) on {} agent(s)",
                dagId, tasks.size(), batches.size(), Set.copyOf(assignments.values()).size());
        return plan;
    }

    long estimateDurationMs(int taskCount, int assignmentCount) {
        if (taskCount == 0) {
            return 0;
        }
        double parallelization = (double) Math.min(assignmentCount, config.getMaxParallelTasks()) / taskCount;
        return Math.round(taskCount * ESTIMATED_TASK_MS * (1 - parallelization * PARALLEL_SPEEDUP));
    }

    // =========================================================================
    // Execution
    // =========================================================================

    public ExecutionResult run(String dagId, DagDefinition definition, List<AgentInfo> candidates,
            Duration timeout) {
        return execute(plan(dagId, definition, candidates), timeout);
    }

    public ExecutionResult run(String dagId, DagDefinition definition, List<AgentInfo> candidates) {
        return run(dagId, definition, candidates, null);
    }

    /**
     * Run a plan to completion, failure, cancellation or timeout.
     * Task failures are reported in the result, not thrown. Tasks still running
     * when the run is cancelled or times out are interrupted.
     *
     * @param timeout whole-run limit, or null for none
     */
    public ExecutionResult execute(ExecutionPlan plan, Duration timeout) {
        if (shutdown.get()) {
            throw new AgentNetworkException(AgentNetworkException.ErrorKind.EXECUTION_FAILURE,
                    "Scheduler is shut down");
        }
        DagExecution execution = new DagExecution(plan);
        if (activeExecutions.putIfAbsent(plan.dagId(), execution) != null) {
            throw AgentNetworkException.validation("DAG is already running: " + plan.dagId());
        }

        long start = System.currentTimeMillis();
        long deadline = timeout == null ? Long.MAX_VALUE : start + timeout.toMillis();
        execution.markRunning(start);
        log.info("DAG {} started: {} task(s), {} batch(es)", plan.dagId(), plan.totalTasks(),
                plan.batches().size());

        boolean finished = false;
        try {
            ExecutionStatus outcome = ExecutionStatus.COMPLETED;
            String error = null;
            boolean timedOut = false;
            try {
                List<List<String>> batches = plan.batches();
                for (int i = 0; i < batches.size(); i++) {
                    if (execution.isCancelled()) {
                        error = "DAG execution cancelled";
                        break;
                    }
                    if (System.currentTimeMillis() >= deadline) {
                        timedOut = true;
                        break;
                    }
                    execution.enterBatch(i);
                    BatchOutcome batch = runBatch(plan, execution, batches.get(i), deadline);
                    if (batch.timedOut()) {
                        timedOut = true;
                        break;
                    }
                    if (!batch.failedTaskIds().isEmpty()) {
                        outcome = ExecutionStatus.FAILED;
                        error = "Tasks failed: " + batch.failedTaskIds();
                        break;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = ExecutionStatus.FAILED;
                error = "DAG execution interrupted";
            }
            if (timedOut) {
                outcome = ExecutionStatus.FAILED;
                error = "DAG execution timed out after " + timeout.toMillis() + "ms";
            }

            ExecutionResult result = finish(plan, execution, outcome, error, timedOut);
            remember(result);
            finished = true;
            log.info("DAG {} finished: {} ({}/{} completed, {} failed) in {}ms", plan.dagId(),
                    result.getStatus(), result.getCompletedTasks(), result.getTotalTasks(),
                    result.getFailedTasks(), result.getExecutionTimeMs());
            return result;
        } finally {
            if (!finished) {
                execution.finish(ExecutionStatus.FAILED, System.currentTimeMillis());
                log.error("DAG {} aborted before it could finish", plan.dagId());
            }
            activeExecutions.remove(plan.dagId());
        }
    }

    private record BatchOutcome(List<String> failedTaskIds, boolean timedOut) {
    }

    /**
     * A submitted task. {@code startedAt} stays 0 while the task waits for a worker.
     */
    private static final class RunningTask {
        private final String taskId;
        private final String agentId;
        private volatile long startedAt;
        private Future<TaskResult> future;

        private RunningTask(String taskId, String agentId) {
            this.taskId = taskId;
            this.agentId = agentId;
        }
    }

    /**
     * Fan the batch out on the worker pool and wait for it. Returns early when the
     * run is cancelled or its deadline passes; every task still running then is
     * interrupted and left without a result.
     */
    private BatchOutcome runBatch(ExecutionPlan plan, DagExecution execution, List<String> batch,
            long deadline) throws InterruptedException {
        Map<String, DagTask> tasksById = new LinkedHashMap<>();
        plan.definition().getTasks().forEach(t -> tasksById.put(t.id(), t));
        Duration taskTimeout = config.taskTimeout();
        long taskTimeoutMs = taskTimeout == null ? 0 : taskTimeout.toMillis();

        List<String> failed = new ArrayList<>();
        Map<String, RunningTask> running = new LinkedHashMap<>();
        for (String taskId : batch) {
            DagTask task = tasksById.get(taskId);
            RunningTask handle = new RunningTask(taskId, plan.assignments().get(taskId));
            try {
                handle.future = workers.submit(() -> {
                    handle.startedAt = System.currentTimeMillis();
                    return runTask(task, handle.agentId);
                });
                running.put(taskId, handle);
            } catch (RejectedExecutionException e) {
                execution.record(TaskResult.failed(taskId, handle.agentId, 0,
                        "Worker pool rejected task: " + e.getMessage()));
                failed.add(taskId);
            }
        }

        try {
            while (true) {
                long now = System.currentTimeMillis();
                for (Iterator<RunningTask> it = running.values().iterator(); it.hasNext(); ) {
                    RunningTask handle = it.next();
                    TaskResult result;
                    if (handle.future.isDone()) {
                        result = resultOf(handle);
                    } else if (taskTimeoutMs > 0 && handle.startedAt > 0 && now - handle.startedAt >= taskTimeoutMs) {
                        handle.future.cancel(true);
                        log.warn("Task {} timed out after {}ms on agent {}", handle.taskId, taskTimeoutMs,
                                handle.agentId);
                        result = TaskResult.failed(handle.taskId, handle.agentId, taskTimeoutMs,
                                "Task timed out after " + taskTimeoutMs + "ms");
                    } else {
                        continue;
                    }
                    execution.record(result);
                    if (result.isFailed()) {
                        failed.add(result.taskId());
                    }
                    it.remove();
                }
                if (running.isEmpty()) {
                    return new BatchOutcome(failed, false);
                }
                if (execution.isCancelled() || shutdown.get()) {
                    return new BatchOutcome(failed, false);
                }
                if (now >= deadline) {
                    return new BatchOutcome(failed, true);
                }
                awaitFirst(running.values().iterator().next(), Math.min(deadline - now, POLL_INTERVAL_MS));
            }
        } finally {
            for (RunningTask handle : running.values()) {
                if (handle.future.cancel(true)) {
                    log.debug("Task {} interrupted", handle.taskId);
                }
            }
        }
    }

    /**
     * Block until the task finishes or the wait elapses, whichever comes first.
     */
    private static void awaitFirst(RunningTask handle, long waitMs) throws InterruptedException {
        try {
            handle.future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.trace("Task {} still running", handle.taskId);
        } catch (ExecutionException | CancellationException e) {
            log.trace("Task {} ended abruptly, collected on the next pass", handle.taskId);
        }
    }

    private static TaskResult resultOf(RunningTask handle) throws InterruptedException {
        long elapsed = handle.startedAt > 0 ? System.currentTimeMillis() - handle.startedAt : 0;
        try {
            return handle.future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.error("Task {} crashed on agent {}: {}", handle.taskId, handle.agentId, message, cause);
            return TaskResult.failed(handle.taskId, handle.agentId, elapsed, message);
        } catch (CancellationException e) {
            return TaskResult.failed(handle.taskId, handle.agentId, elapsed, "Task cancelled");
        }
    }

    private TaskResult runTask(DagTask task, String agentId) {
        long started = System.currentTimeMillis();
        try {
            taskExecutor.execute(task, agentId);
            return TaskResult.completed(task.id(), agentId, System.currentTimeMillis() - started);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Task {} failed on agent {}: {}", task.id(), agentId, message);
            return TaskResult.failed(task.id(), agentId, System.currentTimeMillis() - started, message);
        }
    }

    private ExecutionResult finish(ExecutionPlan plan, DagExecution execution, ExecutionStatus outcome,
            String error, boolean timedOut) {
        long end = System.currentTimeMillis();
        ExecutionStatus status = execution.finish(outcome, end);
        if (status == ExecutionStatus.CANCELLED && error == null) {
            error = "DAG execution cancelled";
        }

        for (DagTask task : plan.definition().getTasks()) {
            if (execution.hasResult(task.id())) {
                continue;
            }
            String agent = plan.assignments().get(task.id());
            execution.record(timedOut
                    ? TaskResult.failed(task.id(), agent, 0, error)
                    : TaskResult.skipped(task.id(), agent, error));
        }

        Map<String, TaskResult> results = execution.getResults();
        List<TaskResult> ordered = plan.definition().getTasks().stream()
                .map(t -> results.get(t.id()))
                .toList();
        List<String> failedIds = ordered.stream().filter(TaskResult::isFailed).map(TaskResult::taskId).toList();
        int completed = (int) ordered.stream().filter(r -> r.status() == TaskStatus.COMPLETED).count();

        return ExecutionResult.builder()
                .dagId(plan.dagId())
                .status(status)
                .completedTasks(completed)
                .failedTasks(failedIds.size())
                .totalTasks(plan.totalTasks())
                .failedTaskIds(new ArrayList<>(failedIds))
                .taskResults(new ArrayList<>(ordered))
                .batches(new ArrayList<>(plan.batches()))
                .startTime(execution.getStartTime())
                .endTime(execution.getEndTime())
                .executionTimeMs(execution.getEndTime() - execution.getStartTime())
                .error(status == ExecutionStatus.COMPLETED ? null : error)
                .build();
    }

    private void remember(ExecutionResult result) {
        synchronized (history) {
            history.addLast(result);
            while (history.size() > config.getExecutionHistoryLimit()) {
                history.removeFirst();
            }
        }
    }

    // =========================================================================
    // Control and inspection
    // =========================================================================

    /**
     * Request cancellation of a running DAG. In-flight tasks of the current batch
     * are interrupted and no later batch starts. Nothing is rolled back.
     */
    public boolean cancelExecution(String dagId) {
        DagExecution execution = activeExecutions.get(dagId);
        if (execution == null || !execution.cancel(System.currentTimeMillis())) {
            log.warn("Cannot cancel DAG {}: not running", dagId);
            return false;
        }
        log.info("DAG {} cancelled", dagId);
        return true;
    }

    public List<DagExecution> getActiveExecutions() {
        return List.copyOf(activeExecutions.values());
    }

    public List<ExecutionResult> getExecutionHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public int getMaxParallelTasks() {
        return config.getMaxParallelTasks();
    }

    /**
     * Cancel every running DAG and stop the worker pool.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        long now = System.currentTimeMillis();
        activeExecutions.values().forEach(e -> e.cancel(now));
        workers.shutdownNow();
        log.info("Dependency scheduler shut down");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }
}
