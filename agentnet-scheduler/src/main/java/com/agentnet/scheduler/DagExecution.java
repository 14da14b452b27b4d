package com.agentnet.scheduler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live state of one in-flight run. Only the scheduler mutates it; readers see a
 * consistent-enough view for monitoring.
 */
public class DagExecution {

    private final String dagId;
    private final ExecutionPlan plan;
    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile long startTime;
    private volatile long endTime;
    private volatile int currentBatch = -1;

    DagExecution(ExecutionPlan plan) {
        this.dagId = plan.dagId();
        this.plan = plan;
    }

    public String getDagId() {
        return dagId;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public int getCurrentBatch() {
        return currentBatch;
    }

    public Map<String, TaskResult> getResults() {
        return Map.copyOf(results);
    }

    public int completedTaskCount() {
        return (int) results.values().stream().filter(r -> r.status() == TaskStatus.COMPLETED).count();
    }

    synchronized void markRunning(long now) {
        status = ExecutionStatus.RUNNING;
        startTime = now;
    }

    void enterBatch(int index) {
        currentBatch = index;
    }

    void record(TaskResult result) {
        results.put(result.taskId(), result);
    }

    boolean hasResult(String taskId) {
        return results.containsKey(taskId);
    }

    /**
     * Move to Cancelled if still running.
     *
     * @return whether the cancellation took effect
     */
    synchronized boolean cancel(long now) {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        status = ExecutionStatus.CANCELLED;
        endTime = now;
        return true;
    }

    boolean isCancelled() {
        return status == ExecutionStatus.CANCELLED;
    }

    /**
     * Set the terminal status unless the run was already cancelled.
     */
    synchronized ExecutionStatus finish(ExecutionStatus terminal, long now) {
        if (status == ExecutionStatus.RUNNING) {
            status = terminal;
            endTime = now;
        }
        return status;
    }
}
