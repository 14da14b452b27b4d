package com.agentnet.scheduler;

/**
 * Outcome of one task within a run.
 */
public record TaskResult(String taskId, TaskStatus status, String assignedAgent,
        long executionTimeMs, String error) {

    public static TaskResult completed(String taskId, String agent, long elapsedMs) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, agent, elapsedMs, null);
    }

    public static TaskResult failed(String taskId, String agent, long elapsedMs, String error) {
        return new TaskResult(taskId, TaskStatus.FAILED, agent, elapsedMs, error);
    }

    public static TaskResult skipped(String taskId, String agent, String reason) {
        return new TaskResult(taskId, TaskStatus.SKIPPED, agent, 0, reason);
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }
}
