package com.agentnet.scheduler;

/**
 * Performs the work of one task on its assigned agent.
 * Throwing marks the task Failed with the exception message.
 */
@FunctionalInterface
public interface TaskExecutor {

    void execute(DagTask task, String agentId) throws Exception;

    /**
     * Completes every task immediately.
     */
    static TaskExecutor noop() {
        return (task, agentId) -> {
        };
    }
}
