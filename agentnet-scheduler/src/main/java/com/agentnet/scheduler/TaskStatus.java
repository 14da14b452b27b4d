package com.agentnet.scheduler;

public enum TaskStatus {
    COMPLETED,
    FAILED,
    /** Never started because an earlier batch failed or the run was cancelled. */
    SKIPPED
}
