package com.agentnet.scheduler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final report of one DAG run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {

    private String dagId;
    private ExecutionStatus status;
    private int completedTasks;
    private int failedTasks;
    private int totalTasks;
    @Builder.Default
    private List<String> failedTaskIds = new ArrayList<>();
    @Builder.Default
    private List<TaskResult> taskResults = new ArrayList<>();
    @Builder.Default
    private List<List<String>> batches = new ArrayList<>();
    private long startTime;
    private long endTime;
    private long executionTimeMs;
    private String error;

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }
}
