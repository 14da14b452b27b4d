package com.agentnet.coordinator;

import java.util.Map;

/**
 * Expected task volume per subsystem.
 *
 * @param tasksPerAgent how many tasks one agent can absorb over the forecast window
 */
public record WorkloadForecast(Map<String, Integer> taskVolumeBySystem, int tasksPerAgent) {

    public static final int DEFAULT_TASKS_PER_AGENT = 10;

    public WorkloadForecast {
        taskVolumeBySystem = taskVolumeBySystem == null ? Map.of() : Map.copyOf(taskVolumeBySystem);
    }

    public static WorkloadForecast of(Map<String, Integer> taskVolumeBySystem) {
        return new WorkloadForecast(taskVolumeBySystem, DEFAULT_TASKS_PER_AGENT);
    }
}
