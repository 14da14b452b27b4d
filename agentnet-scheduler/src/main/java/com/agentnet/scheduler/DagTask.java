package com.agentnet.scheduler;

import java.util.Map;

/**
 * One node of a task graph. {@code action} is opaque to the scheduler and is
 * interpreted by the {@link TaskExecutor}.
 */
public record DagTask(String id, String action, Map<String, String> metadata) {

    public DagTask {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DagTask of(String id, String action) {
        return new DagTask(id, action, Map.of());
    }
}
