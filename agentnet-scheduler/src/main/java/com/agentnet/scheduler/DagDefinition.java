package com.agentnet.scheduler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A task graph as submitted by a client: tasks in declaration order plus a map of
 * task id to the ids it depends on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DagDefinition {

    @Builder.Default
    private List<DagTask> tasks = new ArrayList<>();
    @Builder.Default
    private Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    public static DagDefinition of(List<DagTask> tasks, Map<String, Set<String>> dependencies) {
        return DagDefinition.builder()
                .tasks(tasks)
                .dependencies(dependencies)
                .build();
    }

    public List<String> taskIds() {
        return tasks.stream().map(DagTask::id).toList();
    }

    public int totalDependencies() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }
}
