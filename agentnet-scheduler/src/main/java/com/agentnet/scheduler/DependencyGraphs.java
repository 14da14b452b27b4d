package com.agentnet.scheduler;

import com.agentnet.common.error.AgentNetworkException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure graph algorithms over task dependency graphs.
 * <p>
 * A graph maps every task id to the set of task ids it depends on. Key order is
 * the task declaration order and is used to keep every output deterministic.
 */
public final class DependencyGraphs {

    private DependencyGraphs() {
    }

    // =========================================================================
    // Validation and construction
    // =========================================================================

    /**
     * Check ids, actions and dependency references.
     *
     * @throws AgentNetworkException with kind {@code VALIDATION_ERROR}
     */
    public static void validate(DagDefinition definition) {
        if (definition == null || definition.getTasks() == null) {
            throw AgentNetworkException.validation("DAG definition must contain a task list");
        }
        Set<String> ids = new HashSet<>();
        for (DagTask task : definition.getTasks()) {
            if (task == null || task.id() == null || task.id().isBlank()) {
                throw AgentNetworkException.validation("Task id must not be blank");
            }
            if (!ids.add(task.id())) {
                throw AgentNetworkException.validation("Duplicate task id: " + task.id());
            }
            if (task.action() == null || task.action().isBlank()) {
                throw AgentNetworkException.validation("Task " + task.id() + " has no action");
            }
        }
        Map<String, Set<String>> deps = definition.getDependencies();
        if (deps == null) {
            return;
        }
        for (var entry : deps.entrySet()) {
            if (!ids.contains(entry.getKey())) {
                throw AgentNetworkException.validation(
                        "Dependencies declared for unknown task: " + entry.getKey());
            }
            for (String target : entry.getValue()) {
                if (!ids.contains(target)) {
                    throw AgentNetworkException.validation(
                            "Task " + entry.getKey() + " depends on unknown task: " + target);
                }
            }
        }
    }

    /**
     * Task id to prerequisite ids, with every task present. Prerequisites follow
     * declaration order.
     */
    public static Map<String, Set<String>> buildDependencyGraph(DagDefinition definition) {
        List<String> ids = definition.taskIds();
        Map<String, Integer> order = declarationOrder(ids);
        Map<String, Set<String>> deps = definition.getDependencies() == null
                ? Map.of()
                : definition.getDependencies();

        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (String id : ids) {
            List<String> prerequisites = new ArrayList<>(deps.getOrDefault(id, Set.of()));
            prerequisites.sort(Comparator.comparingInt(p -> order.getOrDefault(p, Integer.MAX_VALUE)));
            graph.put(id, new LinkedHashSet<>(prerequisites));
        }
        return graph;
    }

    // =========================================================================
    // Cycle detection
    // =========================================================================

    /**
     * Depth-first sweep from every root, tracking the current path. Reaching a
     * node that is already on the path records the path slice from that node,
     * closed with the node itself. Iterative, so deep chains cannot overflow the stack.
     */
    public static CycleReport detectCycles(Map<String, Set<String>> graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (String root : graph.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            List<String> path = new ArrayList<>();
            Map<String, Integer> onPath = new HashMap<>();
            Deque<Iterator<String>> stack = new ArrayDeque<>();

            visited.add(root);
            onPath.put(root, 0);
            path.add(root);
            stack.push(graph.getOrDefault(root, Set.of()).iterator());

            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (!it.hasNext()) {
                    stack.pop();
                    onPath.remove(path.remove(path.size() - 1));
                    continue;
                }
                String next = it.next();
                Integer start = onPath.get(next);
                if (start != null) {
                    List<String> cycle = new ArrayList<>(path.subList(start, path.size()));
                    cycle.add(next);
                    cycles.add(cycle);
                } else if (visited.add(next)) {
                    onPath.put(next, path.size());
                    path.add(next);
                    stack.push(graph.getOrDefault(next, Set.of()).iterator());
                }
            }
        }
        return cycles.isEmpty() ? CycleReport.none() : new CycleReport(true, cycles);
    }

    // =========================================================================
    // Batching and assignment
    // =========================================================================

    /**
     * Kahn's algorithm, emitting each wave of tasks with no unfinished
     * prerequisites as one batch. Inside a batch tasks keep declaration order.
     * Stops early, leaving tasks out, if the graph has a cycle.
     */
    public static List<List<String>> topologicalBatches(Map<String, Set<String>> graph) {
        Map<String, Integer> order = declarationOrder(new ArrayList<>(graph.keySet()));
        Map<String, Integer> pending = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();

        graph.forEach((task, prerequisites) -> {
            int count = 0;
            for (String prerequisite : prerequisites) {
                if (graph.containsKey(prerequisite)) {
                    dependents.computeIfAbsent(prerequisite, k -> new ArrayList<>()).add(task);
                    count++;
                }
            }
            pending.put(task, count);
        });

        List<String> ready = new ArrayList<>();
        pending.forEach((task, count) -> {
            if (count == 0) {
                ready.add(task);
            }
        });

        List<List<String>> batches = new ArrayList<>();
        while (!ready.isEmpty()) {
            ready.sort(Comparator.comparingInt(order::get));
            List<String> batch = List.copyOf(ready);
            batches.add(batch);
            ready.clear();
            for (String done : batch) {
                for (String dependent : dependents.getOrDefault(done, List.of())) {
                    if (pending.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
        }
        return batches;
    }

    /**
     * Round-robin over the candidates, in the order given.
     */
    public static Map<String, String> assignAgents(List<String> taskIds, List<String> agentIds) {
        Map<String, String> assignments = new LinkedHashMap<>();
        if (agentIds.isEmpty()) {
            return assignments;
        }
        for (int i = 0; i < taskIds.size(); i++) {
            assignments.put(taskIds.get(i), agentIds.get(i % agentIds.size()));
        }
        return assignments;
    }

    /**
     * Number of tasks that list the given task as a prerequisite, per task.
     */
    public static Map<String, Integer> dependentCounts(Map<String, Set<String>> graph) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        graph.keySet().forEach(task -> counts.put(task, 0));
        graph.values().forEach(prerequisites -> prerequisites
                .forEach(p -> counts.merge(p, 1, Integer::sum)));
        return counts;
    }

    private static Map<String, Integer> declarationOrder(List<String> ids) {
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            order.putIfAbsent(ids.get(i), i);
        }
        return order;
    }
}
