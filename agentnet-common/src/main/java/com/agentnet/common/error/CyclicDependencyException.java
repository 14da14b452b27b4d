package com.agentnet.common.error;

import java.util.List;

/**
 * A task graph contains at least one dependency cycle.
 * Each cycle is closed: its first and last element are the same task.
 */
public class CyclicDependencyException extends AgentNetworkException {

    private final List<List<String>> cycles;

    public CyclicDependencyException(List<List<String>> cycles) {
        super(ErrorKind.CYCLIC_DEPENDENCY, "Circular dependencies detected: " + cycles);
        this.cycles = List.copyOf(cycles);
    }

    public List<List<String>> getCycles() {
        return cycles;
    }
}
