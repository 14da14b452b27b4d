package com.agentnet.coordinator;

import com.agentnet.common.error.AgentNetworkException.ErrorKind;

import java.util.List;

/**
 * Advisory agent allocation per subsystem. Nothing is changed by producing it.
 */
public record AllocationResult(boolean success, List<SystemAllocation> allocations, double expectedEfficiencyGain,
        ErrorKind errorKind, String error) {

    public AllocationResult {
        allocations = allocations == null ? List.of() : List.copyOf(allocations);
    }

    public enum Action {
        SCALE_UP,
        SCALE_DOWN,
        MAINTAIN
    }

    public record SystemAllocation(String systemName, int currentAgents, int requiredAgents, Action action) {
    }

    public static AllocationResult failed(ErrorKind kind, String error) {
        return new AllocationResult(false, List.of(), 0.0, kind, error);
    }
}
