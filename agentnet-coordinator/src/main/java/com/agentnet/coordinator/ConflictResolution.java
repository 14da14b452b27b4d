package com.agentnet.coordinator;

import com.agentnet.common.error.AgentNetworkException.ErrorKind;

import java.util.List;

/**
 * How the coordinator settled a cross-system conflict.
 *
 * @param winner     the earliest-registered involved agent for simple resolution, null otherwise
 * @param resolution the chosen option for consensus, {@code earliest_registration} otherwise
 */
public record ConflictResolution(boolean success, String conflictId, Strategy strategy, String resolution,
        String winner, List<String> affectedAgents, ErrorKind errorKind, String error) {

    public ConflictResolution {
        affectedAgents = affectedAgents == null ? List.of() : List.copyOf(affectedAgents);
    }

    public enum Strategy {
        SIMPLE,
        CONSENSUS
    }

    public static ConflictResolution failed(String conflictId, Strategy strategy, ErrorKind kind, String error) {
        return new ConflictResolution(false, conflictId, strategy, null, null, List.of(), kind, error);
    }
}
