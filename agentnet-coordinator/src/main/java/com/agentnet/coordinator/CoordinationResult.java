package com.agentnet.coordinator;

import com.agentnet.common.error.AgentNetworkException.ErrorKind;
import com.agentnet.integrations.AdapterOutcome;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link NetworkCoordinator#coordinateMultiSystemAgents}.
 *
 * @param plan               system name to the candidate agent ids handed to it
 * @param coordinationTimeMs wall-clock time of the whole call
 * @param overheadMs         coordination time minus the adapters' own work time
 */
public record CoordinationResult(boolean success, String taskId, Map<String, List<String>> plan,
        Map<String, AdapterOutcome> outcomes, List<String> agentsUsed, long coordinationTimeMs, long overheadMs,
        ErrorKind errorKind, String error) {

    public CoordinationResult {
        plan = plan == null ? Map.of() : Map.copyOf(plan);
        outcomes = outcomes == null ? Map.of() : Map.copyOf(outcomes);
        agentsUsed = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
    }

    public static CoordinationResult failed(String taskId, ErrorKind kind, String error, long elapsedMs) {
        return new CoordinationResult(false, taskId, Map.of(), Map.of(), List.of(), elapsedMs, 0, kind, error);
    }
}
