package com.agentnet.integrations;

import com.agentnet.common.error.AgentNetworkException.ErrorKind;

import java.util.List;
import java.util.Map;

/**
 * What one adapter reports back for a {@link CoordinationRequest}.
 * {@code workTimeMs} is the time spent inside the adapter.
 */
public record AdapterOutcome(String systemName, boolean success, Map<String, Object> output,
        List<String> agentsUsed, long workTimeMs, ErrorKind errorKind, String error) {

    public AdapterOutcome {
        output = output == null ? Map.of() : Map.copyOf(output);
        agentsUsed = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
    }

    public static AdapterOutcome success(String systemName, Map<String, Object> output, List<String> agentsUsed) {
        return new AdapterOutcome(systemName, true, output, agentsUsed, 0, null, null);
    }

    public static AdapterOutcome failure(String systemName, ErrorKind kind, String error) {
        return new AdapterOutcome(systemName, false, Map.of(), List.of(), 0, kind, error);
    }

    public AdapterOutcome withWorkTime(long ms) {
        return new AdapterOutcome(systemName, success, output, agentsUsed, ms, errorKind, error);
    }
}
