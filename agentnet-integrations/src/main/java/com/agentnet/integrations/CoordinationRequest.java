package com.agentnet.integrations;

import com.agentnet.registry.AgentInfo;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work the coordinator hands to one adapter: the candidate agents it selected
 * plus free-form parameters each adapter knows how to read.
 */
public record CoordinationRequest(String taskId, String taskType, List<AgentInfo> agents,
        Map<String, Object> parameters, Duration timeout) {

    public CoordinationRequest {
        agents = agents == null ? List.of() : List.copyOf(agents);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public <T> Optional<T> parameter(String key, Class<T> type) {
        Object value = parameters.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
