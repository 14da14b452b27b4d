package com.agentnet.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Discovery filter. Absent (null or empty) fields do not constrain the result.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentQuery {

    private Set<String> capabilities;
    private String systemType;
    private AgentStatus status;
    private Integer limit;

    public static AgentQuery all() {
        return AgentQuery.builder().build();
    }

    public static AgentQuery withCapabilities(Set<String> capabilities) {
        return AgentQuery.builder().capabilities(capabilities).build();
    }

    public static AgentQuery forSystem(String systemType) {
        return AgentQuery.builder().systemType(systemType).build();
    }
}
