package com.agentnet.integrations.consensus;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A contention between agents, possibly spanning subsystems.
 *
 * @param agents   involved agent ids
 * @param severity low, medium, high or critical
 */
public record ConflictData(String conflictId, String conflictType, Set<String> systems, List<String> agents,
        String severity, Map<String, Object> details) {

    public ConflictData {
        systems = systems == null ? Set.of() : Set.copyOf(systems);
        agents = agents == null ? List.of() : List.copyOf(agents);
        severity = severity == null ? "low" : severity;
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
