package com.agentnet.coordinator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A task the coordinator spreads over one or more subsystems.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequirements {

    private String taskId;
    private String taskType;
    /** Every candidate agent must hold all of these. */
    @Builder.Default
    private Set<String> requiredCapabilities = new LinkedHashSet<>();
    /** Used to rank candidates. */
    @Builder.Default
    private Set<String> preferredCapabilities = new LinkedHashSet<>();
    /** Subsystems to involve; empty means every system with an eligible agent. */
    @Builder.Default
    private List<String> systems = new ArrayList<>();
    /** Passed through to each adapter, e.g. the task graph for {@code dag}. */
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();
    /** Per-adapter limit, or null. */
    private Duration timeout;
}
