package com.agentnet.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * A registered agent.
 * The registry keeps its own live entry and only ever hands out copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentInfo {

    private String id;
    private String systemType;
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();
    @Builder.Default
    private AgentStatus status = AgentStatus.IDLE;
    @Builder.Default
    private List<PerformanceMetric> performanceHistory = new ArrayList<>();
    /** Latest resource snapshot; null until the agent reports one. */
    private ResourceUsage resourceUsage;
    private long createdAt;
    private long lastSeen;
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    /**
     * Mean of the values of the last {@code n} metrics, or empty when there is no history.
     */
    public OptionalDouble recentMetricMean(int n) {
        if (performanceHistory.isEmpty()) {
            return OptionalDouble.empty();
        }
        int from = Math.max(0, performanceHistory.size() - n);
        return performanceHistory.subList(from, performanceHistory.size()).stream()
                .mapToDouble(PerformanceMetric::value)
                .average();
    }

    /**
     * Detached copy, safe to hand to callers.
     */
    public AgentInfo copy() {
        return toBuilder()
                .capabilities(new LinkedHashSet<>(capabilities))
                .performanceHistory(new ArrayList<>(performanceHistory))
                .metadata(new LinkedHashMap<>(metadata))
                .build();
    }
}
