package com.agentnet.registry;

import java.util.Map;

/**
 * One observed performance sample of an agent. Values are expected in [0, 1]
 * when used for scoring, but any double is accepted.
 */
public record PerformanceMetric(String name, double value, String unit, long timestamp,
        Map<String, String> metadata) {

    public PerformanceMetric {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PerformanceMetric of(String name, double value) {
        return new PerformanceMetric(name, value, "", System.currentTimeMillis(), Map.of());
    }

    public static PerformanceMetric of(String name, double value, String unit) {
        return new PerformanceMetric(name, value, unit, System.currentTimeMillis(), Map.of());
    }
}
