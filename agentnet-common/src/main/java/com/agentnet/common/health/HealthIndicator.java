package com.agentnet.common.health;

import java.util.Map;

/**
 * One named health signal of a component, with supporting details.
 */
public record HealthIndicator(String name, ModuleStatus status, String message, Map<String, Object> details) {

    public HealthIndicator {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static HealthIndicator of(String name, ModuleStatus status, String message) {
        return new HealthIndicator(name, status, message, Map.of());
    }

    public static HealthIndicator healthy(String name, String message) {
        return of(name, ModuleStatus.HEALTHY, message);
    }
}
