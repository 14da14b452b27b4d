package com.agentnet.common.health;

import java.util.List;
import java.util.Map;

/**
 * A component that can report on its own health.
 */
public interface ReflectiveModule {

    ModuleStatus getModuleStatus();

    List<HealthIndicator> getHealthIndicators();

    /**
     * Free-form operational counters, suitable for logging or a status page.
     */
    Map<String, Object> getOperationalInfo();

    default boolean isHealthy() {
        return getModuleStatus().isHealthy();
    }
}
