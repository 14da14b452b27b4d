package com.agentnet.common.health;

/**
 * Coarse health of a running component.
 */
public enum ModuleStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    INITIALIZING,
    SHUTDOWN;

    public boolean isHealthy() {
        return this == HEALTHY;
    }
}
