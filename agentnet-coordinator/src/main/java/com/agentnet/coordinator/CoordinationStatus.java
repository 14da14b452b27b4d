package com.agentnet.coordinator;

import com.agentnet.common.health.ModuleStatus;

/**
 * Network-wide coordination health as judged by {@link NetworkCoordinator#monitorNetworkHealth()}.
 */
public enum CoordinationStatus {
    OPTIMAL,
    DEGRADED,
    CRITICAL,
    OFFLINE;

    public ModuleStatus toModuleStatus() {
        return switch (this) {
            case OPTIMAL -> ModuleStatus.HEALTHY;
            case DEGRADED -> ModuleStatus.DEGRADED;
            case CRITICAL -> ModuleStatus.UNHEALTHY;
            case OFFLINE -> ModuleStatus.SHUTDOWN;
        };
    }
}
