package com.agentnet.coordinator.intelligence;

public enum PatternType {
    PERFORMANCE_OPTIMIZATION,
    COORDINATION_EFFICIENCY,
    ERROR_PREVENTION,
    CONFLICT_RESOLUTION
}
