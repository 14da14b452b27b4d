package com.agentnet.coordinator.intelligence;

/**
 * Direction of the network health score over recent checks.
 */
public enum Trend {
    INSUFFICIENT_DATA,
    IMPROVING,
    STABLE,
    DEGRADING
}
