package com.agentnet.registry;

/**
 * Lifecycle state of a registered agent.
 * Idle, Active and Busy move freely between each other; any state may go to
 * Error or Offline, and Offline agents are evicted on the next cleanup pass.
 */
public enum AgentStatus {
    IDLE,
    ACTIVE,
    BUSY,
    ERROR,
    OFFLINE;

    /**
     * Whether an agent in this state may be handed new work.
     */
    public boolean isAssignable() {
        return this != ERROR && this != OFFLINE;
    }
}
