package com.agentnet.registry;

/**
 * Operator-driven lifecycle transitions.
 */
public enum LifecycleAction {
    START(AgentStatus.ACTIVE),
    PAUSE(AgentStatus.IDLE),
    RESUME(AgentStatus.ACTIVE),
    STOP(AgentStatus.OFFLINE);

    private final AgentStatus target;

    LifecycleAction(AgentStatus target) {
        this.target = target;
    }

    public AgentStatus targetStatus() {
        return target;
    }
}
