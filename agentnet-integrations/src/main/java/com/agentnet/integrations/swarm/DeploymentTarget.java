package com.agentnet.integrations.swarm;

/**
 * Where a swarm can run, with the number of agents each target holds by default.
 */
public enum DeploymentTarget {
    LOCAL(10),
    CLOUD(100),
    HYBRID(50),
    EDGE(20);

    private final int defaultCapacity;

    DeploymentTarget(int defaultCapacity) {
        this.defaultCapacity = defaultCapacity;
    }

    public int defaultCapacity() {
        return defaultCapacity;
    }
}
