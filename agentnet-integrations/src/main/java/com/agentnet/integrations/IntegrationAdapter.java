package com.agentnet.integrations;

import com.agentnet.common.health.ReflectiveModule;

/**
 * Bridge between the coordinator and one subsystem (consensus, swarm
 * orchestration, DAG execution).
 */
public interface IntegrationAdapter extends ReflectiveModule {

    String getSystemName();

    /**
     * Connect to the subsystem. Ends Connected, or Error if connecting failed.
     */
    void start();

    /**
     * Cancel in-flight work and disconnect.
     */
    void stop();

    IntegrationStatus getStatus();

    SystemIntegration getIntegrationStatus();

    /**
     * Run the coordinator's request through this subsystem. Never throws for
     * domain failures; they come back as an unsuccessful outcome.
     */
    AdapterOutcome coordinate(CoordinationRequest request);
}
