package com.agentnet.coordinator;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.config.ConfigService;
import com.agentnet.integrations.AbstractIntegrationAdapter;
import com.agentnet.integrations.consensus.ConsensusAdapter;
import com.agentnet.integrations.dag.DagAdapter;
import com.agentnet.integrations.swarm.SwarmAdapter;
import com.agentnet.registry.AgentRegistry;
import com.agentnet.scheduler.DependencyScheduler;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * One fully wired agent network: registry, scheduler, the three stock
 * integrations and the coordinator, all built from the same config.
 * <p>
 * Components are started in dependency order and closed in reverse.
 */
@Slf4j
public final class AgentNetwork implements AutoCloseable {

    private final AgentNetworkConfig config;
    private final AgentRegistry registry;
    private final DependencyScheduler scheduler;
    private final DagAdapter dagAdapter;
    private final ConsensusAdapter consensusAdapter;
    private final SwarmAdapter swarmAdapter;
    private final NetworkCoordinator coordinator;

    private AgentNetwork(AgentNetworkConfig config) {
        this.config = config;
        this.registry = new AgentRegistry(config);
        this.scheduler = new DependencyScheduler(config);
        this.dagAdapter = new DagAdapter(config, scheduler);
        this.consensusAdapter = new ConsensusAdapter(config);
        this.swarmAdapter = new SwarmAdapter(config);
        this.coordinator = new NetworkCoordinator(config, registry);
        for (AbstractIntegrationAdapter adapter : adapters()) {
            coordinator.registerSystemIntegration(adapter.getSystemName(), adapter);
        }
    }

    public static AgentNetwork create(AgentNetworkConfig config) {
        return new AgentNetwork(config);
    }

    public static AgentNetwork fromConfigService(ConfigService configService) {
        AgentNetworkConfig config = configService.loadConfig();
        log.info("Building agent network from {}", configService.getConfigPath());
        return new AgentNetwork(config);
    }

    public static AgentNetwork fromConfigFile(Path configPath) {
        return fromConfigService(new ConfigService(configPath));
    }

    /**
     * Network configured from {@value ConfigService#CONFIG_PATH_PROPERTY}, or the
     * default location under the user's home directory.
     */
    public static AgentNetwork fromSystemProperty() {
        return fromConfigService(ConfigService.fromSystemProperty());
    }

    public void start() {
        registry.start();
        adapters().forEach(AbstractIntegrationAdapter::start);
        coordinator.start();
        log.info("Agent network started with integrations {}", coordinator.getNetworkState().systemIntegrations().keySet());
    }

    /**
     * Shut everything down. The network cannot be started again.
     */
    @Override
    public void close() {
        coordinator.close();
        adapters().forEach(AbstractIntegrationAdapter::close);
        scheduler.close();
        registry.close();
        log.info("Agent network closed");
    }

    private List<AbstractIntegrationAdapter> adapters() {
        return List.of(dagAdapter, consensusAdapter, swarmAdapter);
    }

    public AgentNetworkConfig getConfig() {
        return config;
    }

    public AgentRegistry getRegistry() {
        return registry;
    }

    public DependencyScheduler getScheduler() {
        return scheduler;
    }

    public DagAdapter getDagAdapter() {
        return dagAdapter;
    }

    public ConsensusAdapter getConsensusAdapter() {
        return consensusAdapter;
    }

    public SwarmAdapter getSwarmAdapter() {
        return swarmAdapter;
    }

    public NetworkCoordinator getCoordinator() {
        return coordinator;
    }
}
