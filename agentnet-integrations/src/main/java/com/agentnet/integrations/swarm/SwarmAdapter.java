package com.agentnet.integrations.swarm;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.integrations.AbstractIntegrationAdapter;
import com.agentnet.integrations.AdapterOutcome;
import com.agentnet.integrations.CoordinationRequest;
import com.agentnet.registry.AgentInfo;
import com.agentnet.registry.AgentStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deploys agent swarms across deployment targets through a pluggable
 * {@link SwarmDeployer} and sizes swarms for a workload.
 */
@Slf4j
public class SwarmAdapter extends AbstractIntegrationAdapter {

    public static final String SYSTEM_NAME = "orchestration";
    public static final String SWARM_CONFIG_PARAMETER = "swarmConfig";
    public static final String TARGETS_PARAMETER = "targets";

    static final double BASE_AGENT_SCORE = 0.5;
    static final double ACTIVE_BONUS = 0.3;
    static final double IDLE_BONUS = 0.2;
    static final int PERFORMANCE_WINDOW = 5;
    static final double MIN_EFFICIENCY = 0.1;

    private record TargetState(boolean available, int capacity) {
    }

    private record ActiveSwarm(String swarmId, Map<DeploymentTarget, List<String>> distribution,
            int agentCount, long startedAt) {
    }

    private final SwarmDeployer deployer;
    private final ExecutorService deployExecutor;
    private final Map<DeploymentTarget, TargetState> targets = new EnumMap<>(DeploymentTarget.class);
    private final Map<String, ActiveSwarm> activeSwarms = new ConcurrentHashMap<>();

    public SwarmAdapter(AgentNetworkConfig config) {
        this(config, SwarmDeployer.noop());
    }

    public SwarmAdapter(AgentNetworkConfig config, SwarmDeployer deployer) {
        super(SYSTEM_NAME, config);
        this.deployer = deployer;
        for (DeploymentTarget target : DeploymentTarget.values()) {
            targets.put(target, new TargetState(false, target.defaultCapacity()));
        }
        AtomicInteger threadCount = new AtomicInteger();
        this.deployExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "swarm-deploy-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    protected void connect() {
        setTargetAvailability(DeploymentTarget.LOCAL, true);
        log.info("Deployment targets initialized: {}", availableTargets());
    }

    @Override
    protected void disconnect() {
        for (String swarmId : List.copyOf(activeSwarms.keySet())) {
            terminateSwarm(swarmId);
        }
    }

    @Override
    protected void release() {
        deployExecutor.shutdownNow();
    }

    // =========================================================================
    // Targets
    // =========================================================================

    public synchronized void setTargetAvailability(DeploymentTarget target, boolean available) {
        targets.put(target, new TargetState(available, targets.get(target).capacity()));
    }

    public synchronized void setTargetCapacity(DeploymentTarget target, int capacity) {
        targets.put(target, new TargetState(targets.get(target).available(), capacity));
    }

    public synchronized List<DeploymentTarget> availableTargets() {
        return targets.entrySet().stream()
                .filter(e -> e.getValue().available())
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Preferred targets that are available; otherwise the first available target
     * with room for every agent; otherwise the first available target.
     */
    synchronized List<DeploymentTarget> selectTargets(List<DeploymentTarget> preferred, int agentCount) {
        List<DeploymentTarget> available = availableTargets();
        if (available.isEmpty()) {
            throw AgentNetworkException.unavailable("No deployment targets available");
        }
        if (preferred != null && !preferred.isEmpty()) {
            List<DeploymentTarget> selected = preferred.stream().filter(available::contains).distinct().toList();
            if (!selected.isEmpty()) {
                return selected;
            }
        }
        return available.stream()
                .filter(t -> targets.get(t).capacity() >= agentCount)
                .findFirst()
                .map(List::of)
                .orElse(List.of(available.get(0)));
    }

    /**
     * Spread agents evenly, earlier targets taking the remainder.
     */
    static Map<DeploymentTarget, List<String>> distribute(List<String> agentIds, List<DeploymentTarget> selected) {
        Map<DeploymentTarget, List<String>> distribution = new LinkedHashMap<>();
        int perTarget = agentIds.size() / selected.size();
        int remainder = agentIds.size() % selected.size();
        int index = 0;
        for (int i = 0; i < selected.size(); i++) {
            int count = perTarget + (i < remainder ? 1 : 0);
            distribution.put(selected.get(i), List.copyOf(agentIds.subList(index, index + count)));
            index += count;
        }
        return distribution;
    }

    // =========================================================================
    // Deployment
    // =========================================================================

    /**
     * Deploy a swarm. Agents beyond the effective size cap are left out.
     */
    public SwarmDeployment coordinateDistributedSwarm(SwarmConfig swarmConfig, List<AgentInfo> agents,
            List<DeploymentTarget> preferredTargets) {
        String swarmId = "swarm-" + UUID.randomUUID().toString().substring(0, 8);
        long started = System.currentTimeMillis();

        int maxAgents = swarmConfig.maxAgents() > 0
                ? Math.min(swarmConfig.maxAgents(), config.getMaxSwarmSize())
                : config.getMaxSwarmSize();
        List<String> agentIds = agents.stream().map(AgentInfo::getId).toList();
        if (agentIds.size() > maxAgents) {
            log.warn("Swarm size limited to {} (requested {})", maxAgents, agentIds.size());
            agentIds = agentIds.subList(0, maxAgents);
        }
        if (agentIds.isEmpty()) {
            return failDeployment(swarmId, started, "No agents to deploy");
        }

        List<DeploymentTarget> selected;
        try {
            selected = selectTargets(preferredTargets, agentIds.size());
        } catch (AgentNetworkException e) {
            return failDeployment(swarmId, started, e.getMessage());
        }
        Map<DeploymentTarget, List<String>> distribution = distribute(agentIds, selected);

        Future<?> deployment;
        try {
            deployment = deployExecutor.submit(() -> {
                for (var entry : distribution.entrySet()) {
                    deployer.deploy(swarmId, entry.getKey(), entry.getValue());
                }
                return null;
            });
        } catch (RejectedExecutionException e) {
            return failDeployment(swarmId, started, "Swarm adapter is closed");
        }
        try {
            deployment.get(config.getSwarmTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            deployment.cancel(true);
            return failDeployment(swarmId, started,
                    "Swarm deployment timed out after " + config.getSwarmTimeoutSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failDeployment(swarmId, started,
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deployment.cancel(true);
            return failDeployment(swarmId, started, "Swarm deployment interrupted");
        }

        activeSwarms.put(swarmId, new ActiveSwarm(swarmId, distribution, agentIds.size(), started));
        agentsEngaged(agentIds.size());
        long elapsed = System.currentTimeMillis() - started;
        recordOperation("swarm_deployment_time", elapsed, true);
        log.info("Swarm {} deployed: {} agent(s) across {}", swarmId, agentIds.size(), selected);
        return new SwarmDeployment(true, swarmId, selected, distribution, agentIds.size(), elapsed, null);
    }

    private SwarmDeployment failDeployment(String swarmId, long started, String error) {
        long elapsed = System.currentTimeMillis() - started;
        recordOperation("swarm_deployment_time", elapsed, false);
        recordError(error);
        log.error("Swarm deployment failed: {} - {}", swarmId, error);
        return SwarmDeployment.failed(swarmId, elapsed, error);
    }

    /**
     * Tear down an active swarm.
     *
     * @return false if the swarm is not active
     */
    public boolean terminateSwarm(String swarmId) {
        ActiveSwarm swarm = activeSwarms.remove(swarmId);
        if (swarm == null) {
            return false;
        }
        agentsEngaged(-swarm.agentCount());
        try {
            deployer.terminate(swarmId);
        } catch (Exception e) {
            log.error("Swarm {} did not terminate cleanly: {}", swarmId, e.getMessage(), e);
        }
        log.info("Terminated swarm: {}", swarmId);
        return true;
    }

    public List<String> getActiveSwarmIds() {
        return List.copyOf(activeSwarms.keySet());
    }

    // =========================================================================
    // Composition
    // =========================================================================

    /**
     * Size a swarm for a workload and pick the best-suited agents.
     */
    public SwarmComposition optimizeSwarmComposition(WorkloadProfile workload, List<AgentInfo> available) {
        WorkloadProfile profile = workload == null ? WorkloadProfile.defaults() : workload;

        Map<String, Double> scores = new LinkedHashMap<>();
        for (AgentInfo agent : available) {
            scores.put(agent.getId(), suitability(agent));
        }
        int optimalSize = optimalSwarmSize(profile, available.size());

        List<AgentInfo> selected = available.stream()
                .sorted(Comparator.comparingDouble((AgentInfo a) -> scores.get(a.getId())).reversed())
                .limit(optimalSize)
                .toList();

        SwarmComposition.ExpectedPerformance expected = expectedPerformance(selected, profile);
        log.info("Swarm composition optimized: {} agent(s) selected", selected.size());
        return new SwarmComposition(optimalSize, selected.stream().map(AgentInfo::getId).toList(),
                scores, expected);
    }

    double suitability(AgentInfo agent) {
        double score = BASE_AGENT_SCORE;
        if (agent.getStatus() == AgentStatus.ACTIVE) {
            score += ACTIVE_BONUS;
        } else if (agent.getStatus() == AgentStatus.IDLE) {
            score += IDLE_BONUS;
        }
        var recent = agent.recentMetricMean(PERFORMANCE_WINDOW);
        if (recent.isPresent()) {
            score = (score + recent.getAsDouble()) / 2;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    int optimalSwarmSize(WorkloadProfile profile, int availableAgents) {
        int base = switch (profile.complexity() == null ? "medium" : profile.complexity()) {
            case "low" -> 2;
            case "medium" -> 5;
            default -> 10;
        };
        int optimal = (int) (base * (1 + profile.parallelization()));
        return Math.min(optimal, Math.min(availableAgents, config.getMaxSwarmSize()));
    }

    private SwarmComposition.ExpectedPerformance expectedPerformance(List<AgentInfo> selected,
            WorkloadProfile profile) {
        if (selected.isEmpty()) {
            return new SwarmComposition.ExpectedPerformance(0.0, Double.POSITIVE_INFINITY, 0.0,
                    profile.parallelization());
        }
        double average = selected.stream()
                .mapToDouble(a -> a.recentMetricMean(PERFORMANCE_WINDOW).orElse(BASE_AGENT_SCORE))
                .average()
                .orElse(BASE_AGENT_SCORE);
        int n = selected.size();
        double efficiency = average * (1 + profile.parallelization() * (n - 1) / n);
        double completion = profile.durationHours() / Math.max(efficiency, MIN_EFFICIENCY);
        return new SwarmComposition.ExpectedPerformance(Math.min(1.0, efficiency), completion, average,
                profile.parallelization());
    }

    // =========================================================================
    // Coordination
    // =========================================================================

    @Override
    protected AdapterOutcome doCoordinate(CoordinationRequest request) {
        SwarmConfig swarmConfig = request.parameter(SWARM_CONFIG_PARAMETER, SwarmConfig.class)
                .orElseGet(() -> SwarmConfig.named(request.taskId()));
        List<DeploymentTarget> preferred = new ArrayList<>();
        if (request.parameters().get(TARGETS_PARAMETER) instanceof List<?> raw) {
            raw.stream().filter(DeploymentTarget.class::isInstance).map(DeploymentTarget.class::cast)
                    .forEach(preferred::add);
        }

        SwarmDeployment deployment = coordinateDistributedSwarm(swarmConfig, request.agents(), preferred);
        if (!deployment.success()) {
            return AdapterOutcome.failure(SYSTEM_NAME, AgentNetworkException.ErrorKind.EXECUTION_FAILURE,
                    deployment.error());
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("swarmId", deployment.swarmId());
        output.put("targets", deployment.targets().stream().map(Enum::name).toList());
        output.put("deployedAgents", deployment.deployedAgents());
        List<String> used = deployment.distribution().values().stream().flatMap(List::stream).toList();
        return AdapterOutcome.success(SYSTEM_NAME, output, used);
    }

    // =========================================================================
    // Health
    // =========================================================================

    @Override
    protected Map<String, Object> integrationMetadata() {
        return Map.of("activeSwarms", activeSwarms.size(),
                "availableTargets", availableTargets().stream().map(Enum::name).toList());
    }

    @Override
    protected List<HealthIndicator> extraHealthIndicators() {
        List<DeploymentTarget> available = availableTargets();
        return List.of(new HealthIndicator("deployment_targets",
                available.isEmpty() ? ModuleStatus.UNHEALTHY : ModuleStatus.HEALTHY,
                "Available deployment targets: " + available.size(),
                Map.of("available", available.stream().map(Enum::name).toList(),
                        "activeSwarms", activeSwarms.size())));
    }
}
