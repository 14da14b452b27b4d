package com.agentnet.coordinator;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException.ErrorKind;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.common.health.ReflectiveModule;
import com.agentnet.common.infra.IntervalLoop;
import com.agentnet.coordinator.intelligence.IntelligenceInsights;
import com.agentnet.coordinator.intelligence.NetworkIntelligenceEngine;
import com.agentnet.integrations.AdapterOutcome;
import com.agentnet.integrations.CoordinationRequest;
import com.agentnet.integrations.IntegrationAdapter;
import com.agentnet.integrations.IntegrationStatus;
import com.agentnet.integrations.SystemIntegration;
import com.agentnet.integrations.consensus.ConflictComplexity;
import com.agentnet.integrations.consensus.ConflictData;
import com.agentnet.integrations.consensus.ConflictEscalation;
import com.agentnet.integrations.consensus.ConsensusAdapter;
import com.agentnet.registry.AgentInfo;
import com.agentnet.registry.AgentQuery;
import com.agentnet.registry.AgentRegistry;
import com.agentnet.registry.AgentStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Routes tasks across subsystems, keeps the network-wide view of agents and
 * integrations, and judges overall coordination health.
 *
 * <p>All network state is mutated under one lock, never held while an adapter
 * runs; readers get snapshots through {@link #getNetworkState()}.
 */
@Slf4j
public class NetworkCoordinator implements ReflectiveModule, AutoCloseable {

    /** Overhead above this multiple of the ceiling is Critical. */
    static final double CRITICAL_OVERHEAD_FACTOR = 2.0;
    /** Share of adapters that may be unhealthy before the network is Critical. */
    static final double CRITICAL_UNHEALTHY_SHARE = 0.5;
    /** Scales the mean allocation mismatch into an expected efficiency gain. */
    static final double ALLOCATION_GAIN_FACTOR = 0.5;

    private final AgentNetworkConfig config;
    private final AgentRegistry registry;
    private final LongSupplier clock;
    private final NetworkIntelligenceEngine intelligence;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final IntervalLoop healthLoop;

    private final Map<String, IntegrationAdapter> adapters = Collections.synchronizedMap(new LinkedHashMap<>());

    // Guarded by lock
    private final Map<String, SystemIntegration> integrations = new LinkedHashMap<>();
    private Map<String, AgentInfo> agentMirror = Map.of();
    private CoordinationStatus coordinationStatus = CoordinationStatus.OPTIMAL;
    private NetworkPerformanceMetrics metrics;
    private IntelligenceInsights insights = IntelligenceInsights.empty();
    private double averageOverheadMs;
    private long coordinationCount;
    private long healthChecks;
    private long upChecks;
    private boolean stopped;
    private final long createdAt;
    private long lastUpdated;
    private long startedAt;

    public NetworkCoordinator(AgentNetworkConfig config, AgentRegistry registry) {
        this(config, registry, System::currentTimeMillis);
    }

    public NetworkCoordinator(AgentNetworkConfig config, AgentRegistry registry, LongSupplier clock) {
        this.config = config;
        this.registry = registry;
        this.clock = clock;
        this.intelligence = new NetworkIntelligenceEngine(config.getMaxCoordinationOverheadMs());
        this.createdAt = clock.getAsLong();
        this.lastUpdated = createdAt;
        this.metrics = NetworkPerformanceMetrics.initial(createdAt);
        this.healthLoop = new IntervalLoop("network-health-monitor", config.healthCheckInterval(),
                this::monitorNetworkHealth);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Start periodic health monitoring. A closed coordinator cannot be restarted.
     */
    public void start() {
        if (healthLoop.isClosed()) {
            log.warn("Network coordinator is closed and cannot be restarted");
            return;
        }
        if (running.compareAndSet(false, true)) {
            lock.lock();
            try {
                stopped = false;
                startedAt = clock.getAsLong();
                if (coordinationStatus == CoordinationStatus.OFFLINE) {
                    coordinationStatus = CoordinationStatus.OPTIMAL;
                }
            } finally {
                lock.unlock();
            }
            healthLoop.start();
            log.info("Network coordinator started (health check every {}s, overhead ceiling {}ms)",
                    config.getHealthCheckIntervalSeconds(), config.getMaxCoordinationOverheadMs());
        }
    }

    /**
     * Stop monitoring and every registered adapter, then go Offline.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        healthLoop.stop();
        List<IntegrationAdapter> registered = registeredAdapters();
        registered.forEach(IntegrationAdapter::stop);
        lock.lock();
        try {
            adapters.forEach((name, adapter) -> integrations.put(name, adapter.getIntegrationStatus()));
            stopped = true;
            coordinationStatus = CoordinationStatus.OFFLINE;
            lastUpdated = clock.getAsLong();
        } finally {
            lock.unlock();
        }
        log.info("Network coordinator stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        healthLoop.close();
    }

    // =========================================================================
    // Integrations
    // =========================================================================

    /**
     * Register an adapter under a system name. Agents whose system type equals the
     * name are routed to it. Replaces any adapter already registered under the name.
     */
    public void registerSystemIntegration(String systemName, IntegrationAdapter adapter) {
        lock.lock();
        try {
            IntegrationAdapter previous = adapters.put(systemName, adapter);
            if (previous != null && previous != adapter) {
                log.warn("System integration replaced: {}", systemName);
            }
            SystemIntegration snapshot = adapter.getIntegrationStatus();
            integrations.put(systemName, new SystemIntegration(systemName, IntegrationStatus.CONNECTED,
                    snapshot.activeAgents(), snapshot.coordinationOverheadMs(), snapshot.successRate(),
                    clock.getAsLong(), snapshot.errorCount(), snapshot.metadata()));
            lastUpdated = clock.getAsLong();
        } finally {
            lock.unlock();
        }
        log.info("System integration registered: {}", systemName);
    }

    public Optional<IntegrationAdapter> getIntegration(String systemName) {
        return Optional.ofNullable(adapters.get(systemName));
    }

    private List<IntegrationAdapter> registeredAdapters() {
        synchronized (adapters) {
            return List.copyOf(adapters.values());
        }
    }

    // =========================================================================
    // Coordination
    // =========================================================================

    /**
     * Select agents per relevant subsystem and run the task through each subsystem's
     * adapter. Never throws for domain failures.
     * <p>
     * The lock is held while the plan is built and while the outcome is folded into
     * the network metrics, not while adapters run, so health checks and state
     * snapshots answer during long coordinations.
     */
    public CoordinationResult coordinateMultiSystemAgents(TaskRequirements requirements) {
        long started = clock.getAsLong();
        String taskId = requirements == null ? null : requirements.getTaskId();
        Map<String, List<AgentInfo>> plan = new LinkedHashMap<>();
        Map<String, IntegrationAdapter> selected = new LinkedHashMap<>();

        lock.lock();
        try {
            if (taskId == null || taskId.isBlank()) {
                return fail(null, ErrorKind.VALIDATION_ERROR, "Task id is required", started);
            }
            List<String> declared = requirements.getSystems() == null ? List.of() : requirements.getSystems();
            if (!declared.isEmpty()) {
                for (String system : new LinkedHashSet<>(declared)) {
                    if (!adapters.containsKey(system)) {
                        return fail(taskId, ErrorKind.NOT_FOUND, "Unknown system: " + system, started);
                    }
                    List<AgentInfo> candidates = candidatesFor(system, requirements);
                    if (candidates.isEmpty()) {
                        return fail(taskId, ErrorKind.NO_AGENTS_AVAILABLE,
                                "No eligible agents for system " + system, started);
                    }
                    plan.put(system, candidates);
                }
            } else {
                for (String system : registeredSystems()) {
                    List<AgentInfo> candidates = candidatesFor(system, requirements);
                    if (!candidates.isEmpty()) {
                        plan.put(system, candidates);
                    }
                }
                if (plan.isEmpty()) {
                    return fail(taskId, ErrorKind.NO_AGENTS_AVAILABLE,
                            "No eligible agents for task " + taskId, started);
                }
            }

            for (String system : plan.keySet()) {
                IntegrationAdapter adapter = adapters.get(system);
                if (adapter == null || adapter.getStatus() != IntegrationStatus.CONNECTED) {
                    return fail(taskId, ErrorKind.INTEGRATION_UNAVAILABLE,
                            "Integration '" + system + "' is "
                                    + (adapter == null ? "not registered" : adapter.getStatus()),
                            started);
                }
                selected.put(system, adapter);
            }
        } finally {
            lock.unlock();
        }

        Map<String, AdapterOutcome> outcomes = new LinkedHashMap<>();
        long workTime = 0;
        for (var entry : plan.entrySet()) {
            CoordinationRequest request = new CoordinationRequest(taskId, requirements.getTaskType(),
                    entry.getValue(), requirements.getParameters(), requirements.getTimeout());
            AdapterOutcome outcome = selected.get(entry.getKey()).coordinate(request);
            outcomes.put(entry.getKey(), outcome);
            workTime += outcome.workTimeMs();
        }

        long elapsed = clock.getAsLong() - started;
        long overhead = Math.max(0, elapsed - workTime);
        Map<String, List<String>> planIds = new LinkedHashMap<>();
        plan.forEach((system, agents) -> planIds.put(system, agents.stream().map(AgentInfo::getId).toList()));
        List<String> agentsUsed = outcomes.values().stream()
                .flatMap(o -> o.agentsUsed().stream())
                .distinct()
                .toList();
        Optional<AdapterOutcome> firstFailure = outcomes.values().stream().filter(o -> !o.success()).findFirst();

        lock.lock();
        try {
            recordOverhead(overhead);
            coordinationCount++;
            lastUpdated = clock.getAsLong();
            if (firstFailure.isPresent()) {
                degrade();
            }
        } finally {
            lock.unlock();
        }

        if (firstFailure.isPresent()) {
            AdapterOutcome failed = firstFailure.get();
            log.error("Coordination of task {} failed in '{}': {}", taskId, failed.systemName(), failed.error());
            return new CoordinationResult(false, taskId, planIds, outcomes, agentsUsed, elapsed, overhead,
                    failed.errorKind(), failed.error());
        }
        log.info("Task {} coordinated across {} in {}ms (overhead {}ms)", taskId, plan.keySet(), elapsed, overhead);
        return new CoordinationResult(true, taskId, planIds, outcomes, agentsUsed, elapsed, overhead, null, null);
    }

    private List<String> registeredSystems() {
        synchronized (adapters) {
            return List.copyOf(adapters.keySet());
        }
    }

    /**
     * Agents of the system that can take work, best first.
     */
    private List<AgentInfo> candidatesFor(String system, TaskRequirements requirements) {
        AgentQuery query = AgentQuery.builder()
                .systemType(system)
                .capabilities(requirements.getRequiredCapabilities())
                .build();
        return registry.capabilityMatch(query, requirements.getPreferredCapabilities()).stream()
                .filter(a -> a.getStatus().isAssignable())
                .limit(config.getMaxAgentsPerSystem())
                .toList();
    }

    private CoordinationResult fail(String taskId, ErrorKind kind, String error, long started) {
        degrade();
        log.error("Coordination of task {} failed: {}", taskId, error);
        return CoordinationResult.failed(taskId, kind, error, clock.getAsLong() - started);
    }

    private void degrade() {
        if (coordinationStatus == CoordinationStatus.OPTIMAL) {
            coordinationStatus = CoordinationStatus.DEGRADED;
        }
    }

    private void recordOverhead(double sampleMs) {
        averageOverheadMs = coordinationCount == 0 ? sampleMs : (averageOverheadMs + sampleMs) / 2;
    }

    /**
     * Overwrite the rolling overhead average.
     */
    void setAverageCoordinationOverheadMs(double overheadMs) {
        lock.lock();
        try {
            averageOverheadMs = overheadMs;
        } finally {
            lock.unlock();
        }
    }

    public double getAverageCoordinationOverheadMs() {
        lock.lock();
        try {
            return averageOverheadMs;
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Allocation
    // =========================================================================

    /**
     * Compare the forecast's agent needs per system with the current population.
     * Advisory only.
     */
    public AllocationResult optimizeAgentAllocation(WorkloadForecast forecast) {
        if (forecast == null || forecast.taskVolumeBySystem().isEmpty()) {
            return AllocationResult.failed(ErrorKind.VALIDATION_ERROR, "Forecast has no task volume");
        }
        if (forecast.tasksPerAgent() <= 0) {
            return AllocationResult.failed(ErrorKind.VALIDATION_ERROR, "tasksPerAgent must be positive");
        }

        List<AllocationResult.SystemAllocation> allocations = new ArrayList<>();
        double mismatch = 0.0;
        for (var entry : forecast.taskVolumeBySystem().entrySet().stream()
                .sorted(Map.Entry.comparingByKey()).toList()) {
            String system = entry.getKey();
            int volume = Math.max(0, entry.getValue());
            int required = (int) Math.ceil((double) volume / forecast.tasksPerAgent());
            int current = (int) registry.discoverAgents(AgentQuery.forSystem(system)).stream()
                    .filter(a -> a.getStatus() != AgentStatus.OFFLINE)
                    .count();

            AllocationResult.Action action = required > current ? AllocationResult.Action.SCALE_UP
                    : required < current ? AllocationResult.Action.SCALE_DOWN
                    : AllocationResult.Action.MAINTAIN;
            allocations.add(new AllocationResult.SystemAllocation(system, current, required, action));
            int larger = Math.max(required, current);
            mismatch += larger == 0 ? 0.0 : (double) Math.abs(required - current) / larger;
        }
        double gain = mismatch / allocations.size() * ALLOCATION_GAIN_FACTOR;
        log.info("Agent allocation optimized for {} system(s), expected gain {}", allocations.size(), gain);
        return new AllocationResult(true, allocations, gain, null, null);
    }

    // =========================================================================
    // Conflicts
    // =========================================================================

    /**
     * Settle a conflict between agents. Simple conflicts go to the earliest-registered
     * involved agent; complex ones are escalated to the consensus integration.
     */
    public ConflictResolution handleCrossSystemConflicts(ConflictData conflict) {
        ConflictComplexity complexity = ConflictComplexity.classify(conflict);
        ConflictResolution.Strategy strategy = complexity.requiresConsensus()
                ? ConflictResolution.Strategy.CONSENSUS
                : ConflictResolution.Strategy.SIMPLE;

        List<AgentInfo> involved = conflict.agents().stream()
                .map(registry::getAgent)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingLong(AgentInfo::getCreatedAt))
                .toList();
        if (involved.isEmpty()) {
            log.warn("Conflict {} names no registered agents", conflict.conflictId());
            return ConflictResolution.failed(conflict.conflictId(), strategy, ErrorKind.NOT_FOUND,
                    "No registered agents involved in conflict " + conflict.conflictId());
        }
        List<String> affected = involved.stream().map(AgentInfo::getId).toList();

        ConflictResolution resolution;
        if (strategy == ConflictResolution.Strategy.SIMPLE) {
            resolution = new ConflictResolution(true, conflict.conflictId(), strategy, "earliest_registration",
                    affected.get(0), affected, null, null);
        } else {
            resolution = escalate(conflict, involved, affected);
        }

        if (resolution.success()) {
            lock.lock();
            try {
                intelligence.learn("Conflict type '" + conflict.conflictType() + "' resolved with "
                        + strategy.name().toLowerCase(Locale.ROOT) + " strategy");
                insights = withLearnedPatterns(insights);
            } finally {
                lock.unlock();
            }
            log.info("Conflict {} resolved ({}): {}", conflict.conflictId(), strategy, resolution.resolution());
        }
        return resolution;
    }

    private ConflictResolution escalate(ConflictData conflict, List<AgentInfo> involved, List<String> affected) {
        Optional<IntegrationAdapter> adapter = getIntegration(ConsensusAdapter.SYSTEM_NAME);
        if (adapter.isEmpty() || !(adapter.get() instanceof ConsensusAdapter consensus)
                || consensus.getStatus() != IntegrationStatus.CONNECTED) {
            return ConflictResolution.failed(conflict.conflictId(), ConflictResolution.Strategy.CONSENSUS,
                    ErrorKind.INTEGRATION_UNAVAILABLE, "Consensus integration is not available");
        }
        ConflictEscalation escalation = consensus.escalateConflict(conflict, involved);
        if (!escalation.success()) {
            return ConflictResolution.failed(conflict.conflictId(), ConflictResolution.Strategy.CONSENSUS,
                    ErrorKind.EXECUTION_FAILURE, escalation.error());
        }
        return new ConflictResolution(true, conflict.conflictId(), ConflictResolution.Strategy.CONSENSUS,
                escalation.resolution(), null, affected, null, null);
    }

    private IntelligenceInsights withLearnedPatterns(IntelligenceInsights current) {
        return new IntelligenceInsights(intelligence.getLearnedPatterns(), current.optimizationSuggestions(),
                current.predictedPerformance(), current.confidenceScores(), current.healthScore(), current.trend());
    }

    // =========================================================================
    // Health monitoring
    // =========================================================================

    /**
     * Refresh integration snapshots and the agent mirror, then recompute the
     * coordination status and network metrics.
     */
    public HealthReport monitorNetworkHealth() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            int unhealthy = 0;
            boolean allConnected = true;
            Map<String, IntegrationAdapter> current;
            synchronized (adapters) {
                current = new LinkedHashMap<>(adapters);
            }
            for (var entry : current.entrySet()) {
                IntegrationAdapter adapter = entry.getValue();
                integrations.put(entry.getKey(), adapter.getIntegrationStatus());
                if (!adapter.isHealthy()) {
                    unhealthy++;
                }
                if (adapter.getStatus() != IntegrationStatus.CONNECTED) {
                    allConnected = false;
                }
            }

            Map<String, AgentInfo> mirror = new LinkedHashMap<>();
            registry.getAllAgents().forEach(a -> mirror.put(a.getId(), a));
            agentMirror = mirror;
            HealthReport.AgentHealth agentHealth = agentHealth(mirror.values());

            coordinationStatus = determineStatus(current.size(), unhealthy, allConnected);
            healthChecks++;
            if (coordinationStatus != CoordinationStatus.CRITICAL && coordinationStatus != CoordinationStatus.OFFLINE) {
                upChecks++;
            }

            double successRate = integrations.values().stream()
                    .mapToDouble(SystemIntegration::successRate)
                    .average()
                    .orElse(1.0);
            metrics = new NetworkPerformanceMetrics(agentHealth.total(), agentHealth.active(), averageOverheadMs,
                    agentHealth.total() == 0 ? 1.0 : (double) agentHealth.active() / agentHealth.total(),
                    successRate, 100.0 * upChecks / healthChecks, coordinationCount, now);
            insights = intelligence.analyze(metrics);
            lastUpdated = now;

            NetworkState state = snapshot();
            log.debug("Network health: {} ({} adapter(s), {} unhealthy, overhead {}ms)", coordinationStatus,
                    current.size(), unhealthy, averageOverheadMs);
            return new HealthReport(coordinationStatus, integrations, agentHealth, metrics, state.healthSummary(),
                    now);
        } finally {
            lock.unlock();
        }
    }

    private CoordinationStatus determineStatus(int adapterCount, int unhealthyAdapters, boolean allConnected) {
        if (stopped) {
            return CoordinationStatus.OFFLINE;
        }
        double ceiling = config.getMaxCoordinationOverheadMs();
        boolean mostlyUnhealthy = adapterCount > 0
                && (double) unhealthyAdapters / adapterCount > CRITICAL_UNHEALTHY_SHARE;
        if (mostlyUnhealthy || averageOverheadMs > ceiling * CRITICAL_OVERHEAD_FACTOR) {
            return CoordinationStatus.CRITICAL;
        }
        if (averageOverheadMs > ceiling || !allConnected) {
            return CoordinationStatus.DEGRADED;
        }
        return CoordinationStatus.OPTIMAL;
    }

    private static HealthReport.AgentHealth agentHealth(Iterable<AgentInfo> agents) {
        int total = 0, active = 0, idle = 0, busy = 0, error = 0, offline = 0;
        for (AgentInfo agent : agents) {
            total++;
            switch (agent.getStatus()) {
                case ACTIVE -> active++;
                case IDLE -> idle++;
                case BUSY -> busy++;
                case ERROR -> error++;
                case OFFLINE -> offline++;
            }
        }
        return new HealthReport.AgentHealth(total, active, idle, busy, error, offline);
    }

    public NetworkState getNetworkState() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    private NetworkState snapshot() {
        Map<String, AgentInfo> agents = new LinkedHashMap<>();
        agentMirror.forEach((id, agent) -> agents.put(id, agent.copy()));
        return new NetworkState(agents, integrations, metrics, coordinationStatus, insights, createdAt,
                lastUpdated);
    }

    public CoordinationStatus getCoordinationStatus() {
        lock.lock();
        try {
            return coordinationStatus;
        } finally {
            lock.unlock();
        }
    }

    public NetworkIntelligenceEngine getIntelligenceEngine() {
        return intelligence;
    }

    // =========================================================================
    // ReflectiveModule
    // =========================================================================

    @Override
    public ModuleStatus getModuleStatus() {
        if (!running.get()) {
            return ModuleStatus.SHUTDOWN;
        }
        return getCoordinationStatus().toModuleStatus();
    }

    @Override
    public List<HealthIndicator> getHealthIndicators() {
        NetworkState state = getNetworkState();
        double overhead = getAverageCoordinationOverheadMs();
        double ceiling = config.getMaxCoordinationOverheadMs();
        List<HealthIndicator> indicators = new ArrayList<>();

        boolean isRunning = running.get();
        indicators.add(HealthIndicator.of("coordinator_running",
                isRunning ? ModuleStatus.HEALTHY : ModuleStatus.UNHEALTHY,
                isRunning ? "Network coordinator is running" : "Network coordinator is stopped"));

        indicators.add(HealthIndicator.of("coordination_status",
                state.coordinationStatus() == CoordinationStatus.OPTIMAL ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                "Coordination status: " + state.coordinationStatus()));

        indicators.add(new HealthIndicator("coordination_overhead",
                overhead <= ceiling ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                String.format("Average coordination overhead: %.2fms", overhead),
                Map.of("thresholdMs", ceiling, "averageMs", overhead)));

        NetworkHealthSummary summary = state.healthSummary();
        indicators.add(new HealthIndicator("system_integrations",
                summary.connectedSystems() == summary.totalSystems() ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                "Connected systems: " + summary.connectedSystems() + "/" + summary.totalSystems(),
                Map.of("connected", summary.connectedSystems(), "total", summary.totalSystems())));

        indicators.add(new HealthIndicator("agent_network",
                summary.totalAgents() > 0 && summary.activeAgents() > 0 ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                "Active agents: " + summary.activeAgents() + "/" + summary.totalAgents(),
                Map.of("active", summary.activeAgents(), "total", summary.totalAgents())));
        return indicators;
    }

    @Override
    public Map<String, Object> getOperationalInfo() {
        NetworkState state = getNetworkState();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("running", running.get());
        info.put("coordinationStatus", state.coordinationStatus());
        info.put("maxCoordinationOverheadMs", config.getMaxCoordinationOverheadMs());
        info.put("healthCheckIntervalSeconds", config.getHealthCheckIntervalSeconds());
        info.put("averageCoordinationOverheadMs", getAverageCoordinationOverheadMs());
        info.put("coordinationCount", state.performanceMetrics().coordinationCount());
        info.put("networkEfficiency", state.performanceMetrics().networkEfficiency());
        info.put("successRate", state.performanceMetrics().successRate());
        info.put("uptimePercentage", state.performanceMetrics().uptimePercentage());
        info.put("systemIntegrations", List.copyOf(state.systemIntegrations().keySet()));
        info.put("learnedPatterns", state.intelligenceInsights().learnedPatterns().size());
        info.put("uptimeMs", running.get() ? clock.getAsLong() - startedAt : 0L);
        return info;
    }
}
