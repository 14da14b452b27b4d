package com.agentnet.registry;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.common.health.ReflectiveModule;
import com.agentnet.common.infra.IntervalLoop;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * In-memory registry of agents from every subsystem, indexed by capability,
 * system type and status.
 * <p>
 * All maps are guarded by one read/write lock. Every agent id sits in exactly the
 * index buckets matching its current fields, and empty buckets are dropped.
 * Callers only ever see copies of the stored entries.
 */
@Slf4j
public class AgentRegistry implements ReflectiveModule, AutoCloseable {

    static final double UNHEALTHY_ERROR_RATIO = 0.5;
    static final double DEGRADED_ERROR_RATIO = 0.2;
    static final double MIN_ACTIVE_RATIO = 0.3;

    private final AgentNetworkConfig config;
    private final LongSupplier clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, AgentInfo> agents = new HashMap<>();
    private final Map<String, Set<String>> capabilityIndex = new HashMap<>();
    private final Map<String, Set<String>> systemIndex = new HashMap<>();
    private final Map<AgentStatus, Set<String>> statusIndex = new EnumMap<>(AgentStatus.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final IntervalLoop cleanupLoop;

    public AgentRegistry(AgentNetworkConfig config) {
        this(config, System::currentTimeMillis);
    }

    /**
     * @param clock epoch-millis time source; tests pass a controllable one
     */
    public AgentRegistry(AgentNetworkConfig config, LongSupplier clock) {
        this.config = config;
        this.clock = clock;
        this.cleanupLoop = new IntervalLoop("agent-registry-cleanup", config.cleanupInterval(),
                () -> evictStaleAgents(clock.getAsLong()));
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Start the stale-agent eviction loop. A closed registry cannot be restarted.
     */
    public void start() {
        if (cleanupLoop.isClosed()) {
            log.warn("Agent registry is closed and cannot be restarted");
            return;
        }
        if (running.compareAndSet(false, true)) {
            cleanupLoop.start();
            log.info("Agent registry started (timeout: {}s, cleanup: {}s)",
                    config.getAgentTimeoutSeconds(), config.getCleanupIntervalSeconds());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            cleanupLoop.stop();
            log.info("Agent registry stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        cleanupLoop.close();
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register an agent, or update it in place when the id is already known.
     * Re-registration replaces capabilities and system type, merges metadata and
     * keeps the current status.
     *
     * @return false only for invalid input
     */
    public boolean registerAgent(String agentId, String systemType, Set<String> capabilities,
            Map<String, String> metadata) {
        if (agentId == null || agentId.isBlank() || systemType == null || systemType.isBlank()) {
            log.warn("Rejected agent registration with blank id or system type: id={}, system={}",
                    agentId, systemType);
            return false;
        }
        Set<String> caps = capabilities == null ? Set.of() : capabilities;
        long now = clock.getAsLong();

        lock.writeLock().lock();
        try {
            AgentInfo existing = agents.get(agentId);
            if (existing != null) {
                unindex(existing);
                existing.setSystemType(systemType);
                existing.setCapabilities(new LinkedHashSet<>(caps));
                if (metadata != null) {
                    existing.getMetadata().putAll(metadata);
                }
                touch(existing, now);
                index(existing);
                log.warn("Agent re-registered, updated in place: {} ({})", agentId, systemType);
                return true;
            }

            AgentInfo agent = AgentInfo.builder()
                    .id(agentId)
                    .systemType(systemType)
                    .capabilities(new LinkedHashSet<>(caps))
                    .status(AgentStatus.IDLE)
                    .createdAt(now)
                    .lastSeen(now)
                    .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                    .build();
            agents.put(agentId, agent);
            index(agent);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Agent registered: {} ({}) with {} capabilities", agentId, systemType, caps.size());
        return true;
    }

    public boolean unregisterAgent(String agentId) {
        lock.writeLock().lock();
        try {
            AgentInfo removed = agents.remove(agentId);
            if (removed == null) {
                log.warn("Cannot unregister unknown agent: {}", agentId);
                return false;
            }
            unindex(removed);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Agent unregistered: {}", agentId);
        return true;
    }

    // =========================================================================
    // Discovery
    // =========================================================================

    /**
     * Agents matching every present filter, best score first (ties by id).
     */
    public List<AgentInfo> discoverAgents(AgentQuery query) {
        AgentQuery q = query == null ? AgentQuery.all() : query;
        lock.readLock().lock();
        try {
            Set<String> candidates = null;
            if (q.getCapabilities() != null) {
                for (String capability : q.getCapabilities()) {
                    candidates = intersect(candidates, capabilityIndex.get(capability));
                }
            }
            if (q.getSystemType() != null) {
                candidates = intersect(candidates, systemIndex.get(q.getSystemType()));
            }
            if (q.getStatus() != null) {
                candidates = intersect(candidates, statusIndex.get(q.getStatus()));
            }
            Collection<String> ids = candidates == null ? agents.keySet() : candidates;

            List<AgentInfo> result = rank(ids.stream().map(agents::get).toList());
            if (q.getLimit() != null && q.getLimit() >= 0 && result.size() > q.getLimit()) {
                result = result.subList(0, q.getLimit());
            }
            List<AgentInfo> copies = result.stream().map(AgentInfo::copy).toList();
            log.debug("Discovery {} matched {} agent(s)", q, copies.size());
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Agents holding every required capability, re-ranked by how many preferred
     * capabilities they also hold.
     */
    public List<AgentInfo> capabilityMatch(Set<String> required, Set<String> preferred) {
        return capabilityMatch(AgentQuery.withCapabilities(required), preferred);
    }

    /**
     * Capability match on top of an arbitrary discovery query.
     */
    public List<AgentInfo> capabilityMatch(AgentQuery query, Set<String> preferred) {
        List<AgentInfo> matches = discoverAgents(query);
        if (preferred == null || preferred.isEmpty()) {
            return matches;
        }
        List<AgentInfo> ranked = new ArrayList<>(matches);
        // List.sort is stable, so discovery order breaks ties
        ranked.sort(Comparator.comparingDouble(
                (AgentInfo a) -> AgentScoring.capabilityMatchScore(a, preferred)).reversed());
        return ranked;
    }

    public Optional<AgentInfo> getAgent(String agentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId)).map(AgentInfo::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AgentInfo> getAllAgents() {
        return discoverAgents(AgentQuery.all());
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // =========================================================================
    // Updates
    // =========================================================================

    public boolean updateAgentStatus(String agentId, AgentStatus status) {
        boolean updated = mutate(agentId, agent -> {
            if (agent.getStatus() != status) {
                removeFromBucket(statusIndex, agent.getStatus(), agent.getId());
                agent.setStatus(status);
                statusIndex.computeIfAbsent(status, k -> new LinkedHashSet<>()).add(agent.getId());
            }
        });
        if (updated) {
            log.debug("Agent {} status -> {}", agentId, status);
        }
        return updated;
    }

    /**
     * Append a performance sample; the oldest samples are dropped past the history limit.
     */
    public boolean trackPerformance(String agentId, PerformanceMetric metric) {
        if (metric == null) {
            return false;
        }
        return mutate(agentId, agent -> {
            List<PerformanceMetric> history = agent.getPerformanceHistory();
            history.add(metric);
            int overflow = history.size() - config.getPerformanceHistoryLimit();
            if (overflow > 0) {
                history.subList(0, overflow).clear();
            }
        });
    }

    public boolean updateResources(String agentId, ResourceUsage usage) {
        return mutate(agentId, agent -> agent.setResourceUsage(usage));
    }

    public boolean manageAgentLifecycle(String agentId, LifecycleAction action) {
        boolean done = updateAgentStatus(agentId, action.targetStatus());
        if (done) {
            log.info("Agent {} lifecycle action {} applied", agentId, action);
        }
        return done;
    }

    // =========================================================================
    // Eviction
    // =========================================================================

    /**
     * Remove every agent not seen within the agent timeout, and every Offline agent.
     *
     * @return ids of the evicted agents
     */
    public List<String> evictStaleAgents(long nowMs) {
        long timeoutMs = config.agentTimeout().toMillis();
        List<String> evicted = new ArrayList<>();
        lock.writeLock().lock();
        try {
            var it = agents.values().iterator();
            while (it.hasNext()) {
                AgentInfo agent = it.next();
                boolean stale = nowMs - agent.getLastSeen() > timeoutMs;
                if (stale || agent.getStatus() == AgentStatus.OFFLINE) {
                    it.remove();
                    unindex(agent);
                    evicted.add(agent.getId());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted {} stale agent(s): {}", evicted.size(), evicted);
        }
        return evicted;
    }

    public List<String> evictStaleAgents() {
        return evictStaleAgents(clock.getAsLong());
    }

    // =========================================================================
    // Stats and health
    // =========================================================================

    public RegistryStats getRegistryStats() {
        lock.readLock().lock();
        try {
            Map<AgentStatus, Integer> byStatus = new EnumMap<>(AgentStatus.class);
            statusIndex.forEach((status, ids) -> byStatus.put(status, ids.size()));
            Map<String, Integer> bySystem = new TreeMap<>();
            systemIndex.forEach((system, ids) -> bySystem.put(system, ids.size()));
            return new RegistryStats(agents.size(), byStatus, bySystem, capabilityIndex.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ModuleStatus getModuleStatus() {
        if (!running.get()) {
            return ModuleStatus.SHUTDOWN;
        }
        RegistryStats stats = getRegistryStats();
        if (stats.totalAgents() == 0) {
            return ModuleStatus.HEALTHY;
        }
        double errorRatio = stats.ratio(AgentStatus.ERROR);
        if (errorRatio > UNHEALTHY_ERROR_RATIO) {
            return ModuleStatus.UNHEALTHY;
        }
        if (errorRatio > DEGRADED_ERROR_RATIO || stats.ratio(AgentStatus.ACTIVE) < MIN_ACTIVE_RATIO) {
            return ModuleStatus.DEGRADED;
        }
        return ModuleStatus.HEALTHY;
    }

    @Override
    public List<HealthIndicator> getHealthIndicators() {
        RegistryStats stats = getRegistryStats();
        int total = stats.totalAgents();
        List<HealthIndicator> indicators = new ArrayList<>();

        indicators.add(HealthIndicator.of("registry_running",
                running.get() ? ModuleStatus.HEALTHY : ModuleStatus.UNHEALTHY,
                running.get() ? "Agent registry is running" : "Agent registry is stopped"));

        indicators.add(new HealthIndicator("agent_population",
                total > 0 ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                "Total registered agents: " + total,
                Map.of("total", total, "byStatus", Map.copyOf(stats.byStatus()))));

        int active = stats.count(AgentStatus.ACTIVE);
        double activeRatio = stats.ratio(AgentStatus.ACTIVE);
        indicators.add(new HealthIndicator("agent_activity",
                activeRatio >= MIN_ACTIVE_RATIO ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                String.format("Active agents: %d/%d (%.1f%%)", active, total, activeRatio * 100),
                Map.of("active", active, "total", total, "ratio", activeRatio)));

        int errors = stats.count(AgentStatus.ERROR);
        double errorRatio = stats.ratio(AgentStatus.ERROR);
        indicators.add(new HealthIndicator("agent_errors",
                errorRatio <= DEGRADED_ERROR_RATIO ? ModuleStatus.HEALTHY : ModuleStatus.UNHEALTHY,
                String.format("Error agents: %d/%d (%.1f%%)", errors, total, errorRatio * 100),
                Map.of("error", errors, "total", total, "ratio", errorRatio)));

        indicators.add(new HealthIndicator("system_distribution",
                stats.bySystem().isEmpty() ? ModuleStatus.DEGRADED : ModuleStatus.HEALTHY,
                "Agent systems: " + stats.bySystem().size() + " types",
                Map.of("systems", Map.copyOf(stats.bySystem()))));

        indicators.add(new HealthIndicator("capability_coverage",
                stats.capabilityCount() > 0 ? ModuleStatus.HEALTHY : ModuleStatus.DEGRADED,
                "Available capabilities: " + stats.capabilityCount(),
                Map.of("totalCapabilities", stats.capabilityCount())));

        return indicators;
    }

    @Override
    public Map<String, Object> getOperationalInfo() {
        RegistryStats stats = getRegistryStats();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("moduleType", "AgentRegistry");
        info.put("running", running.get());
        info.put("agentTimeoutSeconds", config.getAgentTimeoutSeconds());
        info.put("cleanupIntervalSeconds", config.getCleanupIntervalSeconds());
        info.put("performanceHistoryLimit", config.getPerformanceHistoryLimit());
        info.put("totalAgents", stats.totalAgents());
        info.put("byStatus", stats.byStatus());
        info.put("bySystem", stats.bySystem());
        info.put("capabilityCount", stats.capabilityCount());
        info.put("cleanupTicks", cleanupLoop.getTickCount());
        return info;
    }

    // =========================================================================
    // Internals (caller holds the write lock unless noted)
    // =========================================================================

    private boolean mutate(String agentId, Consumer<AgentInfo> change) {
        long now = clock.getAsLong();
        lock.writeLock().lock();
        try {
            AgentInfo agent = agents.get(agentId);
            if (agent == null) {
                log.warn("Update for unknown agent ignored: {}", agentId);
                return false;
            }
            change.accept(agent);
            touch(agent, now);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void touch(AgentInfo agent, long now) {
        agent.setLastSeen(Math.max(agent.getLastSeen(), now));
    }

    private void index(AgentInfo agent) {
        for (String capability : agent.getCapabilities()) {
            capabilityIndex.computeIfAbsent(capability, k -> new LinkedHashSet<>()).add(agent.getId());
        }
        systemIndex.computeIfAbsent(agent.getSystemType(), k -> new LinkedHashSet<>()).add(agent.getId());
        statusIndex.computeIfAbsent(agent.getStatus(), k -> new LinkedHashSet<>()).add(agent.getId());
    }

    private void unindex(AgentInfo agent) {
        for (String capability : agent.getCapabilities()) {
            removeFromBucket(capabilityIndex, capability, agent.getId());
        }
        removeFromBucket(systemIndex, agent.getSystemType(), agent.getId());
        removeFromBucket(statusIndex, agent.getStatus(), agent.getId());
    }

    private static <K> void removeFromBucket(Map<K, Set<String>> index, K key, String agentId) {
        Set<String> bucket = index.get(key);
        if (bucket != null) {
            bucket.remove(agentId);
            if (bucket.isEmpty()) {
                index.remove(key);
            }
        }
    }

    /** Null {@code acc} means "no filter yet"; a missing bucket empties the result. */
    private static Set<String> intersect(Set<String> acc, Set<String> bucket) {
        if (bucket == null) {
            return Set.of();
        }
        if (acc == null) {
            return new LinkedHashSet<>(bucket);
        }
        Set<String> result = new LinkedHashSet<>(acc);
        result.retainAll(bucket);
        return result;
    }

    private static List<AgentInfo> rank(List<AgentInfo> candidates) {
        List<AgentInfo> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingDouble(AgentScoring::score).reversed()
                .thenComparing(AgentInfo::getId));
        return ranked;
    }

    /**
     * Snapshot of the index buckets, for consistency checks.
     */
    Map<String, Map<String, Set<String>>> indexSnapshot() {
        lock.readLock().lock();
        try {
            Map<String, Set<String>> status = new HashMap<>();
            statusIndex.forEach((k, v) -> status.put(k.name(), Set.copyOf(v)));
            Map<String, Set<String>> caps = new HashMap<>();
            capabilityIndex.forEach((k, v) -> caps.put(k, Set.copyOf(v)));
            Map<String, Set<String>> systems = new HashMap<>();
            systemIndex.forEach((k, v) -> systems.put(k, Set.copyOf(v)));
            return Map.of("capability", caps, "system", systems, "status", status);
        } finally {
            lock.readLock().unlock();
        }
    }
}
