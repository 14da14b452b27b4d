package com.agentnet.registry;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry(AgentNetworkConfig.fromMap(Map.of(
                "agentTimeoutSeconds", 60,
                "performanceHistoryLimit", 5)), now::get);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private List<String> ids(List<AgentInfo> agents) {
        return agents.stream().map(AgentInfo::getId).toList();
    }

    @Nested
    class Registration {
        @Test
        void newAgent_startsIdle() {
            assertTrue(registry.registerAgent("a1", "dag", Set.of("exec"), Map.of()));

            AgentInfo agent = registry.getAgent("a1").orElseThrow();
            assertEquals(AgentStatus.IDLE, agent.getStatus());
            assertEquals("dag", agent.getSystemType());
            assertEquals(now.get(), agent.getCreatedAt());
            assertEquals(1, registry.size());
        }

        @Test
        void blankIdOrSystem_rejected() {
            assertFalse(registry.registerAgent("", "dag", Set.of(), Map.of()));
            assertFalse(registry.registerAgent("a1", " ", Set.of(), Map.of()));
            assertFalse(registry.registerAgent(null, "dag", Set.of(), Map.of()));
            assertEquals(0, registry.size());
        }

        @Test
        void reRegistration_updatesInPlaceAndReindexes() {
            registry.registerAgent("a1", "dag", Set.of("exec", "plan"), Map.of("zone", "eu"));
            registry.updateAgentStatus("a1", AgentStatus.ACTIVE);

            now.addAndGet(5_000);
            assertTrue(registry.registerAgent("a1", "consensus", Set.of("vote"), Map.of("rack", "7")));

            AgentInfo agent = registry.getAgent("a1").orElseThrow();
            assertEquals("consensus", agent.getSystemType());
            assertEquals(Set.of("vote"), agent.getCapabilities());
            assertEquals(Map.of("zone", "eu", "rack", "7"), agent.getMetadata());
            assertEquals(AgentStatus.ACTIVE, agent.getStatus());
            assertEquals(now.get(), agent.getLastSeen());
            assertEquals(1, registry.size());

            assertTrue(registry.discoverAgents(AgentQuery.withCapabilities(Set.of("exec"))).isEmpty());
            assertTrue(registry.discoverAgents(AgentQuery.forSystem("dag")).isEmpty());
            assertEquals(List.of("a1"), ids(registry.discoverAgents(AgentQuery.forSystem("consensus"))));
        }

        @Test
        void unregister_removesFromEveryIndex() {
            registry.registerAgent("a1", "dag", Set.of("exec"), Map.of());

            assertTrue(registry.unregisterAgent("a1"));
            assertFalse(registry.unregisterAgent("a1"));

            assertTrue(registry.discoverAgents(AgentQuery.all()).isEmpty());
            assertTrue(registry.discoverAgents(AgentQuery.withCapabilities(Set.of("exec"))).isEmpty());
            assertTrue(registry.getAgent("a1").isEmpty());
            var snapshot = registry.indexSnapshot();
            assertTrue(snapshot.get("capability").isEmpty());
            assertTrue(snapshot.get("system").isEmpty());
            assertTrue(snapshot.get("status").isEmpty());
        }

        @Test
        void returnedAgents_areDetachedCopies() {
            registry.registerAgent("a1", "dag", Set.of("exec"), Map.of());

            AgentInfo copy = registry.getAgent("a1").orElseThrow();
            copy.getCapabilities().add("hacked");
            copy.setStatus(AgentStatus.ERROR);

            AgentInfo stored = registry.getAgent("a1").orElseThrow();
            assertEquals(Set.of("exec"), stored.getCapabilities());
            assertEquals(AgentStatus.IDLE, stored.getStatus());
        }
    }

    @Nested
    class Discovery {
        @BeforeEach
        void populate() {
            registry.registerAgent("a1", "dag", Set.of("exec", "plan"), Map.of());
            registry.registerAgent("a2", "dag", Set.of("exec"), Map.of());
            registry.registerAgent("a3", "consensus", Set.of("vote"), Map.of());
            registry.registerAgent("a4", "orchestration", Set.of("exec", "deploy"), Map.of());
        }

        @Test
        void byCapability_containsExactlyHolders() {
            List<AgentInfo> found = registry.discoverAgents(AgentQuery.withCapabilities(Set.of("exec")));

            assertEquals(Set.of("a1", "a2", "a4"), Set.copyOf(ids(found)));
            assertTrue(found.stream().allMatch(a -> a.hasCapability("exec")));
        }

        @Test
        void multipleFilters_intersect() {
            var query = AgentQuery.builder()
                    .capabilities(Set.of("exec", "plan"))
                    .systemType("dag")
                    .build();

            assertEquals(List.of("a1"), ids(registry.discoverAgents(query)));
        }

        @Test
        void unknownCapability_shortCircuitsToEmpty() {
            var query = AgentQuery.builder().capabilities(Set.of("exec", "teleport")).build();

            assertTrue(registry.discoverAgents(query).isEmpty());
        }

        @Test
        void byStatus_andLimit() {
            registry.updateAgentStatus("a2", AgentStatus.ACTIVE);
            registry.updateAgentStatus("a4", AgentStatus.ACTIVE);

            var active = registry.discoverAgents(AgentQuery.builder().status(AgentStatus.ACTIVE).build());
            assertEquals(List.of("a2", "a4"), ids(active));

            var limited = registry.discoverAgents(AgentQuery.builder().limit(2).build());
            assertEquals(2, limited.size());
        }

        @Test
        void orderedByScore_thenId() {
            registry.updateAgentStatus("a4", AgentStatus.ACTIVE);
            registry.updateAgentStatus("a1", AgentStatus.BUSY);

            var found = registry.discoverAgents(AgentQuery.withCapabilities(Set.of("exec")));

            // a4 active 0.5, a2 idle 0.4, a1 busy 0.3
            assertEquals(List.of("a4", "a2", "a1"), ids(found));
        }

        @Test
        void sameStatusUpdate_leavesBucketsUnchanged() {
            var before = registry.indexSnapshot();

            assertTrue(registry.updateAgentStatus("a1", AgentStatus.IDLE));

            assertEquals(before, registry.indexSnapshot());
        }

        @Test
        void statusUpdate_movesBucket() {
            registry.updateAgentStatus("a1", AgentStatus.ERROR);

            var status = registry.indexSnapshot().get("status");
            assertEquals(Set.of("a1"), status.get("ERROR"));
            assertFalse(status.get("IDLE").contains("a1"));
        }

        @Test
        void unknownAgentUpdates_returnFalse() {
            assertFalse(registry.updateAgentStatus("ghost", AgentStatus.ACTIVE));
            assertFalse(registry.trackPerformance("ghost", PerformanceMetric.of("q", 1.0)));
            assertFalse(registry.updateResources("ghost", ResourceUsage.ofCpu(10)));
            assertFalse(registry.manageAgentLifecycle("ghost", LifecycleAction.START));
        }
    }

    @Nested
    class CapabilityMatch {
        @Test
        void preferredCapabilities_rerankMatches() {
            registry.registerAgent("a1", "dag", Set.of("exec"), Map.of());
            registry.registerAgent("a2", "dag", Set.of("exec", "gpu"), Map.of());
            registry.registerAgent("a3", "dag", Set.of("exec", "gpu", "fast"), Map.of());

            var ranked = registry.capabilityMatch(Set.of("exec"), Set.of("gpu", "fast"));

            assertEquals(List.of("a3", "a2", "a1"), ids(ranked));
        }

        @Test
        void noPreferred_keepsDiscoveryOrder() {
            registry.registerAgent("b", "dag", Set.of("exec"), Map.of());
            registry.registerAgent("a", "dag", Set.of("exec"), Map.of());

            assertEquals(List.of("a", "b"), ids(registry.capabilityMatch(Set.of("exec"), Set.of())));
        }
    }

    @Nested
    class Performance {
        @Test
        void history_isCappedOldestFirst() {
            registry.registerAgent("a1", "dag", Set.of(), Map.of());
            for (int i = 0; i < 8; i++) {
                registry.trackPerformance("a1", PerformanceMetric.of("q", i));
            }

            var history = registry.getAgent("a1").orElseThrow().getPerformanceHistory();
            assertEquals(5, history.size());
            assertEquals(3.0, history.get(0).value());
            assertEquals(7.0, history.get(4).value());
        }

        @Test
        void updates_refreshLastSeen() {
            registry.registerAgent("a1", "dag", Set.of(), Map.of());
            now.addAndGet(10_000);

            registry.updateResources("a1", ResourceUsage.ofCpu(50));

            assertEquals(now.get(), registry.getAgent("a1").orElseThrow().getLastSeen());
        }

        @Test
        void lifecycle_mapsToStatus() {
            registry.registerAgent("a1", "dag", Set.of(), Map.of());

            registry.manageAgentLifecycle("a1", LifecycleAction.START);
            assertEquals(AgentStatus.ACTIVE, registry.getAgent("a1").orElseThrow().getStatus());
            registry.manageAgentLifecycle("a1", LifecycleAction.PAUSE);
            assertEquals(AgentStatus.IDLE, registry.getAgent("a1").orElseThrow().getStatus());
            registry.manageAgentLifecycle("a1", LifecycleAction.STOP);
            assertEquals(AgentStatus.OFFLINE, registry.getAgent("a1").orElseThrow().getStatus());
        }
    }

    @Nested
    class Eviction {
        @Test
        void staleAgents_evictedOnNextPass() {
            registry.registerAgent("old", "dag", Set.of("exec"), Map.of());
            now.addAndGet(30_000);
            registry.registerAgent("fresh", "dag", Set.of("exec"), Map.of());
            now.addAndGet(31_000);

            List<String> evicted = registry.evictStaleAgents(now.get());

            assertEquals(List.of("old"), evicted);
            assertTrue(registry.getAgent("old").isEmpty());
            assertEquals(List.of("fresh"), ids(registry.discoverAgents(AgentQuery.withCapabilities(Set.of("exec")))));
        }

        @Test
        void exactlyAtTimeout_isKept() {
            registry.registerAgent("a1", "dag", Set.of(), Map.of());

            assertTrue(registry.evictStaleAgents(now.get() + 60_000).isEmpty());
        }

        @Test
        void offlineAgents_evictedRegardlessOfAge() {
            registry.registerAgent("a1", "dag", Set.of(), Map.of());
            registry.updateAgentStatus("a1", AgentStatus.OFFLINE);

            assertEquals(List.of("a1"), registry.evictStaleAgents(now.get()));
            assertTrue(registry.indexSnapshot().get("status").isEmpty());
        }
    }

    @Nested
    class Health {
        @Test
        void stoppedRegistry_isShutdown() {
            assertEquals(ModuleStatus.SHUTDOWN, registry.getModuleStatus());
        }

        @Test
        void closedRegistry_staysShutdownOnStart() {
            registry.start();
            registry.close();
            registry.start();

            assertFalse(registry.isRunning());
            assertEquals(ModuleStatus.SHUTDOWN, registry.getModuleStatus());
        }

        @Test
        void emptyRunningRegistry_isHealthy() {
            registry.start();
            assertEquals(ModuleStatus.HEALTHY, registry.getModuleStatus());
            assertTrue(registry.isHealthy());
        }

        @Test
        void mostlyIdle_isDegraded() {
            registry.start();
            registry.registerAgent("a1", "dag", Set.of(), Map.of());
            registry.registerAgent("a2", "dag", Set.of(), Map.of());

            assertEquals(ModuleStatus.DEGRADED, registry.getModuleStatus());
        }

        @Test
        void mostlyErrors_isUnhealthy() {
            registry.start();
            registry.registerAgent("a1", "dag", Set.of(), Map.of());
            registry.registerAgent("a2", "dag", Set.of(), Map.of());
            registry.registerAgent("a3", "dag", Set.of(), Map.of());
            registry.updateAgentStatus("a1", AgentStatus.ERROR);
            registry.updateAgentStatus("a2", AgentStatus.ERROR);
            registry.updateAgentStatus("a3", AgentStatus.ACTIVE);

            assertEquals(ModuleStatus.UNHEALTHY, registry.getModuleStatus());
        }

        @Test
        void mostlyActive_isHealthy() {
            registry.start();
            registry.registerAgent("a1", "dag", Set.of(), Map.of());
            registry.updateAgentStatus("a1", AgentStatus.ACTIVE);

            assertEquals(ModuleStatus.HEALTHY, registry.getModuleStatus());
        }

        @Test
        void indicators_coverEveryConcern() {
            registry.registerAgent("a1", "dag", Set.of("exec"), Map.of());

            List<String> names = registry.getHealthIndicators().stream().map(HealthIndicator::name).toList();

            assertEquals(List.of("registry_running", "agent_population", "agent_activity",
                    "agent_errors", "system_distribution", "capability_coverage"), names);
        }

        @Test
        void stats_countByStatusAndSystem() {
            registry.registerAgent("a1", "dag", Set.of("exec"), Map.of());
            registry.registerAgent("a2", "consensus", Set.of("vote", "exec"), Map.of());
            registry.updateAgentStatus("a2", AgentStatus.ACTIVE);

            RegistryStats stats = registry.getRegistryStats();

            assertEquals(2, stats.totalAgents());
            assertEquals(1, stats.count(AgentStatus.ACTIVE));
            assertEquals(Map.of("consensus", 1, "dag", 1), stats.bySystem());
            assertEquals(2, stats.capabilityCount());
        }
    }
}
