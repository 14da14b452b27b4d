package com.agentnet.coordinator;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException.ErrorKind;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.integrations.AdapterOutcome;
import com.agentnet.integrations.consensus.ConflictData;
import com.agentnet.integrations.consensus.ConsensusAdapter;
import com.agentnet.integrations.dag.DagAdapter;
import com.agentnet.registry.AgentRegistry;
import com.agentnet.registry.AgentStatus;
import com.agentnet.scheduler.DagDefinition;
import com.agentnet.scheduler.DagTask;
import com.agentnet.scheduler.DependencyScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class NetworkCoordinatorTest {

    private final AtomicLong now = new AtomicLong(5_000_000L);
    private AgentNetworkConfig config;
    private AgentRegistry registry;
    private DependencyScheduler scheduler;
    private DagAdapter dagAdapter;
    private NetworkCoordinator coordinator;

    @BeforeEach
    void setUp() {
        config = AgentNetworkConfig.fromMap(Map.of(
                "maxCoordinationOverheadMs", 100,
                "maxAgentsPerSystem", 3));
        registry = new AgentRegistry(config, now::get);
        scheduler = new DependencyScheduler(config);
        dagAdapter = new DagAdapter(config, scheduler);
        dagAdapter.start();
        coordinator = new NetworkCoordinator(config, registry, now::get);
        coordinator.registerSystemIntegration(DagAdapter.SYSTEM_NAME, dagAdapter);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
        dagAdapter.stop();
        scheduler.close();
        registry.close();
    }

    private void agent(String id, String system, AgentStatus status, String... capabilities) {
        registry.registerAgent(id, system, Set.of(capabilities), Map.of());
        registry.updateAgentStatus(id, status);
        now.incrementAndGet();
    }

    @Nested
    class MultiSystemCoordination {
        @Test
        void dagChain_runsEndToEnd() {
            for (int i = 1; i <= 5; i++) {
                agent("a" + i, "dag", AgentStatus.ACTIVE, "exec");
            }
            DagDefinition chain = DagDefinition.of(
                    List.of(DagTask.of("t1", "exec"), DagTask.of("t2", "exec"), DagTask.of("t3", "exec")),
                    Map.of("t2", Set.of("t1"), "t3", Set.of("t2")));

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(TaskRequirements.builder()
                    .taskId("build-1")
                    .taskType("pipeline")
                    .requiredCapabilities(Set.of("exec"))
                    .systems(List.of("dag"))
                    .parameters(Map.of(DagAdapter.DAG_PARAMETER, chain))
                    .build());

            assertTrue(result.success(), result.error());
            AdapterOutcome outcome = result.outcomes().get("dag");
            assertEquals(3, outcome.output().get("completedTasks"));
            assertEquals(0, outcome.output().get("failedTasks"));
            assertEquals(3, outcome.output().get("batches"));
            assertEquals(3, result.plan().get("dag").size());
            assertFalse(result.agentsUsed().isEmpty());
            assertEquals(1, coordinator.monitorNetworkHealth().networkMetrics().coordinationCount());
        }

        @Test
        void undeclaredSystems_onlyThoseWithEligibleAgents() {
            FakeAdapter orchestration = new FakeAdapter("orchestration");
            orchestration.start();
            coordinator.registerSystemIntegration("orchestration", orchestration);
            agent("s1", "orchestration", AgentStatus.IDLE);

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(
                    TaskRequirements.builder().taskId("t-1").taskType("scan").build());

            assertTrue(result.success());
            assertEquals(Set.of("orchestration"), result.plan().keySet());
            assertEquals(List.of("s1"), result.agentsUsed());
            assertEquals(1, orchestration.requests.size());
        }

        @Test
        void candidates_rankedFilteredAndCapped() {
            agent("d1", "dag", AgentStatus.IDLE, "exec");
            agent("d2", "dag", AgentStatus.IDLE, "exec", "gpu");
            agent("d3", "dag", AgentStatus.ERROR, "exec");
            agent("d4", "dag", AgentStatus.IDLE, "exec");
            agent("d5", "dag", AgentStatus.OFFLINE, "exec");
            agent("d6", "dag", AgentStatus.IDLE, "exec");

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(TaskRequirements.builder()
                    .taskId("t-2")
                    .taskType("render")
                    .requiredCapabilities(Set.of("exec"))
                    .preferredCapabilities(Set.of("gpu"))
                    .build());

            assertTrue(result.success());
            assertEquals(List.of("d2", "d1", "d4"), result.plan().get("dag"));
        }

        @Test
        void unknownSystem_notFound() {
            agent("d1", "dag", AgentStatus.IDLE);

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(TaskRequirements.builder()
                    .taskId("t-3").systems(List.of("quantum")).build());

            assertFalse(result.success());
            assertEquals(ErrorKind.NOT_FOUND, result.errorKind());
            assertEquals(CoordinationStatus.DEGRADED, coordinator.getCoordinationStatus());
        }

        @Test
        void noEligibleAgents() {
            agent("d1", "dag", AgentStatus.OFFLINE);

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(
                    TaskRequirements.builder().taskId("t-4").build());

            assertEquals(ErrorKind.NO_AGENTS_AVAILABLE, result.errorKind());
            assertTrue(scheduler.getExecutionHistory().isEmpty());
        }

        @Test
        void disconnectedAdapter_integrationUnavailable() {
            agent("d1", "dag", AgentStatus.IDLE);
            dagAdapter.stop();

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(TaskRequirements.builder()
                    .taskId("t-5").systems(List.of("dag")).build());

            assertFalse(result.success());
            assertEquals(ErrorKind.INTEGRATION_UNAVAILABLE, result.errorKind());
            assertTrue(scheduler.getExecutionHistory().isEmpty());
        }

        @Test
        void missingTaskId_validationError() {
            CoordinationResult result = coordinator.coordinateMultiSystemAgents(TaskRequirements.builder().build());
            assertEquals(ErrorKind.VALIDATION_ERROR, result.errorKind());
        }

        @Test
        void adapterFailure_reportedWithOutcomes() {
            FakeAdapter failing = new FakeAdapter("orchestration");
            failing.start();
            failing.succeed = false;
            coordinator.registerSystemIntegration("orchestration", failing);
            agent("s1", "orchestration", AgentStatus.IDLE);

            CoordinationResult result = coordinator.coordinateMultiSystemAgents(TaskRequirements.builder()
                    .taskId("t-6").systems(List.of("orchestration")).build());

            assertFalse(result.success());
            assertEquals(ErrorKind.EXECUTION_FAILURE, result.errorKind());
            assertEquals("orchestration rejected the task", result.error());
            assertFalse(result.outcomes().get("orchestration").success());
        }

        @Test
        void overhead_excludesWorkTime_andRollsAverage() {
            FakeAdapter fake = new FakeAdapter("orchestration");
            fake.start();
            fake.workTimeMs = 10;
            coordinator.registerSystemIntegration("orchestration", fake);
            agent("s1", "orchestration", AgentStatus.IDLE);
            TaskRequirements task = TaskRequirements.builder().taskId("t-7").systems(List.of("orchestration")).build();

            fake.onCoordinate = () -> now.addAndGet(50);
            CoordinationResult first = coordinator.coordinateMultiSystemAgents(task);
            assertEquals(50, first.coordinationTimeMs());
            assertEquals(40, first.overheadMs());
            assertEquals(40.0, coordinator.getAverageCoordinationOverheadMs());

            fake.onCoordinate = () -> now.addAndGet(30);
            coordinator.coordinateMultiSystemAgents(task);
            assertEquals(30.0, coordinator.getAverageCoordinationOverheadMs());
        }
    }

    @Nested
    class HealthMonitoring {
        @Test
        void overheadAboveCeiling_degrades_thenRecovers() {
            agent("d1", "dag", AgentStatus.ACTIVE);

            coordinator.setAverageCoordinationOverheadMs(150);
            assertEquals(CoordinationStatus.DEGRADED, coordinator.monitorNetworkHealth().coordinationStatus());

            coordinator.setAverageCoordinationOverheadMs(50);
            assertEquals(CoordinationStatus.OPTIMAL, coordinator.monitorNetworkHealth().coordinationStatus());
        }

        @Test
        void healthCheck_answersWhileCoordinationRuns() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            FakeAdapter slow = new FakeAdapter("orchestration");
            slow.start();
            slow.onCoordinate = () -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            coordinator.registerSystemIntegration("orchestration", slow);
            agent("s1", "orchestration", AgentStatus.ACTIVE);

            CompletableFuture<CoordinationResult> running = CompletableFuture.supplyAsync(() ->
                    coordinator.coordinateMultiSystemAgents(TaskRequirements.builder()
                            .taskId("long").systems(List.of("orchestration")).build()));
            assertTrue(entered.await(2, TimeUnit.SECONDS));

            HealthReport report = CompletableFuture.supplyAsync(coordinator::monitorNetworkHealth)
                    .get(1, TimeUnit.SECONDS);
            assertEquals(2, report.healthSummary().totalSystems());
            assertNotNull(CompletableFuture.supplyAsync(coordinator::getNetworkState).get(1, TimeUnit.SECONDS));
            assertFalse(running.isDone());

            release.countDown();
            assertTrue(running.get(2, TimeUnit.SECONDS).success());
        }

        @Test
        void overheadAboveTwiceCeiling_critical() {
            coordinator.setAverageCoordinationOverheadMs(250);
            assertEquals(CoordinationStatus.CRITICAL, coordinator.monitorNetworkHealth().coordinationStatus());
        }

        @Test
        void disconnectedAdapter_degrades() {
            FakeAdapter idle = new FakeAdapter("orchestration");
            coordinator.registerSystemIntegration("orchestration", idle);

            HealthReport report = coordinator.monitorNetworkHealth();

            assertEquals(CoordinationStatus.DEGRADED, report.coordinationStatus());
            assertEquals(1, report.healthSummary().connectedSystems());
            assertEquals(2, report.healthSummary().totalSystems());
        }

        @Test
        void mostAdaptersUnhealthy_critical() {
            FakeAdapter a = new FakeAdapter("a");
            FakeAdapter b = new FakeAdapter("b");
            a.start();
            b.start();
            a.health = ModuleStatus.UNHEALTHY;
            b.health = ModuleStatus.UNHEALTHY;
            coordinator.registerSystemIntegration("a", a);
            coordinator.registerSystemIntegration("b", b);

            assertEquals(CoordinationStatus.CRITICAL, coordinator.monitorNetworkHealth().coordinationStatus());
        }

        @Test
        void report_countsAgentsAndMetrics() {
            agent("d1", "dag", AgentStatus.ACTIVE);
            agent("d2", "dag", AgentStatus.IDLE);
            agent("d3", "dag", AgentStatus.ERROR);
            agent("d4", "dag", AgentStatus.ACTIVE);

            HealthReport report = coordinator.monitorNetworkHealth();

            assertEquals(new HealthReport.AgentHealth(4, 2, 1, 0, 1, 0), report.agentHealth());
            assertEquals(0.5, report.networkMetrics().networkEfficiency(), 1e-9);
            assertEquals(1.0, report.networkMetrics().successRate(), 1e-9);
            assertEquals(100.0, report.networkMetrics().uptimePercentage(), 1e-9);
            assertEquals(4, coordinator.getNetworkState().activeAgents().size());
            assertFalse(coordinator.getNetworkState().intelligenceInsights().learnedPatterns().isEmpty());
        }

        @Test
        void stop_goesOfflineAndStopsAdapters() {
            coordinator.start();
            assertEquals(ModuleStatus.HEALTHY, coordinator.getModuleStatus());

            coordinator.stop();

            assertEquals(CoordinationStatus.OFFLINE, coordinator.getCoordinationStatus());
            assertEquals(CoordinationStatus.OFFLINE, coordinator.monitorNetworkHealth().coordinationStatus());
            assertEquals(ModuleStatus.SHUTDOWN, dagAdapter.getModuleStatus());
            assertEquals(ModuleStatus.SHUTDOWN, coordinator.getModuleStatus());
        }

        @Test
        void close_isTerminal() {
            coordinator.start();
            coordinator.close();
            coordinator.start();

            assertFalse(coordinator.isRunning());
            assertEquals(ModuleStatus.SHUTDOWN, coordinator.getModuleStatus());
        }

        @Test
        void healthIndicators_cover_network() {
            List<String> names = coordinator.getHealthIndicators().stream().map(HealthIndicator::name).toList();
            assertEquals(List.of("coordinator_running", "coordination_status", "coordination_overhead",
                    "system_integrations", "agent_network"), names);
        }
    }

    @Nested
    class Allocation {
        @Test
        void scalesPerSystem() {
            agent("d1", "dag", AgentStatus.ACTIVE);
            agent("d2", "dag", AgentStatus.IDLE);
            agent("d3", "dag", AgentStatus.OFFLINE);
            agent("c1", "consensus", AgentStatus.IDLE);
            agent("c2", "consensus", AgentStatus.IDLE);

            AllocationResult result = coordinator.optimizeAgentAllocation(new WorkloadForecast(
                    Map.of("dag", 45, "consensus", 5, "orchestration", 0), 10));

            assertTrue(result.success());
            assertEquals(List.of(
                    new AllocationResult.SystemAllocation("consensus", 2, 1, AllocationResult.Action.SCALE_DOWN),
                    new AllocationResult.SystemAllocation("dag", 2, 5, AllocationResult.Action.SCALE_UP),
                    new AllocationResult.SystemAllocation("orchestration", 0, 0, AllocationResult.Action.MAINTAIN)),
                    result.allocations());
            assertEquals((0.5 + 0.6 + 0.0) / 3 * 0.5, result.expectedEfficiencyGain(), 1e-9);
            assertEquals(5, registry.size());
        }

        @Test
        void emptyForecast_rejected() {
            assertEquals(ErrorKind.VALIDATION_ERROR,
                    coordinator.optimizeAgentAllocation(WorkloadForecast.of(Map.of())).errorKind());
            assertEquals(ErrorKind.VALIDATION_ERROR,
                    coordinator.optimizeAgentAllocation(new WorkloadForecast(Map.of("dag", 3), 0)).errorKind());
        }
    }

    @Nested
    class Conflicts {
        @Test
        void simpleConflict_earliestRegisteredWins() {
            agent("late", "dag", AgentStatus.ACTIVE);
            now.addAndGet(1_000);
            agent("later", "dag", AgentStatus.ACTIVE);

            ConflictResolution resolution = coordinator.handleCrossSystemConflicts(new ConflictData("c1", "lock",
                    Set.of("dag"), List.of("later", "late"), "low", Map.of()));

            assertTrue(resolution.success());
            assertEquals(ConflictResolution.Strategy.SIMPLE, resolution.strategy());
            assertEquals("late", resolution.winner());
            assertTrue(coordinator.getNetworkState().intelligenceInsights().learnedPatterns()
                    .contains("Conflict type 'lock' resolved with simple strategy"));
        }

        @Test
        void crossSystemConflict_withoutConsensus_unavailable() {
            agent("d1", "dag", AgentStatus.ACTIVE);
            agent("s1", "orchestration", AgentStatus.ACTIVE);

            ConflictResolution resolution = coordinator.handleCrossSystemConflicts(new ConflictData("c2", "resource",
                    Set.of("dag", "orchestration"), List.of("d1", "s1"), null, Map.of()));

            assertFalse(resolution.success());
            assertEquals(ErrorKind.INTEGRATION_UNAVAILABLE, resolution.errorKind());
        }

        @Test
        void crossSystemConflict_escalatedToConsensus() {
            ConsensusAdapter consensus = new ConsensusAdapter(config);
            consensus.start();
            coordinator.registerSystemIntegration(ConsensusAdapter.SYSTEM_NAME, consensus);
            agent("d1", "dag", AgentStatus.ACTIVE);
            agent("s1", "orchestration", AgentStatus.ACTIVE);

            ConflictResolution resolution = coordinator.handleCrossSystemConflicts(new ConflictData("c3", "resource",
                    Set.of("dag", "orchestration"), List.of("d1", "s1"), null, Map.of()));

            assertTrue(resolution.success(), resolution.error());
            assertEquals(ConflictResolution.Strategy.CONSENSUS, resolution.strategy());
            assertEquals("priority_based", resolution.resolution());
            assertEquals(List.of("d1", "s1"), resolution.affectedAgents());
            consensus.stop();
        }

        @Test
        void unknownAgents_notFound() {
            ConflictResolution resolution = coordinator.handleCrossSystemConflicts(new ConflictData("c4", "lock",
                    Set.of(), List.of("ghost"), null, null));
            assertEquals(ErrorKind.NOT_FOUND, resolution.errorKind());
        }
    }
}
