package com.agentnet.integrations.swarm;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException;
import com.agentnet.integrations.AdapterOutcome;
import com.agentnet.integrations.CoordinationRequest;
import com.agentnet.integrations.IntegrationStatus;
import com.agentnet.registry.AgentInfo;
import com.agentnet.registry.AgentStatus;
import com.agentnet.registry.PerformanceMetric;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SwarmAdapterTest {

    private SwarmAdapter adapter;

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.close();
        }
    }

    private SwarmAdapter started(Map<String, ?> config, SwarmDeployer deployer) {
        adapter = new SwarmAdapter(AgentNetworkConfig.fromMap(config), deployer);
        adapter.start();
        return adapter;
    }

    private static List<AgentInfo> agents(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> AgentInfo.builder().id("s" + i).systemType("orchestration").build())
                .toList();
    }

    private static AgentInfo agent(String id, AgentStatus status, double... metrics) {
        List<PerformanceMetric> history = new ArrayList<>();
        for (double value : metrics) {
            history.add(PerformanceMetric.of("throughput", value));
        }
        return AgentInfo.builder().id(id).systemType("orchestration").status(status)
                .performanceHistory(history).build();
    }

    @Nested
    class Deployment {
        @Test
        void defaultsToLocalTarget() {
            started(Map.of(), SwarmDeployer.noop());

            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("crawl"),
                    agents(3), List.of());

            assertTrue(deployment.success());
            assertEquals(List.of(DeploymentTarget.LOCAL), deployment.targets());
            assertEquals(3, deployment.deployedAgents());
            assertEquals(List.of(deployment.swarmId()), adapter.getActiveSwarmIds());
            assertEquals(3, adapter.getIntegrationStatus().activeAgents());
        }

        @Test
        void preferredTargets_splitEvenlyWithRemainderFirst() {
            List<String> calls = new CopyOnWriteArrayList<>();
            started(Map.of(), (swarmId, target, agentIds) -> calls.add(target + ":" + agentIds.size()));
            adapter.setTargetAvailability(DeploymentTarget.CLOUD, true);

            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("crawl"),
                    agents(5), List.of(DeploymentTarget.CLOUD, DeploymentTarget.EDGE, DeploymentTarget.LOCAL));

            assertEquals(List.of(DeploymentTarget.CLOUD, DeploymentTarget.LOCAL), deployment.targets());
            assertEquals(List.of("s1", "s2", "s3"), deployment.distribution().get(DeploymentTarget.CLOUD));
            assertEquals(List.of("s4", "s5"), deployment.distribution().get(DeploymentTarget.LOCAL));
            assertEquals(List.of("CLOUD:3", "LOCAL:2"), calls);
        }

        @Test
        void withoutPreference_picksTargetWithCapacity() {
            started(Map.of(), SwarmDeployer.noop());
            adapter.setTargetAvailability(DeploymentTarget.CLOUD, true);

            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("big"),
                    agents(15), null);

            assertEquals(List.of(DeploymentTarget.CLOUD), deployment.targets());
        }

        @Test
        void sizeCappedBySwarmConfigAndGlobalMax() {
            started(Map.of("maxSwarmSize", 4), SwarmDeployer.noop());

            assertEquals(4, adapter.coordinateDistributedSwarm(SwarmConfig.named("a"), agents(6), List.of())
                    .deployedAgents());
            assertEquals(2, adapter.coordinateDistributedSwarm(new SwarmConfig("b", 2, Map.of()), agents(6),
                    List.of()).deployedAgents());
        }

        @Test
        void noAgentsOrTargets_fails() {
            started(Map.of(), SwarmDeployer.noop());
            assertFalse(adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), List.of(), List.of()).success());

            adapter.setTargetAvailability(DeploymentTarget.LOCAL, false);
            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), agents(1),
                    List.of());
            assertFalse(deployment.success());
            assertEquals("No deployment targets available", deployment.error());
            assertEquals(2, adapter.getFailureCount());
        }

        @Test
        void failingDeployer_reportsCause() {
            started(Map.of(), (swarmId, target, agentIds) -> {
                throw new IllegalStateException("quota exceeded");
            });

            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), agents(2),
                    List.of());

            assertFalse(deployment.success());
            assertEquals("quota exceeded", deployment.error());
            assertTrue(adapter.getActiveSwarmIds().isEmpty());
        }

        @Test
        void slowDeployer_timesOut_andIsInterrupted() throws Exception {
            CountDownLatch never = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            started(Map.of("swarmTimeoutSeconds", 1), (swarmId, target, agentIds) -> {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
            });

            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), agents(1),
                    List.of());

            assertFalse(deployment.success());
            assertTrue(deployment.error().contains("timed out"));
            assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        }

        @Test
        void close_isTerminal_andRejectsDeployments() {
            started(Map.of(), SwarmDeployer.noop());
            adapter.close();
            adapter.start();

            assertTrue(adapter.isClosed());
            assertEquals(IntegrationStatus.DISCONNECTED, adapter.getStatus());
            SwarmDeployment deployment = adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), agents(1),
                    List.of());
            assertFalse(deployment.success());
            assertEquals("Swarm adapter is closed", deployment.error());
        }

        @Test
        void terminate_releasesAgents() {
            List<String> terminated = new CopyOnWriteArrayList<>();
            started(Map.of(), new SwarmDeployer() {
                @Override
                public void deploy(String swarmId, DeploymentTarget target, List<String> agentIds) {
                }

                @Override
                public void terminate(String swarmId) {
                    terminated.add(swarmId);
                }
            });
            String swarmId = adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), agents(2), List.of())
                    .swarmId();

            assertTrue(adapter.terminateSwarm(swarmId));
            assertFalse(adapter.terminateSwarm(swarmId));
            assertEquals(List.of(swarmId), terminated);
            assertEquals(0, adapter.getIntegrationStatus().activeAgents());
        }

        @Test
        void stop_terminatesActiveSwarms() {
            started(Map.of(), SwarmDeployer.noop());
            adapter.coordinateDistributedSwarm(SwarmConfig.named("x"), agents(2), List.of());

            adapter.stop();

            assertTrue(adapter.getActiveSwarmIds().isEmpty());
        }
    }

    @Nested
    class Composition {
        @Test
        void mediumWorkload_selectsBestAgents() {
            started(Map.of(), SwarmDeployer.noop());
            List<AgentInfo> pool = new ArrayList<>();
            for (int i = 1; i <= 12; i++) {
                pool.add(agent("w" + i, AgentStatus.IDLE));
            }
            pool.add(agent("star", AgentStatus.ACTIVE, 1.0));
            pool.add(agent("broken", AgentStatus.ERROR, 0.0));

            SwarmComposition composition = adapter.optimizeSwarmComposition(WorkloadProfile.defaults(), pool);

            // 5 * (1 + 0.8) = 9
            assertEquals(9, composition.optimalSize());
            assertEquals(9, composition.selectedAgents().size());
            assertEquals("star", composition.selectedAgents().get(0));
            assertFalse(composition.selectedAgents().contains("broken"));
            assertEquals(0.9, composition.agentScores().get("star"), 1e-9);
            assertEquals(0.7, composition.agentScores().get("w1"), 1e-9);
            assertEquals(0.25, composition.agentScores().get("broken"), 1e-9);
            assertTrue(composition.expectedPerformance().efficiency() <= 1.0);
        }

        @Test
        void lowComplexity_limitedByAvailableAgents() {
            started(Map.of(), SwarmDeployer.noop());

            SwarmComposition composition = adapter.optimizeSwarmComposition(
                    new WorkloadProfile("low", 1.0, 2.0), List.of(agent("only", AgentStatus.IDLE)));

            assertEquals(1, composition.optimalSize());
            SwarmComposition.ExpectedPerformance expected = composition.expectedPerformance();
            assertEquals(0.5, expected.averageAgentPerformance(), 1e-9);
            assertEquals(0.5, expected.efficiency(), 1e-9);
            assertEquals(4.0, expected.completionTimeHours(), 1e-9);
        }

        @Test
        void noAgents_infiniteCompletion() {
            started(Map.of(), SwarmDeployer.noop());

            SwarmComposition composition = adapter.optimizeSwarmComposition(null, List.of());

            assertEquals(0, composition.optimalSize());
            assertEquals(0.0, composition.expectedPerformance().efficiency());
            assertTrue(Double.isInfinite(composition.expectedPerformance().completionTimeHours()));
        }
    }

    @Nested
    class Coordination {
        @Test
        void coordinate_readsTargetsParameter() {
            started(Map.of(), SwarmDeployer.noop());
            adapter.setTargetAvailability(DeploymentTarget.EDGE, true);

            AdapterOutcome outcome = adapter.coordinate(new CoordinationRequest("t1", "swarm", agents(2),
                    Map.of(SwarmAdapter.TARGETS_PARAMETER, List.of(DeploymentTarget.EDGE)), null));

            assertTrue(outcome.success());
            assertEquals(List.of("EDGE"), outcome.output().get("targets"));
            assertEquals(List.of("s1", "s2"), outcome.agentsUsed());
        }

        @Test
        void coordinate_failureIsCountedOnce() {
            started(Map.of(), SwarmDeployer.noop());

            AdapterOutcome outcome = adapter.coordinate(new CoordinationRequest("t2", "swarm", List.of(),
                    Map.of(), null));

            assertFalse(outcome.success());
            assertEquals(AgentNetworkException.ErrorKind.EXECUTION_FAILURE, outcome.errorKind());
            assertEquals(1, adapter.getFailureCount());
        }

        @Test
        void healthIndicators_reportTargets() {
            started(Map.of(), SwarmDeployer.noop());
            assertTrue(adapter.getHealthIndicators().stream()
                    .anyMatch(h -> h.name().equals("deployment_targets") && h.status().isHealthy()));
        }
    }
}
