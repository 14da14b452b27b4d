package com.agentnet.registry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentScoringTest {

    private AgentInfo agent(AgentStatus status, double... metrics) {
        List<PerformanceMetric> history = new ArrayList<>();
        for (double m : metrics) {
            history.add(PerformanceMetric.of("q", m));
        }
        return AgentInfo.builder().id("a").systemType("dag").status(status)
                .performanceHistory(history).build();
    }

    @Test
    void noHistory_isBaseTimesStatusWeight() {
        assertEquals(0.5, AgentScoring.score(agent(AgentStatus.ACTIVE)), 1e-9);
        assertEquals(0.4, AgentScoring.score(agent(AgentStatus.IDLE)), 1e-9);
        assertEquals(0.0, AgentScoring.score(agent(AgentStatus.OFFLINE)), 1e-9);
    }

    @Test
    void history_blendsWithRecentMean() {
        // (0.5 + 1.0) / 2
        assertEquals(0.75, AgentScoring.score(agent(AgentStatus.ACTIVE, 1.0, 1.0)), 1e-9);
    }

    @Test
    void onlyLastTenSamplesCount() {
        double[] samples = new double[12];
        samples[0] = 100;
        samples[1] = 100;
        assertEquals(0.25, AgentScoring.score(agent(AgentStatus.ACTIVE, samples)), 1e-9);
    }

    @Test
    void cpuLoad_scalesScoreWithFloor() {
        AgentInfo busyCpu = agent(AgentStatus.ACTIVE);
        busyCpu.setResourceUsage(ResourceUsage.ofCpu(50));
        assertEquals(0.25, AgentScoring.score(busyCpu), 1e-9);

        busyCpu.setResourceUsage(ResourceUsage.ofCpu(100));
        assertEquals(0.05, AgentScoring.score(busyCpu), 1e-9);
    }

    @Test
    void score_isClamped() {
        assertEquals(1.0, AgentScoring.score(agent(AgentStatus.ACTIVE, 50.0)), 1e-9);
    }

    @Test
    void capabilityMatchScore_countsPreferredAndBreadth() {
        AgentInfo a = AgentInfo.builder().id("a").systemType("dag")
                .capabilities(Set.of("exec", "gpu")).build();

        // 1 + 1/2 + 0.1
        assertEquals(1.6, AgentScoring.capabilityMatchScore(a, Set.of("gpu", "fast")), 1e-9);
    }
}
