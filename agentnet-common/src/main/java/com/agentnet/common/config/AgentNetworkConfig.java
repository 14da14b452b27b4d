package com.agentnet.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;

import java.time.Duration;
import java.util.Map;

/**
 * Flat key/value configuration shared by every agent network component.
 * Supplied at construction time; running components do not observe later changes.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentNetworkConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final int DEFAULT_AGENT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_CLEANUP_INTERVAL_SECONDS = 60;
    public static final int DEFAULT_PERFORMANCE_HISTORY_LIMIT = 100;
    public static final int DEFAULT_MAX_PARALLEL_TASKS = 20;
    public static final int DEFAULT_TASK_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_EXECUTION_HISTORY_LIMIT = 100;
    public static final double DEFAULT_MAX_COORDINATION_OVERHEAD_MS = 100.0;
    public static final int DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_MAX_AGENTS_PER_SYSTEM = 10;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
    public static final int DEFAULT_MAX_CONSENSUS_PARTICIPANTS = 10;
    public static final int DEFAULT_CONSENSUS_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_SWARM_SIZE = 50;
    public static final int DEFAULT_SWARM_TIMEOUT_SECONDS = 300;

    // --- Registry ---

    /** Agents not seen for longer than this are evicted. */
    private int agentTimeoutSeconds = DEFAULT_AGENT_TIMEOUT_SECONDS;

    /** Interval of the stale-agent eviction loop. */
    private int cleanupIntervalSeconds = DEFAULT_CLEANUP_INTERVAL_SECONDS;

    /** Per-agent cap on retained performance metrics. */
    private int performanceHistoryLimit = DEFAULT_PERFORMANCE_HISTORY_LIMIT;

    // --- DAG scheduler ---

    private int maxParallelTasks = DEFAULT_MAX_PARALLEL_TASKS;

    /** Per-task timeout; 0 disables it. */
    private int taskTimeoutSeconds = DEFAULT_TASK_TIMEOUT_SECONDS;

    private int executionHistoryLimit = DEFAULT_EXECUTION_HISTORY_LIMIT;

    // --- Coordinator ---

    private double maxCoordinationOverheadMs = DEFAULT_MAX_COORDINATION_OVERHEAD_MS;

    private int healthCheckIntervalSeconds = DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS;

    /** Upper bound of candidate agents the coordinator hands to one adapter. */
    private int maxAgentsPerSystem = DEFAULT_MAX_AGENTS_PER_SYSTEM;

    // --- Consensus ---

    private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

    private int maxConsensusParticipants = DEFAULT_MAX_CONSENSUS_PARTICIPANTS;

    private int consensusTimeoutSeconds = DEFAULT_CONSENSUS_TIMEOUT_SECONDS;

    // --- Swarm ---

    private int maxSwarmSize = DEFAULT_MAX_SWARM_SIZE;

    private int swarmTimeoutSeconds = DEFAULT_SWARM_TIMEOUT_SECONDS;

    /**
     * Config with every value at its default.
     */
    public static AgentNetworkConfig defaults() {
        return new AgentNetworkConfig();
    }

    /**
     * Bind a flat key/value map (e.g. {@code {"maxParallelTasks": 4}}).
     * Unknown keys are ignored; missing keys keep their defaults.
     */
    public static AgentNetworkConfig fromMap(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return defaults();
        }
        return MAPPER.convertValue(values, AgentNetworkConfig.class).normalized();
    }

    /**
     * Clamp out-of-range values back to usable ones.
     */
    public AgentNetworkConfig normalized() {
        if (agentTimeoutSeconds <= 0)
            agentTimeoutSeconds = DEFAULT_AGENT_TIMEOUT_SECONDS;
        if (cleanupIntervalSeconds <= 0)
            cleanupIntervalSeconds = DEFAULT_CLEANUP_INTERVAL_SECONDS;
        performanceHistoryLimit = Math.max(1, performanceHistoryLimit);
        maxParallelTasks = Math.max(1, maxParallelTasks);
        taskTimeoutSeconds = Math.max(0, taskTimeoutSeconds);
        executionHistoryLimit = Math.max(1, executionHistoryLimit);
        if (maxCoordinationOverheadMs <= 0)
            maxCoordinationOverheadMs = DEFAULT_MAX_COORDINATION_OVERHEAD_MS;
        if (healthCheckIntervalSeconds <= 0)
            healthCheckIntervalSeconds = DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS;
        maxAgentsPerSystem = Math.max(1, maxAgentsPerSystem);
        confidenceThreshold = Math.min(1.0, Math.max(0.0, confidenceThreshold));
        maxConsensusParticipants = Math.max(1, maxConsensusParticipants);
        if (consensusTimeoutSeconds <= 0)
            consensusTimeoutSeconds = DEFAULT_CONSENSUS_TIMEOUT_SECONDS;
        maxSwarmSize = Math.max(1, maxSwarmSize);
        if (swarmTimeoutSeconds <= 0)
            swarmTimeoutSeconds = DEFAULT_SWARM_TIMEOUT_SECONDS;
        return this;
    }

    public Duration agentTimeout() {
        return Duration.ofSeconds(agentTimeoutSeconds);
    }

    public Duration cleanupInterval() {
        return Duration.ofSeconds(cleanupIntervalSeconds);
    }

    public Duration healthCheckInterval() {
        return Duration.ofSeconds(healthCheckIntervalSeconds);
    }

    /**
     * Per-task timeout, or {@code null} when disabled.
     */
    public Duration taskTimeout() {
        return taskTimeoutSeconds > 0 ? Duration.ofSeconds(taskTimeoutSeconds) : null;
    }
}
