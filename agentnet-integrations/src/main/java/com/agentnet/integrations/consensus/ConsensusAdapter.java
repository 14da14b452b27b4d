package com.agentnet.integrations.consensus;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.integrations.AbstractIntegrationAdapter;
import com.agentnet.integrations.AdapterOutcome;
import com.agentnet.integrations.CoordinationRequest;
import com.agentnet.registry.AgentInfo;
import com.agentnet.registry.AgentScoring;
import com.agentnet.registry.AgentStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
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
 * Runs network-wide decisions and conflict escalations through a pluggable
 * {@link ConsensusEngine}, weighting each participant by confidence.
 */
@Slf4j
public class ConsensusAdapter extends AbstractIntegrationAdapter {

    public static final String SYSTEM_NAME = "consensus";
    public static final String OPTIONS_PARAMETER = "options";

    static final int CONFIDENCE_WINDOW = 5;
    static final double DEFAULT_ANALYSIS_QUALITY = 0.5;
    static final double CONSENSUS_SYSTEM_BOOST = 1.1;
    static final double VOTING_CAPABILITY_BOOST = 1.05;

    private static final Map<AgentStatus, Double> CONFIDENCE_STATUS_WEIGHTS = Map.of(
            AgentStatus.ACTIVE, 1.0,
            AgentStatus.IDLE, 0.8,
            AgentStatus.BUSY, 0.9,
            AgentStatus.ERROR, 0.2,
            AgentStatus.OFFLINE, 0.0);

    private static final List<DecisionOption> CONFLICT_OPTIONS = List.of(
            new DecisionOption("priority_based", "Resolve based on agent priority", "priority_resolution"),
            new DecisionOption("resource_sharing", "Share resources among conflicting agents", "resource_sharing"),
            new DecisionOption("sequential_execution", "Execute conflicting operations sequentially",
                    "sequential_execution"));

    private static final List<DecisionOption> DEFAULT_OPTIONS = List.of(
            DecisionOption.of("approve"), DecisionOption.of("reject"));

    private final ConsensusEngine engine;
    private final ExecutorService sessionExecutor;
    private final Map<String, Future<ConsensusVote>> activeSessions = new ConcurrentHashMap<>();

    public ConsensusAdapter(AgentNetworkConfig config) {
        this(config, ConsensusEngine.firstOption());
    }

    public ConsensusAdapter(AgentNetworkConfig config, ConsensusEngine engine) {
        super(SYSTEM_NAME, config);
        this.engine = engine;
        AtomicInteger threadCount = new AtomicInteger();
        this.sessionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "consensus-session-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    protected void disconnect() {
        activeSessions.forEach((sessionId, session) -> {
            session.cancel(true);
            log.info("Cancelled consensus session: {}", sessionId);
        });
        activeSessions.clear();
    }

    @Override
    protected void release() {
        sessionExecutor.shutdownNow();
    }

    // =========================================================================
    // Decisions
    // =========================================================================

    /**
     * Ask the engine for a decision among {@code options}. Participants beyond
     * {@code maxConsensusParticipants} are dropped; the session is abandoned after
     * {@code consensusTimeoutSeconds}.
     */
    public ConsensusDecision coordinateConsensusDecision(Map<String, Object> context, List<AgentInfo> agents,
            List<DecisionOption> options) {
        String sessionId = "consensus-" + UUID.randomUUID().toString().substring(0, 8);
        long started = System.currentTimeMillis();

        List<AgentInfo> participants = agents;
        if (participants.size() > config.getMaxConsensusParticipants()) {
            participants = participants.subList(0, config.getMaxConsensusParticipants());
            log.warn("Limited consensus participants to {}", config.getMaxConsensusParticipants());
        }
        List<AgentInfo> voters = List.copyOf(participants);

        Future<ConsensusVote> session;
        try {
            session = sessionExecutor.submit(() -> engine.vote(context, voters, options));
        } catch (RejectedExecutionException e) {
            return failSession(sessionId, voters.size(), started, "Consensus adapter is closed");
        }
        activeSessions.put(sessionId, session);
        agentsEngaged(voters.size());
        try {
            ConsensusVote vote = session.get(config.getConsensusTimeoutSeconds(), TimeUnit.SECONDS);
            Map<String, Double> confidence = participantConfidence(voters);
            double overall = vote.consensusAchieved() && !confidence.isEmpty()
                    ? confidence.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0)
                    : 0.0;
            long elapsed = System.currentTimeMillis() - started;
            recordOperation("consensus_execution_time", elapsed, true);
            log.info("Consensus session {} completed in {}ms: {}", sessionId, elapsed,
                    vote.consensusAchieved() ? vote.selectedOption().optionId() : "no consensus");
            return new ConsensusDecision(true, sessionId, vote.consensusAchieved(),
                    vote.consensusAchieved() ? vote.selectedOption() : null, overall, confidence,
                    vote.voteDistribution(), voters.size(), elapsed, null);
        } catch (TimeoutException e) {
            session.cancel(true);
            return failSession(sessionId, voters.size(), started,
                    "Consensus session timed out after " + config.getConsensusTimeoutSeconds() + "s");
        } catch (CancellationException e) {
            return failSession(sessionId, voters.size(), started, "Consensus session cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failSession(sessionId, voters.size(), started,
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.cancel(true);
            return failSession(sessionId, voters.size(), started, "Consensus session interrupted");
        } finally {
            activeSessions.remove(sessionId);
            agentsEngaged(-voters.size());
        }
    }

    private ConsensusDecision failSession(String sessionId, int participants, long started, String error) {
        long elapsed = System.currentTimeMillis() - started;
        recordOperation("consensus_execution_time", elapsed, false);
        recordError(error);
        log.error("Consensus session {} failed: {}", sessionId, error);
        return ConsensusDecision.failed(sessionId, participants, elapsed, error);
    }

    /**
     * Mean of each participant's last few metric values, or the confidence
     * threshold for agents without history.
     */
    Map<String, Double> participantConfidence(List<AgentInfo> participants) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (AgentInfo agent : participants) {
            var recent = agent.recentMetricMean(CONFIDENCE_WINDOW);
            scores.put(agent.getId(), recent.isPresent()
                    ? clamp(recent.getAsDouble())
                    : config.getConfidenceThreshold());
        }
        return scores;
    }

    /**
     * Confidence per agent from its performance, status and the quality of an
     * analysis, boosted for consensus agents and voters.
     *
     * @param analysis may carry a {@code qualityScore} in [0, 1]
     */
    public Map<String, Double> applyConfidenceScoring(List<AgentInfo> agents, Map<String, Object> analysis) {
        double quality = analysis != null && analysis.get("qualityScore") instanceof Number n
                ? n.doubleValue()
                : DEFAULT_ANALYSIS_QUALITY;

        Map<String, Double> scores = new LinkedHashMap<>();
        for (AgentInfo agent : agents) {
            double score = AgentScoring.BASE_SCORE;
            var recent = agent.recentMetricMean(AgentScoring.SCORE_WINDOW);
            if (recent.isPresent()) {
                score = (score + recent.getAsDouble()) / 2;
            }
            score *= CONFIDENCE_STATUS_WEIGHTS.getOrDefault(agent.getStatus(), 0.5);
            score = clamp((score + quality) / 2);

            if (agent.getSystemType().toLowerCase(Locale.ROOT).contains(SYSTEM_NAME)) {
                score = Math.min(1.0, score * CONSENSUS_SYSTEM_BOOST);
            }
            if (agent.hasCapability("voting")) {
                score = Math.min(1.0, score * VOTING_CAPABILITY_BOOST);
            }
            scores.put(agent.getId(), score);
        }
        log.debug("Applied confidence scoring to {} agent(s)", agents.size());
        return scores;
    }

    // =========================================================================
    // Conflicts
    // =========================================================================

    /**
     * Settle a conflict: simple ones go to the first involved agent, complex
     * ones to a vote among the involved agents.
     *
     * @param agents involved agents, earliest claim first
     */
    public ConflictEscalation escalateConflict(ConflictData conflict, List<AgentInfo> agents) {
        ConflictComplexity complexity = ConflictComplexity.classify(conflict);
        List<String> affected = agents.stream().map(AgentInfo::getId).toList();

        if (!complexity.requiresConsensus()) {
            String winner = affected.isEmpty() ? null : affected.get(0);
            log.info("Conflict {} resolved first-come-first-served, winner: {}", conflict.conflictId(), winner);
            return new ConflictEscalation(true, ConflictEscalation.Method.SIMPLE, "first_come_first_served",
                    winner, null, affected, complexity, null);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("type", "conflict_resolution");
        context.put("conflictId", String.valueOf(conflict.conflictId()));
        context.put("conflictType", String.valueOf(conflict.conflictType()));
        context.put("complexity", complexity.level());

        ConsensusDecision decision = coordinateConsensusDecision(context, agents, CONFLICT_OPTIONS);
        if (!decision.success() || !decision.consensusAchieved()) {
            String error = decision.error() != null ? decision.error() : "Consensus failed";
            return new ConflictEscalation(false, ConflictEscalation.Method.CONSENSUS, null, null,
                    decision.sessionId(), affected, complexity, error);
        }
        log.info("Conflict {} resolved by consensus: {}", conflict.conflictId(), decision.decision().optionId());
        return new ConflictEscalation(true, ConflictEscalation.Method.CONSENSUS, decision.decision().optionId(),
                null, decision.sessionId(), affected, complexity, null);
    }

    // =========================================================================
    // Coordination
    // =========================================================================

    @Override
    protected AdapterOutcome doCoordinate(CoordinationRequest request) {
        List<DecisionOption> options = new ArrayList<>();
        if (request.parameters().get(OPTIONS_PARAMETER) instanceof List<?> raw) {
            raw.stream().filter(DecisionOption.class::isInstance).map(DecisionOption.class::cast)
                    .forEach(options::add);
        }
        if (options.isEmpty()) {
            options.addAll(DEFAULT_OPTIONS);
        }
        Map<String, Object> context = new LinkedHashMap<>(request.parameters());
        context.put("taskId", String.valueOf(request.taskId()));

        ConsensusDecision decision = coordinateConsensusDecision(context, request.agents(), options);
        List<String> participants = request.agents().stream()
                .limit(config.getMaxConsensusParticipants())
                .map(AgentInfo::getId)
                .toList();
        if (!decision.success()) {
            return AdapterOutcome.failure(SYSTEM_NAME, AgentNetworkException.ErrorKind.EXECUTION_FAILURE,
                    decision.error());
        }
        if (!decision.consensusAchieved()) {
            return AdapterOutcome.failure(SYSTEM_NAME, AgentNetworkException.ErrorKind.EXECUTION_FAILURE,
                    "No consensus reached in session " + decision.sessionId());
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("sessionId", decision.sessionId());
        output.put("decision", decision.decision().optionId());
        output.put("confidence", decision.confidence());
        output.put("participants", decision.participants());
        return AdapterOutcome.success(SYSTEM_NAME, output, participants);
    }

    // =========================================================================
    // Health
    // =========================================================================

    @Override
    protected Map<String, Object> integrationMetadata() {
        return Map.of("activeSessions", activeSessions.size(),
                "confidenceThreshold", config.getConfidenceThreshold());
    }

    @Override
    protected List<HealthIndicator> extraHealthIndicators() {
        int sessions = activeSessions.size();
        return List.of(new HealthIndicator("consensus_sessions", ModuleStatus.HEALTHY,
                "Active consensus sessions: " + sessions,
                Map.of("active", sessions, "timeoutSeconds", config.getConsensusTimeoutSeconds())));
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
