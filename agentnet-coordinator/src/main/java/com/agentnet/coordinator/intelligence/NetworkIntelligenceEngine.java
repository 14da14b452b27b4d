package com.agentnet.coordinator.intelligence;

import com.agentnet.coordinator.NetworkPerformanceMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns network metrics into advisory insights: patterns, a health score and its trend.
 * Not thread-safe; the coordinator calls it under its own lock.
 */
@Slf4j
public class NetworkIntelligenceEngine {

    static final double LOW_EFFICIENCY = 0.8;
    static final double HIGH_ERROR_RATE = 0.05;
    /** Error rate at which the error component of the health score reaches zero. */
    static final double ERROR_RATE_FLOOR = 0.1;
    static final double OVERHEAD_WEIGHT = 0.3;
    static final double EFFICIENCY_WEIGHT = 0.3;
    static final double SUCCESS_WEIGHT = 0.2;
    static final double ERROR_WEIGHT = 0.2;
    static final int TREND_WINDOW = 10;
    static final double STABLE_SLOPE = 0.01;
    static final int LEARNED_PATTERN_LIMIT = 100;

    private final double maxCoordinationOverheadMs;
    private final Deque<Double> healthScores = new ArrayDeque<>();
    private final Set<String> learnedPatterns = new LinkedHashSet<>();

    public NetworkIntelligenceEngine(double maxCoordinationOverheadMs) {
        this.maxCoordinationOverheadMs = maxCoordinationOverheadMs;
    }

    /**
     * Analyze one round of metrics and fold its health score into the trend window.
     */
    public IntelligenceInsights analyze(NetworkPerformanceMetrics metrics) {
        List<NetworkPattern> patterns = identifyPatterns(metrics);
        patterns.forEach(p -> learn(p.description()));

        double score = healthScore(metrics);
        healthScores.addLast(score);
        while (healthScores.size() > TREND_WINDOW) {
            healthScores.removeFirst();
        }
        Trend trend = trend(List.copyOf(healthScores));

        Map<String, Double> confidence = new LinkedHashMap<>();
        patterns.forEach(p -> confidence.put(p.type().name(), p.confidence()));

        Map<String, Double> predicted = new LinkedHashMap<>();
        predicted.put("healthScore", predictNext(List.copyOf(healthScores)));

        List<String> suggestions = patterns.stream().map(NetworkPattern::suggestion).toList();
        if (!patterns.isEmpty()) {
            log.debug("Network analysis found {} pattern(s), health score {}", patterns.size(), score);
        }
        return new IntelligenceInsights(List.copyOf(learnedPatterns), suggestions, predicted, confidence,
                score, trend);
    }

    /**
     * Remember an observation, e.g. how a conflict was resolved. Duplicates are kept once.
     */
    public void learn(String pattern) {
        learnedPatterns.add(pattern);
        while (learnedPatterns.size() > LEARNED_PATTERN_LIMIT) {
            learnedPatterns.remove(learnedPatterns.iterator().next());
        }
    }

    public List<String> getLearnedPatterns() {
        return List.copyOf(learnedPatterns);
    }

    List<NetworkPattern> identifyPatterns(NetworkPerformanceMetrics metrics) {
        List<NetworkPattern> patterns = new ArrayList<>();
        if (metrics.averageCoordinationOverheadMs() > maxCoordinationOverheadMs) {
            patterns.add(new NetworkPattern(PatternType.PERFORMANCE_OPTIMIZATION,
                    "High coordination overhead detected", 0.8, -0.2,
                    "Batch coordination messages and reduce coordination frequency"));
        }
        if (metrics.networkEfficiency() < LOW_EFFICIENCY) {
            patterns.add(new NetworkPattern(PatternType.COORDINATION_EFFICIENCY,
                    "Low parallel efficiency detected", 0.7, -0.15,
                    "Optimize task distribution and reduce agent idle time"));
        }
        if (metrics.errorRate() > HIGH_ERROR_RATE) {
            patterns.add(new NetworkPattern(PatternType.ERROR_PREVENTION,
                    "High error rate detected", 0.9, -0.3,
                    "Improve error handling and add retries for failing integrations"));
        }
        return patterns;
    }

    /**
     * Weighted health in [0, 1]. Overhead scores zero at twice the ceiling.
     */
    double healthScore(NetworkPerformanceMetrics metrics) {
        double overhead = Math.max(0.0, 1.0 - metrics.averageCoordinationOverheadMs() / (2 * maxCoordinationOverheadMs));
        double efficiency = metrics.networkEfficiency();
        double success = metrics.successRate();
        double error = Math.max(0.0, 1.0 - metrics.errorRate() / ERROR_RATE_FLOOR);
        double score = overhead * OVERHEAD_WEIGHT + efficiency * EFFICIENCY_WEIGHT
                + success * SUCCESS_WEIGHT + error * ERROR_WEIGHT;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static Trend trend(List<Double> values) {
        if (values.size() < 2) {
            return Trend.INSUFFICIENT_DATA;
        }
        double slope = slope(values);
        if (Math.abs(slope) < STABLE_SLOPE) {
            return Trend.STABLE;
        }
        return slope > 0 ? Trend.IMPROVING : Trend.DEGRADING;
    }

    /**
     * Least-squares slope of the values against their index.
     */
    static double slope(List<Double> values) {
        int n = values.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumX2 += (double) i * i;
        }
        double denominator = n * sumX2 - sumX * sumX;
        return denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
    }

    private static double predictNext(List<Double> values) {
        double last = values.get(values.size() - 1);
        if (values.size() < 2) {
            return last;
        }
        return Math.max(0.0, Math.min(1.0, last + slope(values)));
    }
}
