package com.agentnet.coordinator.intelligence;

import java.util.List;
import java.util.Map;

/**
 * Advisory output of {@link NetworkIntelligenceEngine}. Nothing in the network acts on it.
 *
 * @param learnedPatterns         descriptions of patterns seen so far, oldest first
 * @param predictedPerformance    projected values for the next check, keyed by metric
 * @param confidenceScores        confidence per pattern type found in the latest analysis
 * @param healthScore             weighted score in [0, 1]
 */
public record IntelligenceInsights(List<String> learnedPatterns, List<String> optimizationSuggestions,
        Map<String, Double> predictedPerformance, Map<String, Double> confidenceScores, double healthScore,
        Trend trend) {

    public IntelligenceInsights {
        learnedPatterns = List.copyOf(learnedPatterns);
        optimizationSuggestions = List.copyOf(optimizationSuggestions);
        predictedPerformance = Map.copyOf(predictedPerformance);
        confidenceScores = Map.copyOf(confidenceScores);
    }

    public static IntelligenceInsights empty() {
        return new IntelligenceInsights(List.of(), List.of(), Map.of(), Map.of(), 1.0, Trend.INSUFFICIENT_DATA);
    }
}
