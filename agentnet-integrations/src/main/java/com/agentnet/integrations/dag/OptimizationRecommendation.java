package com.agentnet.integrations.dag;

public record OptimizationRecommendation(String type, String description, double expectedBenefit) {
}
