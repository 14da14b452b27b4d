package com.agentnet.coordinator.intelligence;

/**
 * Something the intelligence engine noticed about the network.
 *
 * @param performanceImpact estimated effect on performance, negative for harmful patterns
 */
public record NetworkPattern(PatternType type, String description, double confidence, double performanceImpact,
        String suggestion) {
}
