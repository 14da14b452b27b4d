package com.agentnet.scheduler;

import java.util.List;

/**
 * Result of cycle detection. Every cycle is closed, e.g. {@code [A, B, C, A]}.
 */
public record CycleReport(boolean hasCycles, List<List<String>> cycles) {

    public CycleReport {
        cycles = cycles.stream().map(List::copyOf).toList();
    }

    public static CycleReport none() {
        return new CycleReport(false, List.of());
    }
}
