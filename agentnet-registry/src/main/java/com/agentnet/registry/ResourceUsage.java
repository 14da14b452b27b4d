package com.agentnet.registry;

/**
 * Latest resource snapshot reported by an agent.
 */
public record ResourceUsage(double cpuPercent, double memoryMb, double networkKbPerSec,
        double diskIoKbPerSec, long timestamp) {

    public static ResourceUsage ofCpu(double cpuPercent) {
        return new ResourceUsage(cpuPercent, 0, 0, 0, System.currentTimeMillis());
    }
}
