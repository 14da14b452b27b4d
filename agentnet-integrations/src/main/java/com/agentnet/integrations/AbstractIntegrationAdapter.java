package com.agentnet.integrations;

import com.agentnet.common.config.AgentNetworkConfig;
import com.agentnet.common.error.AgentNetworkException;
import com.agentnet.common.health.HealthIndicator;
import com.agentnet.common.health.ModuleStatus;
import com.agentnet.registry.PerformanceMetric;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connection state, success counters and timing history shared by every adapter.
 * Subclasses implement {@link #doCoordinate} and record their own operations
 * through {@link #recordOperation}.
 */
@Slf4j
public abstract class AbstractIntegrationAdapter implements IntegrationAdapter, AutoCloseable {

    public static final int METRIC_HISTORY_LIMIT = 1000;
    static final double HEALTHY_SUCCESS_RATE = 0.8;
    static final double DEGRADED_SUCCESS_RATE = 0.5;

    protected final AgentNetworkConfig config;
    private final String systemName;
    private final AtomicReference<IntegrationStatus> status =
            new AtomicReference<>(IntegrationStatus.DISCONNECTED);
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicInteger activeAgents = new AtomicInteger();
    private final Deque<PerformanceMetric> metrics = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile long startedAt;
    private volatile String lastError;

    protected AbstractIntegrationAdapter(String systemName, AgentNetworkConfig config) {
        this.systemName = systemName;
        this.config = config;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Override
    public final void start() {
        if (closed.get()) {
            log.warn("Integration '{}' is closed and cannot be restarted", systemName);
            return;
        }
        if (status.get() == IntegrationStatus.CONNECTED) {
            return;
        }
        status.set(IntegrationStatus.CONNECTING);
        try {
            connect();
            startedAt = System.currentTimeMillis();
            status.set(IntegrationStatus.CONNECTED);
            log.info("Integration '{}' connected", systemName);
        } catch (Exception e) {
            lastError = e.getMessage();
            status.set(IntegrationStatus.ERROR);
            log.error("Integration '{}' failed to connect: {}", systemName, e.getMessage(), e);
        }
    }

    @Override
    public final void stop() {
        if (status.get() == IntegrationStatus.DISCONNECTED) {
            return;
        }
        try {
            disconnect();
        } catch (Exception e) {
            log.error("Integration '{}' failed to release work on stop: {}", systemName, e.getMessage(), e);
        }
        status.set(IntegrationStatus.DISCONNECTED);
        log.info("Integration '{}' disconnected", systemName);
    }

    /**
     * Stop, then release the adapter's threads. A closed adapter stays Disconnected.
     */
    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stop();
        release();
        log.info("Integration '{}' closed", systemName);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Shut down executors owned by the adapter. Called once, after {@link #stop()}.
     */
    protected void release() {
    }

    /**
     * Establish the connection to the subsystem. Throwing leaves the adapter in Error.
     */
    protected void connect() throws Exception {
    }

    /**
     * Cancel or terminate in-flight work before disconnecting.
     */
    protected void disconnect() throws Exception {
    }

    // =========================================================================
    // Coordination
    // =========================================================================

    @Override
    public final AdapterOutcome coordinate(CoordinationRequest request) {
        if (status.get() != IntegrationStatus.CONNECTED) {
            return AdapterOutcome.failure(systemName, AgentNetworkException.ErrorKind.INTEGRATION_UNAVAILABLE,
                    "Integration '" + systemName + "' is " + status.get());
        }
        long started = System.currentTimeMillis();
        AdapterOutcome outcome;
        try {
            outcome = doCoordinate(request);
        } catch (Exception e) {
            log.error("Integration '{}' failed to coordinate task {}: {}",
                    systemName, request.taskId(), e.getMessage(), e);
            recordOperation(systemName + "_coordination", System.currentTimeMillis() - started, false);
            outcome = AdapterOutcome.failure(systemName, AgentNetworkException.kindOf(e),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return outcome.withWorkTime(System.currentTimeMillis() - started);
    }

    /**
     * Map a generic request onto this adapter's primary operation.
     */
    protected abstract AdapterOutcome doCoordinate(CoordinationRequest request) throws Exception;

    // =========================================================================
    // Bookkeeping
    // =========================================================================

    protected void recordOperation(String metricName, long elapsedMs, boolean success) {
        if (success) {
            successCount.incrementAndGet();
        } else {
            failureCount.incrementAndGet();
        }
        PerformanceMetric metric = new PerformanceMetric(metricName, elapsedMs, "ms",
                System.currentTimeMillis(), Map.of("success", String.valueOf(success)));
        synchronized (metrics) {
            metrics.addLast(metric);
            while (metrics.size() > METRIC_HISTORY_LIMIT) {
                metrics.removeFirst();
            }
        }
    }

    protected void recordError(String message) {
        lastError = message;
    }

    protected void agentsEngaged(int delta) {
        activeAgents.addAndGet(delta);
    }

    public double getSuccessRate() {
        long ok = successCount.get();
        long total = ok + failureCount.get();
        return total == 0 ? 1.0 : (double) ok / total;
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    /**
     * Mean duration of the recorded operations.
     */
    public double getAverageOverheadMs() {
        synchronized (metrics) {
            return metrics.stream().mapToDouble(PerformanceMetric::value).average().orElse(0.0);
        }
    }

    public List<PerformanceMetric> getMetricHistory() {
        synchronized (metrics) {
            return List.copyOf(metrics);
        }
    }

    public long getUptimeMs() {
        return status.get() == IntegrationStatus.CONNECTED ? System.currentTimeMillis() - startedAt : 0;
    }

    // =========================================================================
    // Status and health
    // =========================================================================

    @Override
    public String getSystemName() {
        return systemName;
    }

    @Override
    public IntegrationStatus getStatus() {
        return status.get();
    }

    @Override
    public SystemIntegration getIntegrationStatus() {
        return new SystemIntegration(systemName, status.get(), Math.max(0, activeAgents.get()),
                getAverageOverheadMs(), getSuccessRate(), System.currentTimeMillis(),
                failureCount.get(), integrationMetadata());
    }

    /**
     * Extra key/values for {@link SystemIntegration#metadata()}; values must be non-null.
     */
    protected Map<String, Object> integrationMetadata() {
        return Map.of();
    }

    @Override
    public ModuleStatus getModuleStatus() {
        return switch (status.get()) {
            case DISCONNECTED -> ModuleStatus.SHUTDOWN;
            case CONNECTING -> ModuleStatus.INITIALIZING;
            case ERROR -> ModuleStatus.UNHEALTHY;
            case CONNECTED -> {
                double rate = getSuccessRate();
                if (rate >= HEALTHY_SUCCESS_RATE) {
                    yield ModuleStatus.HEALTHY;
                }
                yield rate >= DEGRADED_SUCCESS_RATE ? ModuleStatus.DEGRADED : ModuleStatus.UNHEALTHY;
            }
        };
    }

    @Override
    public List<HealthIndicator> getHealthIndicators() {
        List<HealthIndicator> indicators = new ArrayList<>();
        IntegrationStatus current = status.get();
        indicators.add(HealthIndicator.of("integration_status",
                current == IntegrationStatus.CONNECTED ? ModuleStatus.HEALTHY : ModuleStatus.UNHEALTHY,
                "Integration '" + systemName + "' is " + current));

        double rate = getSuccessRate();
        indicators.add(new HealthIndicator("success_rate",
                rate >= HEALTHY_SUCCESS_RATE ? ModuleStatus.HEALTHY
                        : rate >= DEGRADED_SUCCESS_RATE ? ModuleStatus.DEGRADED : ModuleStatus.UNHEALTHY,
                String.format("Success rate: %.1f%%", rate * 100),
                Map.of("success", successCount.get(), "failure", failureCount.get(), "rate", rate)));

        indicators.addAll(extraHealthIndicators());
        return indicators;
    }

    protected List<HealthIndicator> extraHealthIndicators() {
        return List.of();
    }

    @Override
    public Map<String, Object> getOperationalInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("systemName", systemName);
        info.put("integrationStatus", status.get());
        info.put("successCount", successCount.get());
        info.put("failureCount", failureCount.get());
        info.put("successRate", getSuccessRate());
        info.put("averageOverheadMs", getAverageOverheadMs());
        info.put("activeAgents", activeAgents.get());
        info.put("uptimeMs", getUptimeMs());
        if (lastError != null) {
            info.put("lastError", lastError);
        }
        info.putAll(integrationMetadata());
        return info;
    }
}
