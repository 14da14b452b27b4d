package com.agentnet.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs an action at a fixed interval on its own daemon thread.
 * Used for stale-agent eviction and periodic network health checks.
 * <p>
 * A failing tick is logged and the loop keeps going. {@link #close()} is terminal:
 * a closed loop ignores {@link #start()} and {@link #triggerNow()}.
 */
@Slf4j
public class IntervalLoop implements AutoCloseable {

    static final long MIN_INTERVAL_MS = 10;

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();
    private final Runnable action;
    private volatile long intervalMs;
    private ScheduledFuture<?> scheduledTask;

    public IntervalLoop(String name, Duration interval, Runnable action) {
        this.name = name;
        this.intervalMs = Math.max(MIN_INTERVAL_MS, interval.toMillis());
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the loop. The first tick happens one interval from now.
     */
    public void start() {
        if (closed.get()) {
            log.warn("{} is closed and cannot be restarted", name);
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("{} already running", name);
            return;
        }
        scheduleNext();
        log.info("{} started (interval: {}ms)", name, intervalMs);
    }

    /**
     * Stop the loop. A tick already in progress finishes.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
            }
        }
        log.info("{} stopped", name);
    }

    /**
     * Run one tick immediately, outside the normal schedule.
     */
    public void triggerNow() {
        if (closed.get()) {
            log.warn("{} is closed, tick skipped", name);
            return;
        }
        scheduler.execute(this::runOnce);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    private synchronized void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        runOnce();
        if (running.get()) {
            scheduleNext();
        }
    }

    private void runOnce() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("{} tick failed: {}", name, e.getMessage(), e);
        } finally {
            tickCount.incrementAndGet();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
