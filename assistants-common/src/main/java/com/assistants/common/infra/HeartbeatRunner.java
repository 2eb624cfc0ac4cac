package com.assistants.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Periodically invokes an action on a single daemon thread.
 * Ticks never overlap: the next tick is scheduled only after the previous one
 * returned.
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    public static final long MIN_INTERVAL_MS = 1000;

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long intervalMs;
    private final Consumer<String> heartbeatAction;
    private volatile ScheduledFuture<?> scheduledTask;

    /**
     * Create a new heartbeat runner.
     *
     * @param threadName      name of the worker thread
     * @param intervalMs      interval between heartbeats in milliseconds
     * @param heartbeatAction action to invoke on each heartbeat (receives reason
     *                        string)
     */
    public HeartbeatRunner(String threadName, long intervalMs, Consumer<String> heartbeatAction) {
        this.intervalMs = Math.max(MIN_INTERVAL_MS, intervalMs);
        this.heartbeatAction = heartbeatAction;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the heartbeat loop.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Heartbeat runner already running");
            return;
        }
        scheduleNext();
        log.info("Heartbeat runner started (interval: {}ms)", intervalMs);
    }

    /**
     * Stop the heartbeat loop. A tick already in progress runs to completion.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> task = scheduledTask;
        if (task != null) {
            task.cancel(false);
        }
        log.info("Heartbeat runner stopped");
    }

    /**
     * Trigger a heartbeat immediately (outside the normal schedule).
     */
    public void triggerNow(String reason) {
        scheduler.execute(() -> runOnce(reason));
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        runOnce("interval");
        if (running.get()) {
            scheduleNext();
        }
    }

    private void runOnce(String reason) {
        try {
            heartbeatAction.accept(reason);
        } catch (Exception e) {
            log.error("Heartbeat action failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
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
