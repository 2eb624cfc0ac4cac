package com.assistants.scheduler.runner;

import com.assistants.common.config.AssistantsConfig;
import com.assistants.common.infra.ErrorUtils;
import com.assistants.common.infra.HeartbeatRunner;
import com.assistants.common.logging.SubsystemLogger;
import com.assistants.scheduler.SchedulerService;
import com.assistants.scheduler.model.ScheduleRecord;
import com.assistants.scheduler.model.ScheduleTypes.RunResult;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-process poll loop: on every heartbeat it finds due schedules, takes the
 * execution lock for each, runs the action and records the outcome.
 *
 * <p>
 * Records bound to another session are left alone. Session-less records are
 * claimed for this poller's owner before they run, unless claiming is turned
 * off in config. A lock that cannot be taken is retried on the next tick.
 * </p>
 */
public class SchedulePoller implements AutoCloseable {

    private static final SubsystemLogger log = SubsystemLogger.create("scheduler/poller");

    private final SchedulerService service;
    private final String ownerId;
    private final ScheduleActionExecutor executor;
    private final AssistantsConfig.SchedulerConfig config;
    private final ScheduledExecutorService leaseTimer;
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private volatile HeartbeatRunner heartbeat;

    /**
     * @param ownerId session id of this process; used as lock owner and as the
     *                session that claims global schedules
     */
    public SchedulePoller(SchedulerService service, String ownerId, ScheduleActionExecutor executor,
            AssistantsConfig.SchedulerConfig config) {
        this.service = service;
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.executor = executor;
        this.config = config != null ? config : new AssistantsConfig.SchedulerConfig();
        this.leaseTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "schedule-lease");
            t.setDaemon(true);
            return t;
        });
    }

    // --- Lifecycle ---

    /**
     * Start ticking every {@code heartbeatIntervalMs}. No-op when the scheduler
     * is disabled or already started.
     */
    public synchronized void start() {
        if (!config.isEnabled()) {
            log.info("Scheduler disabled; poller not started");
            return;
        }
        if (heartbeat != null)
            return;
        heartbeat = new HeartbeatRunner("schedule-poller", config.getHeartbeatIntervalMs(), reason -> tick());
        heartbeat.start();
        log.info("Poller started", Map.of("owner", ownerId, "intervalMs", heartbeat.getIntervalMs()));
    }

    public synchronized void stop() {
        if (heartbeat == null)
            return;
        heartbeat.close();
        heartbeat = null;
        log.info("Poller stopped", Map.of("owner", ownerId));
    }

    public boolean isRunning() {
        HeartbeatRunner current = heartbeat;
        return current != null && current.isRunning();
    }

    @Override
    public void close() {
        stop();
        leaseTimer.shutdownNow();
    }

    // --- Tick ---

    /**
     * Run every schedule that is due now and belongs to this owner. A tick
     * started while another is in progress returns immediately.
     *
     * @return number of schedules executed
     */
    public int tick() {
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Tick skipped, previous tick still running");
            return 0;
        }
        try {
            long now = service.now();
            int executed = 0;
            for (ScheduleRecord due : service.getDue(now)) {
                if (!due.isGlobal() && !ownerId.equals(due.getSessionId()))
                    continue;
                try {
                    if (runLocked(due)) {
                        executed++;
                    }
                } catch (IOException | RuntimeException e) {
                    log.error("Schedule " + due.getId() + " failed: " + ErrorUtils.formatErrorMessage(e), e);
                }
            }
            if (executed > 0) {
                log.info("Tick finished", Map.of("executed", executed));
            }
            return executed;
        } finally {
            ticking.set(false);
        }
    }

    private boolean runLocked(ScheduleRecord due) throws IOException {
        String id = due.getId();
        if (!service.acquireLock(id, ownerId, config.getLockTtlMs())) {
            log.debug("Lock busy, deferring", Map.of("id", id));
            return false;
        }
        try {
            if (due.isGlobal() && !claim(id))
                return false;

            Optional<ScheduleRecord> current = service.get(id);
            if (current.isEmpty() || !isRunnable(current.get()))
                return false;

            RunResult result = executeWithLease(current.get());
            service.recordRun(id, result, service.now());
            return true;
        } finally {
            service.releaseLock(id, ownerId);
        }
    }

    /**
     * Pin a session-less schedule to this owner, or skip it when claiming is
     * disabled or another session claimed it first.
     */
    private boolean claim(String id) throws IOException {
        if (!config.isClaimGlobalSchedules())
            return true;
        long now = service.now();
        Optional<ScheduleRecord> claimed = service.update(id, current -> {
            if (!current.isGlobal())
                return current;
            return current.toBuilder().sessionId(ownerId).updatedAt(now).build();
        });
        return claimed.isPresent() && (claimed.get().isGlobal() || ownerId.equals(claimed.get().getSessionId()));
    }

    private boolean isRunnable(ScheduleRecord record) {
        return record.isDue(service.now())
                && (record.isGlobal() || ownerId.equals(record.getSessionId()));
    }

    private RunResult executeWithLease(ScheduleRecord record) {
        String id = record.getId();
        long leaseMs = leaseIntervalMs(config.getLockTtlMs());
        ScheduledFuture<?> lease = leaseTimer.scheduleAtFixedRate(
                () -> refreshLease(id), leaseMs, leaseMs, TimeUnit.MILLISECONDS);
        try {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("id", id);
            meta.put("kind", record.getSchedule().kind());
            log.info("Running schedule", meta);
            RunResult result = executor.execute(record, record.actionPayload());
            return result != null ? result : RunResult.success(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunResult.failure(ErrorUtils.formatErrorMessage(e));
        } catch (Exception e) {
            log.warn("Schedule action failed", Map.of("id", id, "error", ErrorUtils.formatErrorMessage(e)));
            return RunResult.failure(ErrorUtils.formatErrorMessage(e));
        } finally {
            lease.cancel(false);
        }
    }

    private void refreshLease(String id) {
        try {
            if (!service.refreshLock(id, ownerId)) {
                log.warn("Lost lock while running", Map.of("id", id));
            }
        } catch (IOException e) {
            log.warn("Lock refresh failed", Map.of("id", id, "error", ErrorUtils.formatErrorMessage(e)));
        }
    }

    /**
     * Lock refresh period for a given TTL: half the TTL, so a running action
     * refreshes its lock well before it can go stale.
     */
    static long leaseIntervalMs(long ttlMs) {
        return Math.max(1, ttlMs / 2);
    }

    public String getOwnerId() {
        return ownerId;
    }
}
