package com.assistants.scheduler;

import com.assistants.common.config.AssistantsConfig;
import com.assistants.scheduler.cron.CronParse;
import com.assistants.scheduler.model.ScheduleRecord;
import com.assistants.scheduler.model.ScheduleSpec;
import com.assistants.scheduler.model.ScheduleTypes.RunResult;
import com.assistants.scheduler.model.ScheduleTypes.ScheduleStatus;
import com.assistants.scheduler.store.ScheduleIds;
import com.assistants.scheduler.store.ScheduleListFilter;
import com.assistants.scheduler.store.ScheduleLock;
import com.assistants.scheduler.store.ScheduleStore;
import com.assistants.scheduler.store.ScheduleValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Entry point for everything schedule related: CRUD over the store, next-run
 * computation, execution locks and the lifecycle transitions around a run.
 */
@Slf4j
public class SchedulerService {

    private final ScheduleStore store;
    private final ScheduleLock lock;
    private final NextRunComputer nextRunComputer;
    private final Clock clock;

    public SchedulerService(ScheduleStore store, ScheduleLock lock, NextRunComputer nextRunComputer, Clock clock) {
        this.store = store;
        this.lock = lock;
        this.nextRunComputer = nextRunComputer;
        this.clock = clock;
    }

    /**
     * Service over {@code root} with the system clock and JVM default zone.
     */
    public static SchedulerService forRoot(Path root) {
        return forRoot(root, null, Clock.systemUTC());
    }

    /**
     * Service over {@code root} honouring the scheduler section of the config.
     */
    public static SchedulerService forRoot(Path root, AssistantsConfig.SchedulerConfig config, Clock clock) {
        ZoneId zone = config != null
                ? CronParse.resolveZone(config.getDefaultTimezone()).orElse(ZoneId.systemDefault())
                : ZoneId.systemDefault();
        return new SchedulerService(
                new ScheduleStore(root),
                new ScheduleLock(root, clock),
                new NextRunComputer(zone, null),
                clock);
    }

    public long now() {
        return clock.millis();
    }

    // --- Store operations ---

    public List<ScheduleRecord> list(ScheduleListFilter filter) {
        return store.list(filter);
    }

    public List<ScheduleRecord> list() {
        return store.list();
    }

    public Optional<ScheduleRecord> get(String id) {
        return store.get(id);
    }

    public void save(ScheduleRecord record) throws IOException {
        store.save(record);
    }

    public boolean delete(String id) throws IOException {
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("Deleted schedule {}", id);
        }
        return deleted;
    }

    public Optional<ScheduleRecord> update(String id, UnaryOperator<ScheduleRecord> updater) throws IOException {
        return store.update(id, updater);
    }

    public List<ScheduleRecord> getDue(long now) {
        return store.getDue(now);
    }

    public List<ScheduleRecord> getDue() {
        return store.getDue(now());
    }

    public Optional<Long> computeNextRun(ScheduleRecord record, long fromTime) {
        return nextRunComputer.computeNextRun(record, fromTime);
    }

    // --- Locks ---

    public boolean acquireLock(String id, String ownerId, long ttlMs) throws IOException {
        return lock.acquire(id, ownerId, ttlMs);
    }

    public boolean acquireLock(String id, String ownerId) throws IOException {
        return lock.acquire(id, ownerId, ScheduleLock.DEFAULT_LOCK_TTL_MS);
    }

    public boolean releaseLock(String id, String ownerId) throws IOException {
        return lock.release(id, ownerId);
    }

    public boolean refreshLock(String id, String ownerId) throws IOException {
        return lock.refresh(id, ownerId);
    }

    // --- Lifecycle ---

    /**
     * Validate and persist a new schedule.
     *
     * @return the stored record, active with its first run computed
     * @throws ScheduleValidationException if the draft is invalid or its next
     *                                     run cannot be computed
     */
    public ScheduleRecord create(ScheduleDraft draft) throws IOException {
        ScheduleValidator.validateDraft(draft);
        long now = now();
        ScheduleRecord record = ScheduleRecord.builder()
                .id(draft.getId() != null ? draft.getId() : ScheduleIds.generate())
                .createdAt(now)
                .updatedAt(now)
                .createdBy(draft.getCreatedBy())
                .sessionId(draft.getSessionId())
                .actionType(draft.getActionType())
                .command(draft.getCommand().trim())
                .message(draft.getMessage())
                .description(draft.getDescription())
                .status(ScheduleStatus.ACTIVE)
                .schedule(draft.getSchedule())
                .build();

        Long nextRunAt = computeNextRun(record, now)
                .orElseThrow(() -> new ScheduleValidationException("unable to compute next run for schedule."));
        record.setNextRunAt(nextRunAt);
        store.save(record);
        log.info("Created {} schedule {} for '{}', next run at {}",
                record.getSchedule().kind(), record.getId(), record.getCommand(), nextRunAt);
        return record;
    }

    /**
     * @return the paused record, empty if it does not exist
     */
    public Optional<ScheduleRecord> pause(String id) throws IOException {
        long now = now();
        return store.update(id, current -> current.toBuilder()
                .status(ScheduleStatus.PAUSED)
                .updatedAt(now)
                .build());
    }

    /**
     * Reactivate a schedule with a next run computed from now.
     *
     * @return the resumed record, empty if it does not exist
     * @throws ScheduleValidationException if no next run can be computed
     */
    public Optional<ScheduleRecord> resume(String id) throws IOException {
        Optional<ScheduleRecord> existing = store.get(id);
        if (existing.isEmpty())
            return Optional.empty();

        long now = now();
        Long nextRunAt = computeNextRun(existing.get(), now)
                .orElseThrow(() -> new ScheduleValidationException(
                        "unable to compute next run for schedule " + id + "."));
        return store.update(id, current -> current.toBuilder()
                .status(ScheduleStatus.ACTIVE)
                .updatedAt(now)
                .nextRunAt(nextRunAt)
                .build());
    }

    /**
     * Apply the outcome of a run. One-shot schedules end as {@code completed}
     * or {@code error}; recurring ones get their next run computed from
     * {@code finishedAt} and stay paused if they were paused meanwhile.
     *
     * @return the updated record, empty if it was deleted during the run
     */
    public Optional<ScheduleRecord> recordRun(String id, RunResult outcome, long finishedAt) throws IOException {
        return store.update(id, live -> {
            ScheduleRecord updated = live.toBuilder()
                    .updatedAt(finishedAt)
                    .lastRunAt(finishedAt)
                    .lastResult(outcome)
                    .build();
            if (live.getSchedule() instanceof ScheduleSpec.Once) {
                updated.setStatus(outcome.ok() ? ScheduleStatus.COMPLETED : ScheduleStatus.ERROR);
                updated.setNextRunAt(null);
            } else {
                updated.setStatus(live.getStatus() == ScheduleStatus.PAUSED
                        ? ScheduleStatus.PAUSED
                        : ScheduleStatus.ACTIVE);
                Optional<Long> next = computeNextRun(updated, finishedAt);
                if (next.isEmpty()) {
                    log.warn("No next run for schedule {} after run at {}", id, finishedAt);
                }
                updated.setNextRunAt(next.orElse(null));
            }
            return updated;
        });
    }

    public ScheduleStore getStore() {
        return store;
    }

    public ScheduleLock getLock() {
        return lock;
    }

    public NextRunComputer getNextRunComputer() {
        return nextRunComputer;
    }
}
