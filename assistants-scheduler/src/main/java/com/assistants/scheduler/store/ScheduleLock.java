package com.assistants.scheduler.store;

import com.assistants.common.infra.JsonFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Optional;

/**
 * Advisory per-schedule execution lock: {@code schedules/locks/<id>.lock.json}.
 *
 * <p>
 * Creation is exclusive: the lock content is written to a temp file and
 * hard-linked to the lock path, which fails if another process got there
 * first. A holder keeps the lock alive with {@link #refresh}; once more than
 * {@code ttlMs} passes without a refresh, any process may take it over.
 * </p>
 */
@Slf4j
public class ScheduleLock {

    public static final long DEFAULT_LOCK_TTL_MS = 10 * 60 * 1000L;
    /** Attempts per acquire; each failed attempt may clear one stale lock. */
    public static final int MAX_LOCK_RETRIES = 2;

    static final String LOCKS_DIRNAME = "locks";
    private static final String LOCK_SUFFIX = ".lock.json";

    private final Path locksDir;
    private final Clock clock;

    public ScheduleLock(Path root) {
        this(root, Clock.systemUTC());
    }

    public ScheduleLock(Path root, Clock clock) {
        this.locksDir = root.resolve(ScheduleStore.SCHEDULES_DIRNAME).resolve(LOCKS_DIRNAME);
        this.clock = clock;
    }

    public Path getLocksDir() {
        return locksDir;
    }

    public Path lockPath(String id) {
        return locksDir.resolve(ScheduleIds.requireSafe(id) + LOCK_SUFFIX);
    }

    // --- Acquire ---

    /**
     * Try to become the executor of schedule {@code id}.
     *
     * @return true if this owner now holds the lock; false on contention with a
     *         live lock, after exhausting takeover attempts, or for an unsafe id
     * @throws IOException on file system errors other than contention
     */
    public boolean acquire(String id, String ownerId, long ttlMs) throws IOException {
        if (!ScheduleIds.isSafe(id))
            return false;
        Files.createDirectories(locksDir);
        Path path = lockPath(id);

        for (int attempt = 0; attempt < MAX_LOCK_RETRIES; attempt++) {
            long now = clock.millis();
            if (publish(path, new LockInfo(ownerId, now, now, ttlMs))) {
                log.debug("Lock {} acquired by {}", id, ownerId);
                return true;
            }

            String raw;
            try {
                raw = Files.readString(path, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                // released between our publish and read
                continue;
            }

            Optional<LockInfo> holder = parse(raw);
            if (holder.isPresent() && !holder.get().isStale(now, ttlMs)) {
                log.debug("Lock {} held by {}", id, holder.get().ownerId());
                return false;
            }
            if (!removeIfUnchanged(path, raw)) {
                return false;
            }
            log.debug("Cleared {} lock {} (owner {})",
                    holder.isPresent() ? "stale" : "corrupt", id,
                    holder.map(LockInfo::ownerId).orElse("unknown"));
        }
        return false;
    }

    public boolean acquire(String id, String ownerId) throws IOException {
        return acquire(id, ownerId, DEFAULT_LOCK_TTL_MS);
    }

    // --- Release / refresh ---

    /**
     * Delete the lock if {@code ownerId} holds it.
     *
     * @return true if the lock file was removed
     * @throws IOException if a lock we own cannot be deleted
     */
    public boolean release(String id, String ownerId) throws IOException {
        if (!ScheduleIds.isSafe(id))
            return false;
        Path path = lockPath(id);
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return false;
        }
        Optional<LockInfo> holder = parse(raw);
        if (holder.isEmpty() || !holder.get().isOwnedBy(ownerId))
            return false;
        // a lock taken over since the read has different content and is kept
        boolean deleted = deleteIfUnchanged(path, raw);
        if (deleted) {
            log.debug("Lock {} released by {}", id, ownerId);
        }
        return deleted;
    }

    /**
     * Bump {@code updatedAt} on a lock this owner holds.
     *
     * @return false if the lock is gone or belongs to someone else
     * @throws IOException if the refreshed lock cannot be written
     */
    public boolean refresh(String id, String ownerId) throws IOException {
        Optional<LockInfo> holder = read(id);
        if (holder.isEmpty() || !holder.get().isOwnedBy(ownerId))
            return false;
        JsonFile.save(lockPath(id), holder.get().touch(clock.millis()));
        return true;
    }

    /**
     * Current lock content, empty if missing, unreadable or the id is unsafe.
     */
    public Optional<LockInfo> read(String id) {
        if (!ScheduleIds.isSafe(id))
            return Optional.empty();
        try {
            return parse(Files.readString(lockPath(id), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    // --- Internals ---

    private boolean publish(Path path, LockInfo info) throws IOException {
        Path tmp = JsonFile.writeTemp(locksDir, path.getFileName().toString(), JsonFile.toJson(info));
        try {
            Files.createLink(path, tmp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (UnsupportedOperationException e) {
            return publishCreateNew(path, info);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean publishCreateNew(Path path, LockInfo info) throws IOException {
        try {
            Files.writeString(path, JsonFile.toJson(info), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Delete {@code path} only if it still holds {@code expected}, so that a
     * lock another process has just re-created is left alone.
     */
    private static boolean removeIfUnchanged(Path path, String expected) throws IOException {
        return deleteIfUnchanged(path, expected) || Files.notExists(path);
    }

    /**
     * @return true if {@code path} still held {@code expected} and was deleted
     */
    static boolean deleteIfUnchanged(Path path, String expected) throws IOException {
        String current;
        try {
            current = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return false;
        }
        return current.equals(expected) && Files.deleteIfExists(path);
    }

    private static Optional<LockInfo> parse(String raw) {
        try {
            LockInfo info = JsonFile.mapper().readValue(raw, LockInfo.class);
            return Optional.ofNullable(info);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
