package com.assistants.scheduler.store;

/**
 * Content of a {@code locks/<id>.lock.json} file. Fields are boxed so that
 * partially written or hand-edited locks still parse.
 */
public record LockInfo(String ownerId, Long createdAt, Long updatedAt, Long ttlMs) {

    /**
     * Last heartbeat of the holder: {@code updatedAt}, else {@code createdAt},
     * else 0.
     */
    public long lastTouchedAt() {
        if (updatedAt != null)
            return updatedAt;
        if (createdAt != null)
            return createdAt;
        return 0L;
    }

    /**
     * A lock is stale once more than its own TTL (or {@code fallbackTtlMs} when
     * it has none) has passed since it was last touched.
     */
    public boolean isStale(long now, long fallbackTtlMs) {
        long ttl = ttlMs != null ? ttlMs : fallbackTtlMs;
        return now - lastTouchedAt() > ttl;
    }

    public boolean isOwnedBy(String owner) {
        return ownerId != null && ownerId.equals(owner);
    }

    LockInfo touch(long now) {
        return new LockInfo(ownerId, createdAt, now, ttlMs);
    }
}
