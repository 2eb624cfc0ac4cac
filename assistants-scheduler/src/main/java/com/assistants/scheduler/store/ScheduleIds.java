package com.assistants.scheduler.store;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Schedule ids double as file names, so only a restricted alphabet is allowed.
 */
public final class ScheduleIds {

    private ScheduleIds() {
    }

    private static final Pattern SAFE_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    /**
     * Letters, digits, {@code -} and {@code _} only; no separators, dots or
     * whitespace.
     */
    public static boolean isSafe(String id) {
        return id != null && SAFE_ID.matcher(id).matches();
    }

    /**
     * @throws ScheduleValidationException if the id is not safe
     */
    public static String requireSafe(String id) {
        if (!isSafe(id)) {
            throw new ScheduleValidationException("Invalid schedule id: " + id);
        }
        return id;
    }

    /**
     * Fresh random id; UUIDs only use safe characters.
     */
    public static String generate() {
        return UUID.randomUUID().toString();
    }
}
