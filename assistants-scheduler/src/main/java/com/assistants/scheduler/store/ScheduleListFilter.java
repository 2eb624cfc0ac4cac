package com.assistants.scheduler.store;

/**
 * Session scoping for {@link ScheduleStore#list(ScheduleListFilter)}.
 *
 * @param sessionId caller's session; null lists every schedule
 * @param all       when true the session filter is not applied
 */
public record ScheduleListFilter(String sessionId, boolean all) {

    /** Every schedule regardless of session. */
    public static ScheduleListFilter everything() {
        return new ScheduleListFilter(null, true);
    }

    /** Schedules of {@code sessionId} plus global ones. */
    public static ScheduleListFilter forSession(String sessionId) {
        return new ScheduleListFilter(sessionId, false);
    }

    boolean appliesSessionFilter() {
        return !all && sessionId != null && !sessionId.isBlank();
    }
}
