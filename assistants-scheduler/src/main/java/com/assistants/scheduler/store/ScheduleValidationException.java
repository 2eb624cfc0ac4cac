package com.assistants.scheduler.store;

/**
 * A schedule definition or id was rejected before anything was written.
 */
public class ScheduleValidationException extends IllegalArgumentException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
