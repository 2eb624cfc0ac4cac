package com.assistants.scheduler.runner;

import com.assistants.scheduler.model.ScheduleRecord;
import com.assistants.scheduler.model.ScheduleTypes.RunResult;

/**
 * Runs the action of a due schedule. What running means (a shell command, a
 * message injected into a session) is up to the implementation.
 */
@FunctionalInterface
public interface ScheduleActionExecutor {

    /**
     * @param record  the schedule being executed, as re-read under the lock
     * @param payload command or message text, see
     *                {@link ScheduleRecord#actionPayload()}
     * @return outcome stored as the schedule's last result
     * @throws Exception treated as a failed run
     */
    RunResult execute(ScheduleRecord record, String payload) throws Exception;
}
