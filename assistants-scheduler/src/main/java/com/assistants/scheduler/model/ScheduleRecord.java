package com.assistants.scheduler.model;

import com.assistants.scheduler.model.ScheduleTypes.ActionType;
import com.assistants.scheduler.model.ScheduleTypes.CreatedBy;
import com.assistants.scheduler.model.ScheduleTypes.RunResult;
import com.assistants.scheduler.model.ScheduleTypes.ScheduleStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One persisted trigger, stored as {@code schedules/<id>.json}.
 * Mutated only through read-modify-write of the whole record.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRecord {
    private String id;
    private long createdAt;
    private long updatedAt;
    private CreatedBy createdBy;
    /** Owning session; null for a global schedule. */
    private String sessionId;
    @Builder.Default
    private ActionType actionType = ActionType.COMMAND;
    private String command;
    private String message;
    private String description;
    private ScheduleStatus status;
    private ScheduleSpec schedule;
    /** Cached next fire time; null means unknown and never due. */
    private Long nextRunAt;
    private Long lastRunAt;
    private RunResult lastResult;

    @JsonIgnore
    public boolean isGlobal() {
        return sessionId == null || sessionId.isBlank();
    }

    /**
     * Text handed to the executor: the message for message actions (falling
     * back to the command when no message is set), otherwise the command.
     */
    @JsonIgnore
    public String actionPayload() {
        if (actionType == ActionType.MESSAGE && message != null && !message.isBlank()) {
            return message;
        }
        return command;
    }

    /**
     * Due means active with a known next run at or before {@code now}.
     */
    @JsonIgnore
    public boolean isDue(long now) {
        return status == ScheduleStatus.ACTIVE && nextRunAt != null && nextRunAt <= now;
    }
}
