package com.assistants.scheduler;

import com.assistants.scheduler.model.ScheduleSpec;
import com.assistants.scheduler.model.ScheduleTypes.ActionType;
import com.assistants.scheduler.model.ScheduleTypes.CreatedBy;
import lombok.Builder;
import lombok.Data;

/**
 * Input to {@link SchedulerService#create(ScheduleDraft)}: the user-supplied
 * part of a schedule. Timestamps, status and next run are filled in on create.
 */
@Data
@Builder
public class ScheduleDraft {
    /** Optional; a random id is generated when null. */
    private String id;
    @Builder.Default
    private CreatedBy createdBy = CreatedBy.USER;
    private String sessionId;
    @Builder.Default
    private ActionType actionType = ActionType.COMMAND;
    private String command;
    private String message;
    private String description;
    private ScheduleSpec schedule;
}
