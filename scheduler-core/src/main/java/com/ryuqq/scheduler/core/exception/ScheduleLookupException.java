package com.ryuqq.scheduler.core.exception;

import com.ryuqq.scheduler.core.model.ScheduleId;

/**
 * 요청한 Schedule이 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScheduleLookupException extends SchedulerException {

    public ScheduleLookupException(ScheduleId scheduleId) {
        super("No schedule found with id " + scheduleId.getValue());
    }
}
