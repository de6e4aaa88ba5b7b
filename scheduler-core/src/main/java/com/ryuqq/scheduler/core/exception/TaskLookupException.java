package com.ryuqq.scheduler.core.exception;

import com.ryuqq.scheduler.core.model.TaskId;

/**
 * 요청한 Task가 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TaskLookupException extends SchedulerException {

    public TaskLookupException(TaskId taskId) {
        super("No task found with id " + taskId.getValue());
    }
}
