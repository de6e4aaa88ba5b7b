package com.ryuqq.scheduler.core.exception;

import com.ryuqq.scheduler.core.model.JobId;

/**
 * 요청한 Job이 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JobLookupException extends SchedulerException {

    public JobLookupException(JobId jobId) {
        super("No job found with id " + jobId.getValue());
    }
}
