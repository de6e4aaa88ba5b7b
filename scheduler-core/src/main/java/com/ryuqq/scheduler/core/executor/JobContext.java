package com.ryuqq.scheduler.core.executor;

import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Task 함수에 전달되는 실행 문맥.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param jobId 실행 중인 Job
 * @param taskId Task
 * @param scheduleId 원본 Schedule (직접 추가한 Job이면 null)
 * @param scheduledFireTime 예정 실행 시각 (직접 추가한 Job이면 null)
 * @param arguments 디코딩된 인자
 */
public record JobContext(
    JobId jobId,
    TaskId taskId,
    ScheduleId scheduleId,
    Instant scheduledFireTime,
    JobArguments arguments
) {

    public JobContext {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (arguments == null) {
            arguments = JobArguments.none();
        }
    }
}
