package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.statemachine.JobStatus;

import java.time.Instant;

/**
 * Job이 종료 상태로 반납됨 (토픽: job_completed).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobReleased(Instant timestamp, JobId jobId, TaskId taskId, ScheduleId scheduleId, JobStatus status, Instant scheduledFireTime) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.JOB_COMPLETED;
    }
}
