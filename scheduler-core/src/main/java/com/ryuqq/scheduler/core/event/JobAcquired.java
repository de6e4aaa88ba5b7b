package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * 워커가 Job을 획득함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobAcquired(Instant timestamp, JobId jobId, TaskId taskId, ScheduleId scheduleId, InstanceId workerId) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.JOB_ACQUIRED;
    }
}
