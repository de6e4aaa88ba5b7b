package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Job이 추가됨. 워커는 이 이벤트로 대기에서 깨어납니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobAdded(Instant timestamp, JobId jobId, TaskId taskId, ScheduleId scheduleId) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.JOB_ADDED;
    }
}
