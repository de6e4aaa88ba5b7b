package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Schedule이 새로 추가됨. 스케줄러 루프는 이 이벤트로 대기에서 깨어납니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScheduleAdded(Instant timestamp, ScheduleId scheduleId, TaskId taskId, Instant nextFireTime) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.SCHEDULE_ADDED;
    }
}
