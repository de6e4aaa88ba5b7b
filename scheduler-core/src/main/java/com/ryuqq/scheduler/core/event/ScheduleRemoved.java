package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Schedule이 삭제됨. finished가 true이면 Trigger가 종료되어 자동 삭제된 경우입니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScheduleRemoved(Instant timestamp, ScheduleId scheduleId, TaskId taskId, boolean finished) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.SCHEDULE_REMOVED;
    }
}
