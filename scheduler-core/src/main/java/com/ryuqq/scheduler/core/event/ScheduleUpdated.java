package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Schedule이 교체되었거나 처리 후 다음 실행 시각이 갱신됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScheduleUpdated(Instant timestamp, ScheduleId scheduleId, TaskId taskId, Instant nextFireTime) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.SCHEDULE_UPDATED;
    }
}
