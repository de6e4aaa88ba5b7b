package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * 기존 Task 정의가 교체됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskUpdated(Instant timestamp, TaskId taskId) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.TASK_UPDATED;
    }
}
