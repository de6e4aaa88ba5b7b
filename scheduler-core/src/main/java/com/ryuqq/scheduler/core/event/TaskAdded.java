package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Task가 새로 등록됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskAdded(Instant timestamp, TaskId taskId) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.TASK_ADDED;
    }
}
