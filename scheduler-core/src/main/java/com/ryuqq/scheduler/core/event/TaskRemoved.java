package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Instant;

/**
 * Task가 삭제됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskRemoved(Instant timestamp, TaskId taskId) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.TASK_REMOVED;
    }
}
