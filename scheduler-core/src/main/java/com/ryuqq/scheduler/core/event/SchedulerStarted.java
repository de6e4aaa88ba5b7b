package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.InstanceId;

import java.time.Instant;

/**
 * 스케줄러 인스턴스가 시작됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SchedulerStarted(Instant timestamp, InstanceId instanceId) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.SCHEDULER_STARTED;
    }
}
