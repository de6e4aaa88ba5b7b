package com.ryuqq.scheduler.core.event;

import com.ryuqq.scheduler.core.model.InstanceId;

import java.time.Instant;

/**
 * 스케줄러 인스턴스가 중지됨. 치명적 오류로 중지된 경우 error에 원인이 담깁니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SchedulerStopped(Instant timestamp, InstanceId instanceId, String error) implements Event {

    @Override
    public EventTopic topic() {
        return EventTopic.SCHEDULER_STOPPED;
    }
}
