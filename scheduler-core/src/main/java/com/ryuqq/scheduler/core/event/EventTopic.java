package com.ryuqq.scheduler.core.event;

import java.util.Arrays;

/**
 * 이벤트 토픽과 이벤트 타입의 대응.
 *
 * <p>프로세스 간 전송 시 토픽 문자열로 이벤트 타입을 복원하는 데 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventTopic {

    TASK_ADDED("task_added", TaskAdded.class),
    TASK_UPDATED("task_updated", TaskUpdated.class),
    TASK_REMOVED("task_removed", TaskRemoved.class),
    SCHEDULE_ADDED("schedule_added", ScheduleAdded.class),
    SCHEDULE_UPDATED("schedule_updated", ScheduleUpdated.class),
    SCHEDULE_REMOVED("schedule_removed", ScheduleRemoved.class),
    JOB_ADDED("job_added", JobAdded.class),
    JOB_ACQUIRED("job_acquired", JobAcquired.class),
    JOB_COMPLETED("job_completed", JobReleased.class),
    SCHEDULER_STARTED("scheduler_started", SchedulerStarted.class),
    SCHEDULER_STOPPED("scheduler_stopped", SchedulerStopped.class);

    private final String value;
    private final Class<? extends Event> eventType;

    EventTopic(String value, Class<? extends Event> eventType) {
        this.value = value;
        this.eventType = eventType;
    }

    public String getValue() {
        return value;
    }

    public Class<? extends Event> getEventType() {
        return eventType;
    }

    /**
     * 토픽 문자열로 조회.
     *
     * @param value 토픽 문자열
     * @return EventTopic
     * @throws IllegalArgumentException 알 수 없는 토픽인 경우
     */
    public static EventTopic fromValue(String value) {
        return Arrays.stream(values())
            .filter(topic -> topic.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event topic: " + value));
    }
}
