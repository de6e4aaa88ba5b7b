package com.ryuqq.scheduler.core.event;

import java.time.Instant;

/**
 * 스케줄러 이벤트.
 *
 * <p>DataStore와 스케줄러가 상태 변화를 알리기 위해 EventBroker로 발행합니다.
 * 모든 이벤트는 불변 record이며 Serializer로 인코딩하여 프로세스 간에 전송할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Event
    permits TaskAdded, TaskUpdated, TaskRemoved,
            ScheduleAdded, ScheduleUpdated, ScheduleRemoved,
            JobAdded, JobAcquired, JobReleased,
            SchedulerStarted, SchedulerStopped {

    /**
     * 이벤트 발생 시각.
     *
     * @return 발생 시각
     */
    Instant timestamp();

    /**
     * 이벤트 토픽.
     *
     * @return 토픽
     */
    EventTopic topic();
}
