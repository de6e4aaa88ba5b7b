package com.ryuqq.scheduler.core.spi;

import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;

import java.time.Instant;

/**
 * 처리가 끝난 Schedule의 반납 내용.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scheduleId 반납할 Schedule
 * @param nextFireTime 다음 실행 시각 (null이면 종료되어 삭제)
 * @param lastFireTime 마지막으로 처리한 실행 시각
 */
public record ScheduleUpdate(ScheduleId scheduleId, Instant nextFireTime, Instant lastFireTime) {

    public ScheduleUpdate {
        if (scheduleId == null) {
            throw new IllegalArgumentException("scheduleId cannot be null");
        }
    }

    /**
     * 실행 시각 변경 없이 리스만 반납.
     *
     * @param schedule 획득했던 Schedule
     * @return 현재 실행 시각을 유지하는 ScheduleUpdate
     */
    public static ScheduleUpdate unchanged(Schedule schedule) {
        return new ScheduleUpdate(schedule.id(), schedule.nextFireTime(), schedule.lastFireTime());
    }

    public boolean finished() {
        return nextFireTime == null;
    }
}
