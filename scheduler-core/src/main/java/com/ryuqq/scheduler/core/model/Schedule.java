package com.ryuqq.scheduler.core.model;

import com.ryuqq.scheduler.core.trigger.Trigger;

import java.time.Duration;
import java.time.Instant;

/**
 * Task와 Trigger의 결합 (주기적 실행 정의).
 *
 * <p>Schedule은 DataStore에 저장되며, 스케줄러 인스턴스가 리스(lease)를 획득한 뒤
 * 도래한 실행 시각마다 Job을 생성하고 다음 실행 시각을 기록하여 반납합니다.</p>
 *
 * <p><strong>리스 불변식:</strong></p>
 * <ul>
 *   <li>acquiredBy와 acquiredUntil은 함께 설정되거나 함께 비어 있음</li>
 *   <li>리스는 acquiredUntil이 DataStore 시계의 현재 시각보다 뒤일 때만 유효</li>
 *   <li>nextFireTime이 null이면 더 이상 실행할 시각이 없는(종료된) Schedule</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id Schedule 식별자
 * @param taskId 실행할 Task
 * @param trigger 실행 시각 규칙
 * @param args 인코딩된 Job 인자
 * @param coalesce 누적된 실행 시각 병합 정책
 * @param misfireGraceTime 지연 허용 시간 (null이면 Task 설정 상속)
 * @param paused 일시 정지 여부
 * @param jobResultExpirationTime 생성되는 Job 결과의 보관 기간
 * @param nextFireTime 다음 실행 시각 (null이면 종료)
 * @param lastFireTime 마지막으로 처리한 실행 시각
 * @param acquiredBy 리스 소유 스케줄러
 * @param acquiredUntil 리스 만료 시각
 */
public record Schedule(
    ScheduleId id,
    TaskId taskId,
    Trigger trigger,
    Payload args,
    CoalescePolicy coalesce,
    Duration misfireGraceTime,
    boolean paused,
    Duration jobResultExpirationTime,
    Instant nextFireTime,
    Instant lastFireTime,
    InstanceId acquiredBy,
    Instant acquiredUntil
) {

    /**
     * 기본 Job 결과 보관 기간 (0이면 결과를 저장하지 않음).
     */
    public static final Duration DEFAULT_RESULT_EXPIRATION = Duration.ZERO;

    public Schedule {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (args == null) {
            args = Payload.empty();
        }
        if (coalesce == null) {
            coalesce = CoalescePolicy.LATEST;
        }
        if (misfireGraceTime != null && misfireGraceTime.isNegative()) {
            throw new IllegalArgumentException(
                "misfireGraceTime cannot be negative (current: " + misfireGraceTime + ")"
            );
        }
        if (jobResultExpirationTime == null) {
            jobResultExpirationTime = DEFAULT_RESULT_EXPIRATION;
        }
        if (jobResultExpirationTime.isNegative()) {
            throw new IllegalArgumentException(
                "jobResultExpirationTime cannot be negative (current: " + jobResultExpirationTime + ")"
            );
        }
        if ((acquiredBy == null) != (acquiredUntil == null)) {
            throw new IllegalArgumentException(
                "acquiredBy and acquiredUntil must be set together (acquiredBy: " + acquiredBy
                    + ", acquiredUntil: " + acquiredUntil + ")"
            );
        }
    }

    /**
     * 기본 옵션으로 Schedule 생성.
     *
     * @param id Schedule 식별자
     * @param taskId Task 식별자
     * @param trigger 실행 시각 규칙
     * @param firstFireTime 첫 실행 시각
     * @return 리스가 없는 새 Schedule
     */
    public static Schedule of(ScheduleId id, TaskId taskId, Trigger trigger, Instant firstFireTime) {
        return new Schedule(id, taskId, trigger, Payload.empty(), CoalescePolicy.LATEST, null, false,
            DEFAULT_RESULT_EXPIRATION, firstFireTime, null, null, null);
    }

    /**
     * 주어진 시각에 리스가 유효한지 확인.
     *
     * @param now 기준 시각 (DataStore 시계)
     * @return acquiredUntil이 now보다 뒤이면 true
     */
    public boolean leaseLiveAt(Instant now) {
        return acquiredUntil != null && acquiredUntil.isAfter(now);
    }

    /**
     * 주어진 시각에 실행 대상인지 확인 (리스 여부와 무관).
     *
     * @param now 기준 시각
     * @return 정지되지 않았고 nextFireTime이 now 이전이거나 같으면 true
     */
    public boolean dueAt(Instant now) {
        return !paused && nextFireTime != null && !nextFireTime.isAfter(now);
    }

    public Schedule withArgs(Payload args) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    public Schedule withCoalesce(CoalescePolicy coalesce) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    public Schedule withMisfireGraceTime(Duration misfireGraceTime) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    public Schedule withPaused(boolean paused) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    public Schedule withJobResultExpirationTime(Duration jobResultExpirationTime) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    /**
     * 실행 시각 갱신.
     *
     * @param nextFireTime 다음 실행 시각 (null이면 종료)
     * @param lastFireTime 마지막 처리 시각
     * @return 새 Schedule
     */
    public Schedule withFireTimes(Instant nextFireTime, Instant lastFireTime) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    public Schedule withLease(InstanceId acquiredBy, Instant acquiredUntil) {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, acquiredBy, acquiredUntil);
    }

    public Schedule withoutLease() {
        return new Schedule(id, taskId, trigger, args, coalesce, misfireGraceTime, paused,
            jobResultExpirationTime, nextFireTime, lastFireTime, null, null);
    }
}
