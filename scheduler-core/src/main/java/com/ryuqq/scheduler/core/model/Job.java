package com.ryuqq.scheduler.core.model;

import com.ryuqq.scheduler.core.statemachine.JobStatus;
import com.ryuqq.scheduler.core.statemachine.JobStatusTransition;

import java.time.Duration;
import java.time.Instant;

/**
 * Task 실행 1회 요청.
 *
 * <p>Job은 스케줄러 루프가 Schedule의 실행 시각마다 생성하거나,
 * 사용자가 직접 추가합니다. 워커는 Job을 리스로 획득하여 실행하고
 * 결과({@link JobResult})와 함께 반납합니다.</p>
 *
 * <p><strong>시작 마감 시각:</strong> startDeadline이 지난 뒤 획득된 Job은
 * 실행하지 않고 {@link JobStatus#MISSED}로 종료합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id Job 식별자
 * @param taskId 실행할 Task
 * @param args 인코딩된 인자
 * @param scheduleId 생성한 Schedule (직접 추가한 Job이면 null)
 * @param scheduledFireTime 예정 실행 시각 (직접 추가한 Job이면 null)
 * @param startDeadline 시작 마감 시각 (null이면 무제한)
 * @param resultExpirationTime 결과 보관 기간
 * @param createdAt 생성 시각
 * @param status 현재 상태
 * @param acquiredBy 리스 소유 워커
 * @param acquiredUntil 리스 만료 시각
 */
public record Job(
    JobId id,
    TaskId taskId,
    Payload args,
    ScheduleId scheduleId,
    Instant scheduledFireTime,
    Instant startDeadline,
    Duration resultExpirationTime,
    Instant createdAt,
    JobStatus status,
    InstanceId acquiredBy,
    Instant acquiredUntil
) {

    public Job {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (args == null) {
            args = Payload.empty();
        }
        if (resultExpirationTime == null) {
            resultExpirationTime = Duration.ZERO;
        }
        if (resultExpirationTime.isNegative()) {
            throw new IllegalArgumentException(
                "resultExpirationTime cannot be negative (current: " + resultExpirationTime + ")"
            );
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if ((acquiredBy == null) != (acquiredUntil == null)) {
            throw new IllegalArgumentException("acquiredBy and acquiredUntil must be set together");
        }
    }

    /**
     * 사용자가 직접 추가하는 Job 생성.
     *
     * @param taskId 실행할 Task
     * @param args 인코딩된 인자
     * @param resultExpirationTime 결과 보관 기간
     * @param createdAt 생성 시각
     * @return PENDING 상태의 새 Job
     */
    public static Job create(TaskId taskId, Payload args, Duration resultExpirationTime, Instant createdAt) {
        return new Job(JobId.generate(), taskId, args, null, null, null, resultExpirationTime,
            createdAt, JobStatus.PENDING, null, null);
    }

    /**
     * Schedule의 실행 시각으로부터 Job 생성.
     *
     * @param schedule 원본 Schedule
     * @param fireTime 예정 실행 시각
     * @param startDeadline 시작 마감 시각 (null이면 무제한)
     * @param createdAt 생성 시각
     * @return PENDING 상태의 새 Job
     */
    public static Job forSchedule(Schedule schedule, Instant fireTime, Instant startDeadline, Instant createdAt) {
        return new Job(JobId.generate(), schedule.taskId(), schedule.args(), schedule.id(), fireTime,
            startDeadline, schedule.jobResultExpirationTime(), createdAt, JobStatus.PENDING, null, null);
    }

    /**
     * 주어진 시각에 시작 마감 시각이 지났는지 확인.
     *
     * @param now 기준 시각
     * @return 마감 시각이 있고 now가 그보다 뒤이면 true
     */
    public boolean deadlinePassedAt(Instant now) {
        return startDeadline != null && now.isAfter(startDeadline);
    }

    public boolean leaseLiveAt(Instant now) {
        return acquiredUntil != null && acquiredUntil.isAfter(now);
    }

    /**
     * 상태 전이 (검증 후).
     *
     * @param next 다음 상태
     * @return 새 Job
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public Job withStatus(JobStatus next) {
        JobStatus validated = JobStatusTransition.transition(status, next);
        return new Job(id, taskId, args, scheduleId, scheduledFireTime, startDeadline, resultExpirationTime,
            createdAt, validated, acquiredBy, acquiredUntil);
    }

    public Job withLease(InstanceId acquiredBy, Instant acquiredUntil) {
        return new Job(id, taskId, args, scheduleId, scheduledFireTime, startDeadline, resultExpirationTime,
            createdAt, status, acquiredBy, acquiredUntil);
    }
}
