package com.ryuqq.scheduler.core.model;

import com.ryuqq.scheduler.core.statemachine.JobStatus;

import java.time.Instant;

/**
 * 종료된 Job의 결과.
 *
 * <p>워커가 Job을 반납할 때 DataStore에 저장되며, {@code expiresAt}이 지나면
 * 정리 대상이 됩니다. 결과 조회는 1회성입니다 (조회 시 삭제).</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>status는 항상 종료 상태</li>
 *   <li>returnValue는 SUCCESS일 때만 존재</li>
 *   <li>error는 SUCCESS가 아닐 때만 존재 가능</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param jobId Job 식별자
 * @param taskId Task 식별자
 * @param scheduleId Schedule 식별자 (직접 추가한 Job이면 null)
 * @param status 종료 상태
 * @param returnValue 인코딩된 반환값 (SUCCESS일 때만)
 * @param error 오류 설명 (실패 계열일 때)
 * @param startedAt 실행 시작 시각 (실행되지 않았으면 null)
 * @param finishedAt 종료 시각
 * @param expiresAt 결과 만료 시각
 */
public record JobResult(
    JobId jobId,
    TaskId taskId,
    ScheduleId scheduleId,
    JobStatus status,
    Payload returnValue,
    JobError error,
    Instant startedAt,
    Instant finishedAt,
    Instant expiresAt
) {

    public JobResult {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
        if (returnValue != null && status != JobStatus.SUCCESS) {
            throw new IllegalArgumentException("returnValue is only allowed for SUCCESS (current: " + status + ")");
        }
        if (error != null && status == JobStatus.SUCCESS) {
            throw new IllegalArgumentException("error is not allowed for SUCCESS");
        }
        if (finishedAt == null) {
            throw new IllegalArgumentException("finishedAt cannot be null");
        }
        if (expiresAt == null) {
            expiresAt = finishedAt;
        }
    }

    public static JobResult success(Job job, Payload returnValue, Instant startedAt, Instant finishedAt) {
        return of(job, JobStatus.SUCCESS, returnValue, null, startedAt, finishedAt);
    }

    public static JobResult failure(Job job, JobError error, Instant startedAt, Instant finishedAt) {
        return of(job, JobStatus.FAILURE, null, error, startedAt, finishedAt);
    }

    /**
     * 시작 마감 시각을 넘긴 Job의 결과.
     *
     * @param job 대상 Job
     * @param now 판정 시각
     * @return MISSED 결과
     */
    public static JobResult missed(Job job, Instant now) {
        JobError error = JobError.of("MissedStartDeadline",
            "Job was not started before its start deadline " + job.startDeadline());
        return of(job, JobStatus.MISSED, null, error, null, now);
    }

    public static JobResult cancelled(Job job, Instant startedAt, Instant finishedAt) {
        return of(job, JobStatus.CANCELLED, null, null, startedAt, finishedAt);
    }

    private static JobResult of(Job job, JobStatus status, Payload returnValue, JobError error,
                                Instant startedAt, Instant finishedAt) {
        return new JobResult(job.id(), job.taskId(), job.scheduleId(), status, returnValue, error,
            startedAt, finishedAt, finishedAt.plus(job.resultExpirationTime()));
    }

    /**
     * 주어진 시각에 결과가 만료되었는지 확인.
     *
     * @param now 기준 시각
     * @return expiresAt이 now 이전이거나 같으면 true
     */
    public boolean expiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
