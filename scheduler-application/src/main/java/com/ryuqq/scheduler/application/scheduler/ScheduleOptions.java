package com.ryuqq.scheduler.application.scheduler;

import com.ryuqq.scheduler.core.model.CoalescePolicy;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.ScheduleId;

import java.time.Duration;

/**
 * Schedule 추가 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>id: Schedule 식별자 (null이면 자동 생성)</li>
 *   <li>args: Job에 전달할 인자 (기본 없음)</li>
 *   <li>coalesce: 밀린 실행 시각 병합 정책 (기본 LATEST)</li>
 *   <li>misfireGraceTime: misfire 허용 시간 (null이면 Task 설정 상속)</li>
 *   <li>paused: 정지 상태로 추가 (기본 false)</li>
 *   <li>jobResultExpirationTime: 생성되는 Job 결과 보관 기간 (기본 0, 보관 안 함)</li>
 *   <li>conflictPolicy: 같은 ID가 있을 때의 처리 (기본 EXCEPTION)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScheduleOptions(
    ScheduleId id,
    JobArguments args,
    CoalescePolicy coalesce,
    Duration misfireGraceTime,
    boolean paused,
    Duration jobResultExpirationTime,
    ConflictPolicy conflictPolicy
) {

    public ScheduleOptions() {
        this(null, JobArguments.none(), CoalescePolicy.LATEST, null, false, Duration.ZERO, ConflictPolicy.EXCEPTION);
    }

    public ScheduleOptions {
        if (args == null) {
            args = JobArguments.none();
        }
        if (coalesce == null) {
            throw new IllegalArgumentException("coalesce cannot be null");
        }
        if (misfireGraceTime != null && misfireGraceTime.isNegative()) {
            throw new IllegalArgumentException(
                "misfireGraceTime cannot be negative (current: " + misfireGraceTime + ")"
            );
        }
        if (jobResultExpirationTime == null || jobResultExpirationTime.isNegative()) {
            throw new IllegalArgumentException(
                "jobResultExpirationTime cannot be null or negative (current: " + jobResultExpirationTime + ")"
            );
        }
        if (conflictPolicy == null) {
            throw new IllegalArgumentException("conflictPolicy cannot be null");
        }
    }

    public ScheduleOptions withId(ScheduleId id) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }

    public ScheduleOptions withArgs(JobArguments args) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }

    public ScheduleOptions withCoalesce(CoalescePolicy coalesce) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }

    public ScheduleOptions withMisfireGraceTime(Duration misfireGraceTime) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }

    public ScheduleOptions withPaused(boolean paused) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }

    public ScheduleOptions withJobResultExpirationTime(Duration jobResultExpirationTime) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }

    public ScheduleOptions withConflictPolicy(ConflictPolicy conflictPolicy) {
        return new ScheduleOptions(id, args, coalesce, misfireGraceTime, paused, jobResultExpirationTime, conflictPolicy);
    }
}
