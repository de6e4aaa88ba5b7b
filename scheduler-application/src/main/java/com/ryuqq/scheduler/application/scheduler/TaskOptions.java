package com.ryuqq.scheduler.application.scheduler;

import com.ryuqq.scheduler.core.model.Task;

import java.time.Duration;

/**
 * Task 등록 옵션 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param executor 실행할 JobExecutor 이름 (기본 "threadpool")
 * @param maxRunningJobs 동시 실행 상한 (null이면 무제한)
 * @param misfireGraceTime 기본 misfire 허용 시간 (null이면 무제한)
 */
public record TaskOptions(String executor, Integer maxRunningJobs, Duration misfireGraceTime) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: executor=threadpool, maxRunningJobs=무제한, misfireGraceTime=무제한</p>
     */
    public TaskOptions() {
        this(Task.DEFAULT_EXECUTOR, null, null);
    }

    public TaskOptions {
        if (executor == null || executor.isBlank()) {
            throw new IllegalArgumentException("executor cannot be null or blank");
        }
        if (maxRunningJobs != null && maxRunningJobs <= 0) {
            throw new IllegalArgumentException(
                "maxRunningJobs must be positive (current: " + maxRunningJobs + ")"
            );
        }
        if (misfireGraceTime != null && misfireGraceTime.isNegative()) {
            throw new IllegalArgumentException(
                "misfireGraceTime cannot be negative (current: " + misfireGraceTime + ")"
            );
        }
    }

    public TaskOptions withExecutor(String executor) {
        return new TaskOptions(executor, maxRunningJobs, misfireGraceTime);
    }

    public TaskOptions withMaxRunningJobs(Integer maxRunningJobs) {
        return new TaskOptions(executor, maxRunningJobs, misfireGraceTime);
    }

    public TaskOptions withMisfireGraceTime(Duration misfireGraceTime) {
        return new TaskOptions(executor, maxRunningJobs, misfireGraceTime);
    }
}
