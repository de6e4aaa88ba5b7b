package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.scheduler.SchedulerRole;

/**
 * {@link DefaultScheduler} 전체 설정 (불변 record).
 *
 * <p>역할(role)에 따라 Schedule 루프와 워커 루프 중 어떤 것을 띄울지 결정되며,
 * 나머지 설정은 각 루프에 그대로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param role 인스턴스 역할
 * @param loop Schedule 루프 설정
 * @param worker 워커 설정
 * @param cleaner 정리 설정
 * @param retry DataStore 재시도 설정
 */
public record SchedulerConfig(
    SchedulerRole role,
    SchedulerLoopConfig loop,
    WorkerConfig worker,
    CleanerConfig cleaner,
    DataStoreRetryConfig retry
) {

    /**
     * 기본 설정 생성자 (BOTH 역할, 각 설정 기본값).
     */
    public SchedulerConfig() {
        this(SchedulerRole.BOTH, new SchedulerLoopConfig(), new WorkerConfig(),
            new CleanerConfig(), new DataStoreRetryConfig());
    }

    public SchedulerConfig {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        if (cleaner == null) {
            throw new IllegalArgumentException("cleaner cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
    }

    public SchedulerConfig withRole(SchedulerRole role) {
        return new SchedulerConfig(role, loop, worker, cleaner, retry);
    }

    public SchedulerConfig withLoop(SchedulerLoopConfig loop) {
        return new SchedulerConfig(role, loop, worker, cleaner, retry);
    }

    public SchedulerConfig withWorker(WorkerConfig worker) {
        return new SchedulerConfig(role, loop, worker, cleaner, retry);
    }

    public SchedulerConfig withCleaner(CleanerConfig cleaner) {
        return new SchedulerConfig(role, loop, worker, cleaner, retry);
    }

    public SchedulerConfig withRetry(DataStoreRetryConfig retry) {
        return new SchedulerConfig(role, loop, worker, cleaner, retry);
    }
}
