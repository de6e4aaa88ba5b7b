package com.ryuqq.scheduler.core.model;

import java.time.Duration;

/**
 * 실행 가능한 작업 정의.
 *
 * <p>Task는 실행할 함수 참조와 실행 정책을 묶은 단위입니다.
 * 같은 TaskId로 다시 등록하면 기존 정의를 교체합니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>id: Task 식별자</li>
 *   <li>func: 워커가 해석할 함수 참조</li>
 *   <li>executor: 실행기 이름 (기본 {@value #DEFAULT_EXECUTOR})</li>
 *   <li>maxRunningJobs: 전체 백엔드 기준 동시 실행 상한 (null이면 무제한)</li>
 *   <li>misfireGraceTime: 실행 지연 허용 시간 (null이면 무제한)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id Task 식별자 (필수)
 * @param func 함수 참조 (필수)
 * @param executor 실행기 이름 (필수)
 * @param maxRunningJobs 동시 실행 상한 (null 또는 양수)
 * @param misfireGraceTime 지연 허용 시간 (null 또는 0 이상)
 */
public record Task(
    TaskId id,
    CallableRef func,
    String executor,
    Integer maxRunningJobs,
    Duration misfireGraceTime
) {

    /**
     * 기본 실행기 이름.
     */
    public static final String DEFAULT_EXECUTOR = "threadpool";

    public Task {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (func == null) {
            throw new IllegalArgumentException("func cannot be null");
        }
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

    /**
     * 기본 정책으로 Task 생성.
     *
     * @param id Task 식별자
     * @param func 함수 참조
     * @return 기본 실행기, 무제한 동시 실행, 무제한 지연 허용 Task
     */
    public static Task of(TaskId id, CallableRef func) {
        return new Task(id, func, DEFAULT_EXECUTOR, null, null);
    }

    public Task withExecutor(String executor) {
        return new Task(id, func, executor, maxRunningJobs, misfireGraceTime);
    }

    public Task withMaxRunningJobs(Integer maxRunningJobs) {
        return new Task(id, func, executor, maxRunningJobs, misfireGraceTime);
    }

    public Task withMisfireGraceTime(Duration misfireGraceTime) {
        return new Task(id, func, executor, maxRunningJobs, misfireGraceTime);
    }
}
