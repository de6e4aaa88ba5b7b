package com.ryuqq.scheduler.adapter.runner;

import java.time.Duration;

/**
 * Job 워커 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>leaseDurationMs: Job 리스 기간 (기본 30000ms). 실행 중에는 주기적으로 연장</li>
 *   <li>batchSize: 한 번에 획득할 Job 수 상한 (기본 10)</li>
 *   <li>maxConcurrentJobs: 이 인스턴스가 동시에 실행하는 최대 Job 수 (기본 20)</li>
 *   <li>pollingIntervalMs: 이벤트가 없을 때 Job을 확인하는 주기 (기본 1000ms)</li>
 *   <li>jobTimeoutMs: Job 실행 제한 시간, 0이면 제한 없음 (기본 0)</li>
 * </ul>
 *
 * <p><strong>동시성 설정 가이드:</strong></p>
 * <ul>
 *   <li>I/O 위주 Task: maxConcurrentJobs = CPU 코어 수 * 4 ~ 8</li>
 *   <li>CPU 위주 Task: maxConcurrentJobs = CPU 코어 수</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param leaseDurationMs 리스 기간 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxConcurrentJobs 동시 실행 수 (1 이상)
 * @param pollingIntervalMs 폴링 주기 (밀리초, 양수)
 * @param jobTimeoutMs 실행 제한 시간 (밀리초, 0 이상)
 */
public record WorkerConfig(
    long leaseDurationMs,
    int batchSize,
    int maxConcurrentJobs,
    long pollingIntervalMs,
    long jobTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: leaseDurationMs=30000ms, batchSize=10, maxConcurrentJobs=20,
     * pollingIntervalMs=1000ms, jobTimeoutMs=0 (제한 없음)</p>
     */
    public WorkerConfig() {
        this(30000, 10, 20, 1000, 0);
    }

    public WorkerConfig {
        if (leaseDurationMs <= 0) {
            throw new IllegalArgumentException(
                "leaseDurationMs must be positive (current: " + leaseDurationMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentJobs must be positive (current: " + maxConcurrentJobs + ")"
            );
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (jobTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "jobTimeoutMs must be >= 0 (current: " + jobTimeoutMs + ")"
            );
        }
    }

    public WorkerConfig withLeaseDurationMs(long leaseDurationMs) {
        return new WorkerConfig(leaseDurationMs, batchSize, maxConcurrentJobs, pollingIntervalMs, jobTimeoutMs);
    }

    public WorkerConfig withBatchSize(int batchSize) {
        return new WorkerConfig(leaseDurationMs, batchSize, maxConcurrentJobs, pollingIntervalMs, jobTimeoutMs);
    }

    public WorkerConfig withMaxConcurrentJobs(int maxConcurrentJobs) {
        return new WorkerConfig(leaseDurationMs, batchSize, maxConcurrentJobs, pollingIntervalMs, jobTimeoutMs);
    }

    public WorkerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new WorkerConfig(leaseDurationMs, batchSize, maxConcurrentJobs, pollingIntervalMs, jobTimeoutMs);
    }

    public WorkerConfig withJobTimeoutMs(long jobTimeoutMs) {
        return new WorkerConfig(leaseDurationMs, batchSize, maxConcurrentJobs, pollingIntervalMs, jobTimeoutMs);
    }

    public Duration leaseDuration() {
        return Duration.ofMillis(leaseDurationMs);
    }

    /**
     * @return 실행 제한 시간 (제한 없으면 null)
     */
    public Duration jobTimeout() {
        return jobTimeoutMs == 0 ? null : Duration.ofMillis(jobTimeoutMs);
    }
}
