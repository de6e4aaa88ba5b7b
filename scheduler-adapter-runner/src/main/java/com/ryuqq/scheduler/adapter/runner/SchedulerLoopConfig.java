package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.scheduling.FirePlanner;

import java.time.Duration;

/**
 * Schedule 처리 루프 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>leaseDurationMs: Schedule 리스 기간 (기본 30000ms)</li>
 *   <li>batchSize: 한 번에 획득할 Schedule 수 (기본 100)</li>
 *   <li>maxWaitMs: 다음 실행 시각이 멀어도 이 시간마다 DataStore를 다시 확인 (기본 60000ms)</li>
 *   <li>maxCatchUp: Schedule 하나가 한 번에 따라잡는 최대 실행 시각 수 (기본 1000)</li>
 * </ul>
 *
 * <p>maxWaitMs는 다른 인스턴스가 추가한 Schedule을 이벤트 없이도 발견하기 위한 상한입니다.
 * 공유 EventBroker를 쓰면 이벤트로 바로 깨어납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param leaseDurationMs 리스 기간 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxWaitMs 최대 대기 시간 (밀리초, 양수)
 * @param maxCatchUp 따라잡기 상한 (1 이상)
 */
public record SchedulerLoopConfig(
    long leaseDurationMs,
    int batchSize,
    long maxWaitMs,
    int maxCatchUp
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: leaseDurationMs=30000ms, batchSize=100, maxWaitMs=60000ms, maxCatchUp=1000</p>
     */
    public SchedulerLoopConfig() {
        this(30000, 100, 60000, FirePlanner.DEFAULT_MAX_CATCH_UP);
    }

    public SchedulerLoopConfig {
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
        if (maxWaitMs <= 0) {
            throw new IllegalArgumentException(
                "maxWaitMs must be positive (current: " + maxWaitMs + ")"
            );
        }
        if (maxCatchUp <= 0) {
            throw new IllegalArgumentException(
                "maxCatchUp must be positive (current: " + maxCatchUp + ")"
            );
        }
    }

    public SchedulerLoopConfig withLeaseDurationMs(long leaseDurationMs) {
        return new SchedulerLoopConfig(leaseDurationMs, batchSize, maxWaitMs, maxCatchUp);
    }

    public SchedulerLoopConfig withBatchSize(int batchSize) {
        return new SchedulerLoopConfig(leaseDurationMs, batchSize, maxWaitMs, maxCatchUp);
    }

    public SchedulerLoopConfig withMaxWaitMs(long maxWaitMs) {
        return new SchedulerLoopConfig(leaseDurationMs, batchSize, maxWaitMs, maxCatchUp);
    }

    public SchedulerLoopConfig withMaxCatchUp(int maxCatchUp) {
        return new SchedulerLoopConfig(leaseDurationMs, batchSize, maxWaitMs, maxCatchUp);
    }

    public Duration leaseDuration() {
        return Duration.ofMillis(leaseDurationMs);
    }
}
