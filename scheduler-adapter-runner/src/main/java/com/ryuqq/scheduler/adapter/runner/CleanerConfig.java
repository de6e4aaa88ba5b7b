package com.ryuqq.scheduler.adapter.runner;

/**
 * DataStore 정리 주기 설정 (불변 record).
 *
 * <p>만료된 Job 결과 삭제와 리스가 끊긴 Job 회수를 얼마나 자주 할지 정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param cleanupIntervalMs 정리 주기 (밀리초, 양수, 기본 900000ms = 15분)
 */
public record CleanerConfig(long cleanupIntervalMs) {

    public CleanerConfig() {
        this(900000);
    }

    public CleanerConfig {
        if (cleanupIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "cleanupIntervalMs must be positive (current: " + cleanupIntervalMs + ")"
            );
        }
    }

    public CleanerConfig withCleanupIntervalMs(long cleanupIntervalMs) {
        return new CleanerConfig(cleanupIntervalMs);
    }
}
