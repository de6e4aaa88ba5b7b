package com.ryuqq.scheduler.adapter.runner;

/**
 * DataStore 재시도 설정 (불변 record).
 *
 * <p>{@link RetryingDataStore}가 {@code DataStoreUnavailableException}을 만났을 때
 * 몇 번, 어떤 간격으로 다시 시도할지 정합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 호출을 포함한 최대 시도 횟수 (기본 5)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 (기본 100ms)</li>
 *   <li>maxDelayMs: 재시도 간격 상한 (기본 5000ms)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상, 1이면 재시도 없음)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record DataStoreRetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=5, baseDelayMs=100ms, maxDelayMs=5000ms, jitterFactor=0.1</p>
     */
    public DataStoreRetryConfig() {
        this(5, 100, 5000, 0.1);
    }

    public DataStoreRetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        // 나머지 값은 BackoffCalculator가 검증
        new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 재시도를 하지 않는 설정.
     *
     * @return maxAttempts=1인 설정
     */
    public static DataStoreRetryConfig noRetry() {
        return new DataStoreRetryConfig().withMaxAttempts(1);
    }

    public DataStoreRetryConfig withMaxAttempts(int maxAttempts) {
        return new DataStoreRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public DataStoreRetryConfig withBaseDelayMs(long baseDelayMs) {
        return new DataStoreRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public DataStoreRetryConfig withMaxDelayMs(long maxDelayMs) {
        return new DataStoreRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public DataStoreRetryConfig withJitterFactor(double jitterFactor) {
        return new DataStoreRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 이 설정의 백오프 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator toBackoffCalculator() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }
}
