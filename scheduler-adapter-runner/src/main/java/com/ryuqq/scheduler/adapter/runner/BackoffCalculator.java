package com.ryuqq.scheduler.adapter.runner;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>DataStore가 일시적으로 응답하지 않을 때 재시도 간격을 지수적으로 늘립니다.
 * 여러 스케줄러 인스턴스가 같은 DataStore를 동시에 재시도하지 않도록 Jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, maxDelay=5000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 100-110ms</li>
 *   <li>attempt=3: 400-440ms</li>
 *   <li>attempt=8: 5000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성 ({@link DataStoreRetryConfig} 기본값과 동일).
     */
    public BackoffCalculator() {
        this(100, 5000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // shift가 63을 넘으면 overflow
        int shift = Math.min(attempt - 1, 62);
        long multiplier = 1L << shift;
        long exponential = multiplier > maxDelayMs / baseDelayMs
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    /**
     * {@link #calculate(int)}의 Duration 버전.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 대기 시간
     */
    public Duration delayFor(int attempt) {
        return Duration.ofMillis(calculate(attempt));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
