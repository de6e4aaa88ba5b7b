package com.ryuqq.scheduler.application.scheduler;

import java.time.Duration;

/**
 * 단발성 Job 추가 옵션 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param resultExpirationTime 결과 보관 기간 (0이면 결과를 저장하지 않음)
 */
public record JobOptions(Duration resultExpirationTime) {

    /**
     * 기본 설정 생성자 (결과 보관 안 함).
     */
    public JobOptions() {
        this(Duration.ZERO);
    }

    public JobOptions {
        if (resultExpirationTime == null || resultExpirationTime.isNegative()) {
            throw new IllegalArgumentException(
                "resultExpirationTime cannot be null or negative (current: " + resultExpirationTime + ")"
            );
        }
    }

    /**
     * 결과를 주어진 기간 동안 보관하는 옵션.
     *
     * @param resultExpirationTime 보관 기간
     * @return JobOptions 인스턴스
     */
    public static JobOptions retainingResultFor(Duration resultExpirationTime) {
        return new JobOptions(resultExpirationTime);
    }
}
