package com.ryuqq.scheduler.core.scheduling;

import java.time.Instant;

/**
 * Job으로 만들어질 실행 시각 하나.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param fireTime 예정 실행 시각
 * @param startDeadline 시작 마감 시각 (null이면 무제한)
 * @param missed 계산 시점에 이미 마감 시각을 넘겼으면 true
 */
public record FireOccurrence(Instant fireTime, Instant startDeadline, boolean missed) {

    public FireOccurrence {
        if (fireTime == null) {
            throw new IllegalArgumentException("fireTime cannot be null");
        }
    }
}
