package com.ryuqq.scheduler.core.trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 고정 간격 실행.
 *
 * <p><strong>기준 시각(start)이 있는 경우:</strong> 실행 시각은 {@code start + k * period} 격자 위에
 * 놓이며, 다음 실행 시각은 직전 시각 이후의 첫 격자점입니다. 격자 위의 직전 시각이라면
 * 결과는 {@code previous + period}와 같습니다.</p>
 *
 * <p><strong>기준 시각이 없는 경우:</strong> 첫 실행 시각은 now이고,
 * 이후로는 {@code previous + period}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param period 실행 간격 (양수)
 * @param start 격자 기준 시각 (null 가능)
 * @param end 마지막 허용 시각 (null이면 무제한)
 */
public record IntervalTrigger(Duration period, Instant start, Instant end) implements Trigger {

    public IntervalTrigger {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive (current: " + period + ")");
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException(
                "end cannot be before start (start: " + start + ", end: " + end + ")"
            );
        }
    }

    /**
     * 기준 시각 없이 생성.
     *
     * @param period 실행 간격
     * @return IntervalTrigger 인스턴스
     */
    public static IntervalTrigger every(Duration period) {
        return new IntervalTrigger(period, null, null);
    }

    /**
     * 기준 시각을 지정하여 생성.
     *
     * @param period 실행 간격
     * @param start 격자 기준 시각
     * @return IntervalTrigger 인스턴스
     */
    public static IntervalTrigger every(Duration period, Instant start) {
        return new IntervalTrigger(period, start, null);
    }

    @Override
    public Optional<Instant> next(Instant previousFireTime, Instant now) {
        Instant candidate;
        if (previousFireTime == null) {
            candidate = start != null ? start : now;
        } else if (start == null) {
            candidate = previousFireTime.plus(period);
        } else if (previousFireTime.isBefore(start)) {
            candidate = start;
        } else {
            long steps = Duration.between(start, previousFireTime).dividedBy(period) + 1;
            candidate = start.plus(period.multipliedBy(steps));
        }

        if (end != null && candidate.isAfter(end)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
