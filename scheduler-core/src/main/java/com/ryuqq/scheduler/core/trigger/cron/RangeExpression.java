package com.ryuqq.scheduler.core.trigger.cron;

import java.time.LocalDateTime;

/**
 * 범위와 간격 표현식: {@code *}, {@code *}/n, a, a-b, a-b/n, a/n.
 *
 * <p>요일 필드에서만 first &gt; last인 순환 범위(예: sat-mon)를 허용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param first 시작 값
 * @param last 끝 값
 * @param step 간격 (1 이상)
 * @param cycleLength 순환 길이 (순환 범위가 아니면 0)
 */
public record RangeExpression(int first, int last, int step, int cycleLength) implements FieldExpression {

    public RangeExpression {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive (current: " + step + ")");
        }
        if (first > last && cycleLength == 0) {
            throw new IllegalArgumentException(
                "Range start cannot be greater than its end (start: " + first + ", end: " + last + ")"
            );
        }
    }

    @Override
    public boolean matches(int value, LocalDateTime dateTime) {
        if (first <= last) {
            return value >= first && value <= last && (value - first) % step == 0;
        }
        boolean inRange = value >= first || value <= last;
        int offset = Math.floorMod(value - first, cycleLength);
        return inRange && offset % step == 0;
    }
}
