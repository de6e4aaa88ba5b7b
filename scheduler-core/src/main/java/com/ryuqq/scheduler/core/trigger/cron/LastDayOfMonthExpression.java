package com.ryuqq.scheduler.core.trigger.cron;

import java.time.LocalDateTime;

/**
 * {@code last}: 달의 마지막 날.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LastDayOfMonthExpression() implements FieldExpression {

    @Override
    public boolean matches(int value, LocalDateTime dateTime) {
        return value == dateTime.toLocalDate().lengthOfMonth();
    }
}
