package com.ryuqq.scheduler.core.trigger.cron;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * 달 안에서 n번째 요일 또는 마지막 요일: {@code 2nd mon}, {@code last fri}.
 *
 * <p>해당 달에 n번째 요일이 없으면(예: 5번째 월요일) 그 달은 일치하는 날이 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param ordinal 1~5 (0이면 마지막)
 * @param dayOfWeek 요일
 */
public record WeekdayPositionExpression(int ordinal, DayOfWeek dayOfWeek) implements FieldExpression {

    public WeekdayPositionExpression {
        if (ordinal < 0 || ordinal > 5) {
            throw new IllegalArgumentException("ordinal must be between 0 and 5 (current: " + ordinal + ")");
        }
        if (dayOfWeek == null) {
            throw new IllegalArgumentException("dayOfWeek cannot be null");
        }
    }

    @Override
    public boolean matches(int value, LocalDateTime dateTime) {
        LocalDate monthStart = dateTime.toLocalDate().withDayOfMonth(1);
        LocalDate target = ordinal == 0
            ? monthStart.with(TemporalAdjusters.lastInMonth(dayOfWeek))
            : monthStart.with(TemporalAdjusters.dayOfWeekInMonth(ordinal, dayOfWeek));
        return target.getMonth() == monthStart.getMonth() && target.getDayOfMonth() == value;
    }
}
