package com.ryuqq.scheduler.core.trigger.cron;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CronFieldParser 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CronFieldParserTest {

    private static final LocalDateTime JAN_1 = LocalDateTime.of(2026, 1, 1, 0, 0);

    @Test
    void parse_StepOverWildcard() {
        // Given
        CronField field = CronFieldParser.parse(CronFieldType.MINUTE, "*/20");

        // When & Then
        assertEquals(OptionalInt.of(20), field.getNextValue(JAN_1.withMinute(1)));
        assertEquals(OptionalInt.of(40), field.getNextValue(JAN_1.withMinute(40)));
        assertTrue(field.getNextValue(JAN_1.withMinute(41)).isEmpty());
    }

    @Test
    void parse_ListOfRanges() {
        // Given
        CronField field = CronFieldParser.parse(CronFieldType.HOUR, "1-3,22");

        // When & Then
        assertEquals(OptionalInt.of(1), field.getNextValue(JAN_1));
        assertEquals(OptionalInt.of(22), field.getNextValue(JAN_1.withHour(4)));
    }

    @Test
    void parse_MonthAndWeekdayNames() {
        // Given
        CronField months = CronFieldParser.parse(CronFieldType.MONTH, "MAR-may");
        CronField weekdays = CronFieldParser.parse(CronFieldType.DAY_OF_WEEK, "sat-mon");

        // When & Then
        assertEquals(OptionalInt.of(3), months.getNextValue(JAN_1));
        // 2026-01-01은 목요일(3): 범위가 토(5)부터 월(0)까지 이어짐
        assertEquals(OptionalInt.of(5), weekdays.getNextValue(JAN_1));
    }

    @Test
    void parse_WeekdayPositionInMonth() {
        // Given
        CronField field = CronFieldParser.parse(CronFieldType.DAY, "2nd tue");

        // When & Then
        // 2026년 1월 두 번째 화요일은 13일
        assertEquals(OptionalInt.of(13), field.getNextValue(JAN_1));
    }

    @Test
    void parse_LastDayOfMonth() {
        // Given
        CronField field = CronFieldParser.parse(CronFieldType.DAY, "last");

        // When & Then
        assertEquals(OptionalInt.of(28), field.getNextValue(LocalDateTime.of(2026, 2, 3, 0, 0)));
    }

    @Test
    void parse_OutOfRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CronFieldParser.parse(CronFieldType.HOUR, "25")
        );
        assertTrue(exception.getMessage().contains("out of range"));
    }

    @Test
    void parse_InvalidExpressions_ThrowException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CronFieldParser.parse(CronFieldType.MINUTE, "5-2"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldParser.parse(CronFieldType.MINUTE, "*/0"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldParser.parse(CronFieldType.HOUR, "mon"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldParser.parse(CronFieldType.SECOND, " "));
        assertThrows(IllegalArgumentException.class, () -> CronFieldParser.parse(CronFieldType.MINUTE, "?"));
    }
}
