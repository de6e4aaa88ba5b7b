package com.ryuqq.scheduler.core.trigger;

import com.ryuqq.scheduler.core.exception.MaxIterationsReachedException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AndTrigger, OrTrigger 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CombiningTriggerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void and_DailyAndWeekdayCron_FiresOnWeekdaysOnly() {
        // Given
        AndTrigger trigger = AndTrigger.of(
            CalendarIntervalTrigger.daily(LocalTime.of(9, 0), LocalDate.of(2026, 1, 1), ZoneOffset.UTC),
            CronTrigger.fromCrontab("0 9 * * mon-fri", ZoneOffset.UTC)
        );
        Instant endOfMonth = Instant.parse("2026-02-01T00:00:00Z");

        // When
        List<Instant> fireTimes = new ArrayList<>();
        Optional<Instant> next = trigger.next(null, NOW);
        while (next.isPresent() && next.get().isBefore(endOfMonth)) {
            fireTimes.add(next.get());
            next = trigger.next(next.get(), NOW);
        }

        // Then
        assertEquals(22, fireTimes.size());
        for (Instant fireTime : fireTimes) {
            ZonedDateTime local = fireTime.atZone(ZoneOffset.UTC);
            assertEquals(LocalTime.of(9, 0), local.toLocalTime());
            assertNotEquals(DayOfWeek.SATURDAY, local.getDayOfWeek());
            assertNotEquals(DayOfWeek.SUNDAY, local.getDayOfWeek());
        }
    }

    @Test
    void and_AnyTriggerExhausted_ReturnsEmpty() {
        // Given
        AndTrigger trigger = AndTrigger.of(
            IntervalTrigger.every(Duration.ofHours(1), NOW),
            new DateTrigger(NOW.plusSeconds(7200))
        );

        // When
        Instant only = trigger.next(null, NOW).orElseThrow();

        // Then
        assertEquals(NOW.plusSeconds(7200), only);
        assertTrue(trigger.next(only, NOW).isEmpty());
    }

    @Test
    void and_WithinThreshold_ReturnsEarliest() {
        // Given
        AndTrigger trigger = new AndTrigger(List.of(
            new DateTrigger(NOW.plusSeconds(10)),
            new DateTrigger(NOW.plusSeconds(12))
        ), Duration.ofSeconds(5), 10);

        // When & Then
        assertEquals(Optional.of(NOW.plusSeconds(10)), trigger.next(null, NOW));
    }

    @Test
    void and_NeverAligned_ThrowsMaxIterationsReached() {
        // Given
        AndTrigger trigger = new AndTrigger(List.of(
            IntervalTrigger.every(Duration.ofHours(2), NOW),
            IntervalTrigger.every(Duration.ofHours(2), NOW.plusSeconds(3600))
        ), Duration.ZERO, 50);

        // When & Then
        assertThrows(MaxIterationsReachedException.class, () -> trigger.next(null, NOW));
    }

    @Test
    void or_ReturnsEarliestOfAll() {
        // Given
        OrTrigger trigger = OrTrigger.of(
            IntervalTrigger.every(Duration.ofHours(3), NOW),
            IntervalTrigger.every(Duration.ofHours(2), NOW)
        );

        // When
        List<Instant> fireTimes = new ArrayList<>();
        Instant previous = null;
        for (int i = 0; i < 5; i++) {
            previous = trigger.next(previous, NOW).orElseThrow();
            fireTimes.add(previous);
        }

        // Then
        assertEquals(List.of(NOW, NOW.plusSeconds(7200), NOW.plusSeconds(10800),
            NOW.plusSeconds(14400), NOW.plusSeconds(21600)), fireTimes);
    }

    @Test
    void or_AllExhausted_ReturnsEmpty() {
        // Given
        OrTrigger trigger = OrTrigger.of(new DateTrigger(NOW), new DateTrigger(NOW.plusSeconds(60)));

        // When & Then
        assertEquals(Optional.of(NOW.plusSeconds(60)), trigger.next(NOW, NOW));
        assertTrue(trigger.next(NOW.plusSeconds(60), NOW).isEmpty());
    }

    @Test
    void constructor_EmptyTriggers_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new OrTrigger(List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new AndTrigger(List.of(new DateTrigger(NOW)), Duration.ofSeconds(1), 0));
    }
}
