package com.ryuqq.scheduler.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 식별자 Value Object 테스트 (TaskId, ScheduleId, JobId).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskIdTest {

    @Test
    void of_ValidValue_CreatesTaskId() {
        // When
        TaskId taskId = TaskId.of("billing.send-invoice");

        // Then
        assertEquals("billing.send-invoice", taskId.getValue());
        assertEquals(TaskId.of("billing.send-invoice"), taskId);
        assertEquals(TaskId.of("billing.send-invoice").hashCode(), taskId.hashCode());
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TaskId.of("  ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
        assertThrows(IllegalArgumentException.class, () -> TaskId.of(null));
    }

    @Test
    void of_WhitespaceInside_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TaskId.of("send invoice"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // Given
        String value = "t".repeat(256);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TaskId.of(value));
        assertDoesNotThrow(() -> TaskId.of("t".repeat(255)));
    }

    @Test
    void generate_ProducesDistinctIds() {
        // When
        JobId first = JobId.generate();
        JobId second = JobId.generate();

        // Then
        assertNotEquals(first, second);
        assertFalse(first.getValue().isBlank());
    }

    @Test
    void scheduleId_EqualsByValue() {
        // Then
        assertEquals(ScheduleId.of("nightly"), ScheduleId.of("nightly"));
        assertNotEquals(ScheduleId.of("nightly"), ScheduleId.of("hourly"));
    }
}
