package com.ryuqq.scheduler.core.model;

import com.ryuqq.scheduler.core.statemachine.JobStatus;
import com.ryuqq.scheduler.core.trigger.IntervalTrigger;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Job, Schedule, Task 모델 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JobTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final TaskId TASK_ID = TaskId.of("report");

    @Test
    void create_PendingWithoutLease() {
        // When
        Job job = Job.create(TASK_ID, null, null, T0);

        // Then
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(Payload.empty(), job.args());
        assertEquals(Duration.ZERO, job.resultExpirationTime());
        assertNull(job.scheduleId());
        assertFalse(job.leaseLiveAt(T0));
    }

    @Test
    void forSchedule_CopiesScheduleSettings() {
        // Given
        Schedule schedule = Schedule.of(ScheduleId.of("hourly"), TASK_ID,
                IntervalTrigger.every(Duration.ofHours(1), T0), T0)
            .withArgs(Payload.of(new byte[]{1}))
            .withJobResultExpirationTime(Duration.ofMinutes(10));

        // When
        Job job = Job.forSchedule(schedule, T0, T0.plusSeconds(30), T0.plusSeconds(1));

        // Then
        assertEquals(ScheduleId.of("hourly"), job.scheduleId());
        assertEquals(T0, job.scheduledFireTime());
        assertEquals(Payload.of(new byte[]{1}), job.args());
        assertEquals(Duration.ofMinutes(10), job.resultExpirationTime());
        assertFalse(job.deadlinePassedAt(T0.plusSeconds(30)));
        assertTrue(job.deadlinePassedAt(T0.plusSeconds(31)));
    }

    @Test
    void withStatus_InvalidTransition_ThrowsException() {
        // Given
        Job job = Job.create(TASK_ID, null, null, T0);

        // When & Then
        assertThrows(IllegalStateException.class, () -> job.withStatus(JobStatus.SUCCESS));
        assertEquals(JobStatus.MISSED, job.withStatus(JobStatus.MISSED).status());
    }

    @Test
    void withLease_HalfSetLease_ThrowsException() {
        // Given
        Job job = Job.create(TASK_ID, null, null, T0);

        // When
        Job leased = job.withLease(InstanceId.of("worker-1"), T0.plusSeconds(30));

        // Then
        assertTrue(leased.leaseLiveAt(T0.plusSeconds(29)));
        assertFalse(leased.leaseLiveAt(T0.plusSeconds(30)));
        assertThrows(IllegalArgumentException.class, () -> job.withLease(InstanceId.of("worker-1"), null));
    }

    @Test
    void schedule_DueOnlyWhenNotPausedAndTimeReached() {
        // Given
        Schedule schedule = Schedule.of(ScheduleId.of("hourly"), TASK_ID,
            IntervalTrigger.every(Duration.ofHours(1), T0), T0);

        // Then
        assertTrue(schedule.dueAt(T0));
        assertFalse(schedule.dueAt(T0.minusMillis(1)));
        assertFalse(schedule.withPaused(true).dueAt(T0));
        assertFalse(schedule.withFireTimes(null, T0).dueAt(T0));
    }

    @Test
    void schedule_NegativeDurations_ThrowException() {
        // Given
        Schedule schedule = Schedule.of(ScheduleId.of("hourly"), TASK_ID,
            IntervalTrigger.every(Duration.ofHours(1), T0), T0);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> schedule.withMisfireGraceTime(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> schedule.withJobResultExpirationTime(Duration.ofSeconds(-1)));
        assertEquals(CoalescePolicy.LATEST, schedule.coalesce());
    }

    @Test
    void task_DefaultsAndValidation() {
        // When
        Task task = Task.of(TASK_ID, CallableRef.of("com.acme.Reports::daily"));

        // Then
        assertEquals(Task.DEFAULT_EXECUTOR, task.executor());
        assertNull(task.maxRunningJobs());
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> task.withMaxRunningJobs(0)
        );
        assertTrue(exception.getMessage().contains("maxRunningJobs must be positive"));
        assertThrows(IllegalArgumentException.class, () -> task.withExecutor(" "));
        assertThrows(IllegalArgumentException.class, () -> CallableRef.of(""));
    }
}
