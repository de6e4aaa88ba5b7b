package com.ryuqq.scheduler.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.scheduler.core.statemachine.SchedulerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SchedulerStateTransition 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SchedulerStateTransitionTest {

    @Test
    void transition_FullLifecycle_Succeeds() {
        // Given
        SchedulerState state = STOPPED;

        // When
        state = SchedulerStateTransition.transition(state, STARTING);
        state = SchedulerStateTransition.transition(state, RUNNING);
        assertTrue(state.isActive());
        state = SchedulerStateTransition.transition(state, STOPPING);
        state = SchedulerStateTransition.transition(state, STOPPED);

        // Then
        assertEquals(STOPPED, state);
        assertFalse(state.isActive());
    }

    @Test
    void validate_StartingToStopping_Succeeds() {
        // 시작 실패 시 경로
        assertDoesNotThrow(() -> SchedulerStateTransition.validate(STARTING, STOPPING));
    }

    @Test
    void validate_RunningToStarting_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> SchedulerStateTransition.transition(RUNNING, STARTING)
        );
        assertTrue(exception.getMessage().contains("RUNNING"));
    }

    @Test
    void validate_StoppedToRunning_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> SchedulerStateTransition.validate(STOPPED, RUNNING));
        assertThrows(IllegalStateException.class, () -> SchedulerStateTransition.validate(STOPPING, RUNNING));
        assertThrows(IllegalStateException.class, () -> SchedulerStateTransition.validate(STOPPED, STOPPING));
    }
}
