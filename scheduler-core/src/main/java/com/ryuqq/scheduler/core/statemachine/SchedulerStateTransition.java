package com.ryuqq.scheduler.core.statemachine;

/**
 * 스케줄러 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>STOPPED → STARTING</li>
 *   <li>STARTING → RUNNING, STARTING → STOPPING</li>
 *   <li>RUNNING → STOPPING</li>
 *   <li>STOPPING → STOPPED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SchedulerStateTransition {

    private SchedulerStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SchedulerState from, SchedulerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case STOPPED -> to == SchedulerState.STARTING;
            case STARTING -> to == SchedulerState.RUNNING || to == SchedulerState.STOPPING;
            case RUNNING -> to == SchedulerState.STOPPING;
            case STOPPING -> to == SchedulerState.STOPPED;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid scheduler state transition: %s → %s", from, to)
            );
        }
    }

    public static SchedulerState transition(SchedulerState current, SchedulerState next) {
        validate(current, next);
        return next;
    }
}
