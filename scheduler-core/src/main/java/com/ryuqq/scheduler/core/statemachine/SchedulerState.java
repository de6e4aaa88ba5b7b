package com.ryuqq.scheduler.core.statemachine;

/**
 * 스케줄러 인스턴스의 실행 상태.
 *
 * <pre>
 * STOPPED ─► STARTING ─► RUNNING ─► STOPPING ─► STOPPED
 *                └──────────────────────┘ (시작 실패)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SchedulerState {

    STOPPED,

    STARTING,

    RUNNING,

    STOPPING;

    /**
     * 작업을 처리할 수 있는 상태인지 확인.
     *
     * @return RUNNING인 경우 true
     */
    public boolean isActive() {
        return this == RUNNING;
    }
}
