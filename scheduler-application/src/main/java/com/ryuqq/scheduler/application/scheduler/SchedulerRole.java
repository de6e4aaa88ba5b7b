package com.ryuqq.scheduler.application.scheduler;

/**
 * 스케줄러 인스턴스가 수행하는 역할.
 *
 * <ul>
 *   <li>SCHEDULER: Schedule 처리 루프만 실행 (Job 생성)</li>
 *   <li>WORKER: 워커 디스패치 루프만 실행 (Job 실행)</li>
 *   <li>BOTH: 두 루프 모두 실행 (기본값)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SchedulerRole {

    SCHEDULER,
    WORKER,
    BOTH;

    public boolean processesSchedules() {
        return this != WORKER;
    }

    public boolean processesJobs() {
        return this != SCHEDULER;
    }
}
