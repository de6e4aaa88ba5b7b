/**
 * Runner Adapter Layer - Scheduler 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.scheduler.application.scheduler.Scheduler}의 구체적인 구현과
 * 그것을 움직이는 루프들을 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.adapter.runner.DefaultScheduler} - 생명주기와 공개 API</li>
 *   <li>{@link com.ryuqq.scheduler.adapter.runner.ScheduleProcessor} - 도래한 Schedule을 Job으로 변환</li>
 *   <li>{@link com.ryuqq.scheduler.adapter.runner.JobDispatcher} - Job 획득, 실행, 결과 반납</li>
 *   <li>{@link com.ryuqq.scheduler.adapter.runner.DataStoreCleaner} - 만료 결과와 끊긴 Job 정리</li>
 *   <li>{@link com.ryuqq.scheduler.adapter.runner.RetryingDataStore} - 일시적 DataStore 장애 재시도</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultScheduler, ScheduleProcessor, JobDispatcher)
 *   ↓ implements
 * application (Scheduler interface, Runtime)
 *   ↓ depends on
 * core (Task, Schedule, Job, Trigger, FirePlanner)
 *   ↓ depends on
 * core/spi (DataStore, EventBroker, Serializer)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scheduler.adapter.runner;
