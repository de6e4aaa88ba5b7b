/**
 * 스케줄러 공개 API.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.application.scheduler.Scheduler} - Task/Schedule/Job 관리와 생명주기</li>
 *   <li>{@link com.ryuqq.scheduler.application.scheduler.TaskOptions},
 *       {@link com.ryuqq.scheduler.application.scheduler.ScheduleOptions},
 *       {@link com.ryuqq.scheduler.application.scheduler.JobOptions} - 호출 옵션</li>
 *   <li>{@link com.ryuqq.scheduler.application.scheduler.SchedulerRole} - 인스턴스 역할</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code DefaultScheduler}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.scheduler.application.scheduler;
