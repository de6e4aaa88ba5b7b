package com.ryuqq.scheduler.core.spi;

import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 스케줄링 상태 저장소 SPI (리스 프로토콜).
 *
 * <p>여러 스케줄러 프로세스가 하나의 DataStore를 공유하며, 리스(lease)를 통해
 * 같은 Schedule의 같은 실행 시각이 두 번 처리되지 않도록 보장합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Task, Schedule, Job, JobResult 영속화</li>
 *   <li>도래한 Schedule과 대기 중인 Job의 원자적 획득 (리스 부여)</li>
 *   <li>리스 소유 여부를 조건으로 한 반납과 연장</li>
 *   <li>Task별 동시 실행 상한 적용</li>
 *   <li>상태 변화 이벤트 발행</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>모든 메서드는 같은 백엔드를 공유하는 동시 호출자에 대해 원자적이어야 함</li>
 *   <li>리스 비교에는 DataStore의 시계가 기준 (호출자 시계 아님)</li>
 *   <li>일시적 백엔드 장애는 {@link com.ryuqq.scheduler.core.exception.DataStoreUnavailableException}으로 알림</li>
 * </ul>
 *
 * <p><strong>사용 예시 (스케줄러 루프):</strong></p>
 * <pre>
 * List&lt;Schedule&gt; schedules = dataStore.acquireSchedules(instanceId, Duration.ofSeconds(30), 100);
 * List&lt;ScheduleUpdate&gt; updates = new ArrayList&lt;&gt;();
 * for (Schedule schedule : schedules) {
 *     // 실행 시각 계산 후 Job 추가
 *     dataStore.addJob(job);
 *     updates.add(new ScheduleUpdate(schedule.id(), nextFireTime, lastFireTime));
 * }
 * dataStore.releaseSchedules(instanceId, updates);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DataStore {

    /**
     * 저장소 시작. 상태 변화 이벤트는 주어진 EventBroker로 발행됩니다.
     *
     * @param eventBroker 이벤트 발행 대상
     */
    void start(EventBroker eventBroker);

    /**
     * 저장소 중지.
     */
    void stop();

    /**
     * Task 등록 (같은 ID가 있으면 교체).
     *
     * @param task 등록할 Task
     */
    void addTask(Task task);

    Optional<Task> getTask(TaskId taskId);

    List<Task> getTasks();

    /**
     * Task 삭제.
     *
     * @param taskId 삭제할 Task
     * @throws com.ryuqq.scheduler.core.exception.TaskLookupException Task가 없는 경우
     */
    void removeTask(TaskId taskId);

    /**
     * Schedule 추가.
     *
     * @param schedule 추가할 Schedule
     * @param conflictPolicy 같은 ID가 있을 때의 처리 정책
     * @throws com.ryuqq.scheduler.core.exception.ConflictException 정책이 EXCEPTION이고 같은 ID가 있는 경우
     */
    void addSchedule(Schedule schedule, ConflictPolicy conflictPolicy);

    /**
     * Schedule 삭제. 존재하지 않는 ID는 무시합니다.
     *
     * @param scheduleIds 삭제할 Schedule 목록
     */
    void removeSchedules(Collection<ScheduleId> scheduleIds);

    List<Schedule> getSchedules();

    /**
     * 주어진 ID의 Schedule 조회. 존재하지 않는 ID는 결과에서 빠집니다.
     *
     * @param scheduleIds 조회할 Schedule 목록
     * @return 조회된 Schedule
     */
    List<Schedule> getSchedules(Collection<ScheduleId> scheduleIds);

    /**
     * 도래한 Schedule을 원자적으로 획득.
     *
     * <p>일시 정지되지 않았고, nextFireTime이 현재 시각 이전이며, 유효한 리스가 없는
     * Schedule을 nextFireTime 순으로 최대 limit개까지 획득합니다.</p>
     *
     * @param schedulerId 획득하는 스케줄러
     * @param leaseDuration 리스 기간
     * @param limit 최대 개수
     * @return 리스가 설정된 Schedule 목록
     */
    List<Schedule> acquireSchedules(InstanceId schedulerId, Duration leaseDuration, int limit);

    /**
     * 처리한 Schedule 반납.
     *
     * <p>nextFireTime이 null인 Schedule은 삭제됩니다. 리스를 더 이상 소유하지 않는 항목은
     * 적용되지 않으며, 나머지를 적용한 뒤 예외로 알립니다.</p>
     *
     * @param schedulerId 반납하는 스케줄러
     * @param updates 반납 내용
     * @throws com.ryuqq.scheduler.core.exception.LeaseExpiredException 리스를 잃은 항목이 있는 경우
     */
    void releaseSchedules(InstanceId schedulerId, List<ScheduleUpdate> updates);

    /**
     * Schedule 리스 연장 (하트비트).
     *
     * @throws com.ryuqq.scheduler.core.exception.LeaseExpiredException 리스를 잃은 항목이 있는 경우
     */
    void extendScheduleLeases(InstanceId schedulerId, Collection<ScheduleId> scheduleIds, Duration leaseDuration);

    /**
     * 다음으로 처리해야 할 시각.
     *
     * <p>다른 인스턴스가 리스를 가진 Schedule은 리스 만료 시각 이후로 계산합니다.</p>
     *
     * @return 가장 이른 처리 시각 (대상이 없으면 empty)
     */
    Optional<Instant> getNextScheduleRunTime();

    /**
     * Job 추가.
     *
     * <p>MISSED 상태로 전달된 Job은 대기열에 넣지 않고 MISSED 결과만 기록합니다.</p>
     *
     * @param job PENDING 또는 MISSED 상태의 Job
     */
    void addJob(Job job);

    List<Job> getJobs();

    List<Job> getJobs(Collection<JobId> jobIds);

    /**
     * 대기 중인 Job을 원자적으로 획득하여 RUNNING으로 전이.
     *
     * <p>생성 순으로 획득하며, Task의 maxRunningJobs 상한을 백엔드 전체 기준으로 지킵니다.
     * 리스가 만료된 RUNNING Job(워커 유실)은 먼저 FAILURE로 종료합니다.</p>
     *
     * @param workerId 획득하는 워커
     * @param leaseDuration 리스 기간
     * @param limit 최대 개수
     * @return 획득한 Job 목록
     */
    List<Job> acquireJobs(InstanceId workerId, Duration leaseDuration, int limit);

    /**
     * Job 리스 연장 (하트비트).
     *
     * @throws com.ryuqq.scheduler.core.exception.LeaseExpiredException 리스를 잃은 항목이 있는 경우
     */
    void extendJobLeases(InstanceId workerId, Collection<JobId> jobIds, Duration leaseDuration);

    /**
     * 실행이 끝난 Job 반납.
     *
     * @param workerId 반납하는 워커
     * @param taskId Job의 Task (동시 실행 카운트 갱신용)
     * @param result 실행 결과
     * @throws com.ryuqq.scheduler.core.exception.LeaseExpiredException 워커가 더 이상 Job을 소유하지 않는 경우
     */
    void releaseJob(InstanceId workerId, TaskId taskId, JobResult result);

    /**
     * 대기 중인 Job 취소.
     *
     * @param jobId 취소할 Job
     * @return PENDING 상태였고 취소되었으면 true
     */
    boolean cancelJob(JobId jobId);

    /**
     * Job 결과 조회 (1회성: 조회한 결과는 삭제됨).
     *
     * @param jobId 조회할 Job
     * @return 만료되지 않은 결과 (없으면 empty)
     */
    Optional<JobResult> getJobResult(JobId jobId);

    /**
     * 만료된 결과 삭제와 유실된 Job 정리.
     */
    void cleanup();
}
