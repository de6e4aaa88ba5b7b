package com.ryuqq.scheduler.application.scheduler;

import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.Subscription;
import com.ryuqq.scheduler.core.statemachine.SchedulerState;
import com.ryuqq.scheduler.core.trigger.Trigger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 스케줄러 공개 API.
 *
 * <p>Task를 등록하고, Trigger로 Schedule을 추가하거나 단발성 Job을 추가하며,
 * 결과를 조회합니다. 같은 DataStore를 공유하는 여러 인스턴스가 동시에 동작할 수 있고,
 * 한 Schedule의 한 실행 시각은 정확히 한 인스턴스만 처리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * scheduler.configureTask(TaskId.of("report"), context -&gt; reportService.run(), new TaskOptions());
 * scheduler.addSchedule(TaskId.of("report"),
 *     CronTrigger.fromCrontab("0 9 * * mon-fri", ZoneId.of("Asia/Seoul")),
 *     new ScheduleOptions().withId(ScheduleId.of("weekday-report")));
 * scheduler.start();
 *
 * Integer sum = scheduler.runJob(TaskId.of("sum"), JobArguments.of(1, 2), Integer.class, Duration.ofSeconds(5));
 * </pre>
 *
 * <p><strong>상태 제약:</strong> Task/Schedule/Job 관리 메서드는 정지 상태에서도 호출할 수 있으며
 * (DataStore에 바로 기록), {@link #runJob}과 결과 대기는 워커 역할로 실행 중일 때 의미가 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Scheduler {

    // ============================================================
    // Tasks
    // ============================================================

    /**
     * 함수를 이 프로세스에 등록하고 Task로 저장.
     *
     * <p>같은 ID의 Task가 있으면 교체합니다. 함수는 이 인스턴스의 워커에서만 해석 가능합니다.</p>
     *
     * @param taskId Task 식별자
     * @param function 실행할 함수
     * @param options Task 옵션
     * @return 저장된 Task
     */
    Task configureTask(TaskId taskId, TaskFunction function, TaskOptions options);

    /**
     * 미리 구성한 Task 저장 (func는 CallableResolver가 해석할 수 있어야 함).
     *
     * @param task 저장할 Task
     */
    void addTask(Task task);

    List<Task> getTasks();

    /**
     * Task 삭제.
     *
     * @param taskId 삭제할 Task
     * @throws com.ryuqq.scheduler.core.exception.TaskLookupException Task가 없는 경우
     */
    void removeTask(TaskId taskId);

    // ============================================================
    // Schedules
    // ============================================================

    /**
     * Schedule 추가.
     *
     * <p>첫 실행 시각은 Trigger로 계산합니다. Trigger가 첫 실행 시각을 만들지 못하면 거부합니다.</p>
     *
     * @param taskId 실행할 Task
     * @param trigger 실행 시각 규칙
     * @param options Schedule 옵션
     * @return Schedule 식별자
     * @throws com.ryuqq.scheduler.core.exception.TaskLookupException Task가 없는 경우
     * @throws com.ryuqq.scheduler.core.exception.ConflictException 정책이 EXCEPTION이고 같은 ID가 있는 경우
     * @throws com.ryuqq.scheduler.core.exception.TriggerExhaustedException 첫 실행 시각이 없는 경우
     */
    ScheduleId addSchedule(TaskId taskId, Trigger trigger, ScheduleOptions options);

    /**
     * Schedule 삭제. 없는 ID는 무시합니다.
     *
     * @param scheduleId 삭제할 Schedule
     */
    void removeSchedule(ScheduleId scheduleId);

    /**
     * Schedule 조회.
     *
     * @param scheduleId 조회할 Schedule
     * @return Schedule
     * @throws com.ryuqq.scheduler.core.exception.ScheduleLookupException 없는 경우
     */
    Schedule getSchedule(ScheduleId scheduleId);

    List<Schedule> getSchedules();

    /**
     * Schedule 일시 정지. 정지된 동안의 실행 시각은 재개 후 misfire/coalesce 규칙으로 처리됩니다.
     *
     * @param scheduleId 정지할 Schedule
     * @throws com.ryuqq.scheduler.core.exception.ScheduleLookupException 없는 경우
     */
    void pauseSchedule(ScheduleId scheduleId);

    void unpauseSchedule(ScheduleId scheduleId);

    // ============================================================
    // Jobs
    // ============================================================

    /**
     * 단발성 Job 추가 (즉시 실행 대상).
     *
     * @param taskId 실행할 Task
     * @param arguments 인자
     * @param options Job 옵션
     * @return Job 식별자
     * @throws com.ryuqq.scheduler.core.exception.TaskLookupException Task가 없는 경우
     */
    JobId addJob(TaskId taskId, JobArguments arguments, JobOptions options);

    /**
     * Job 결과 조회 (대기하지 않음, 1회성).
     *
     * @param jobId 조회할 Job
     * @return 결과 (아직 끝나지 않았으면 empty)
     * @throws com.ryuqq.scheduler.core.exception.JobLookupException Job도 결과도 없는 경우
     */
    Optional<JobResult> getJobResult(JobId jobId);

    /**
     * Job이 끝날 때까지 대기 후 결과 조회.
     *
     * @param jobId 대기할 Job
     * @param timeout 최대 대기 시간
     * @return 결과 (시간 내에 끝나지 않았거나 결과를 보관하지 않는 Job이면 empty)
     * @throws com.ryuqq.scheduler.core.exception.JobLookupException Job도 결과도 없는 경우
     */
    Optional<JobResult> awaitJobResult(JobId jobId, Duration timeout);

    /**
     * Job을 추가하고 완료까지 대기한 뒤 반환값을 디코딩.
     *
     * @param taskId 실행할 Task
     * @param arguments 인자
     * @param resultType 반환값 타입
     * @param timeout 최대 대기 시간
     * @param <T> 반환값 타입
     * @return 디코딩된 반환값 (함수가 null을 반환했으면 null)
     * @throws com.ryuqq.scheduler.core.exception.JobExecutionException SUCCESS가 아닌 경우
     * @throws com.ryuqq.scheduler.core.exception.JobTimeoutException 시간 내에 끝나지 않은 경우
     */
    <T> T runJob(TaskId taskId, JobArguments arguments, Class<T> resultType, Duration timeout);

    /**
     * Job 취소 (협조적).
     *
     * <p>대기 중인 Job은 바로 CANCELLED가 되고, 이 인스턴스에서 실행 중인 Job에는
     * 인터럽트를 보냅니다. 함수가 인터럽트에 반응하지 않으면 끝까지 실행됩니다.</p>
     *
     * @param jobId 취소할 Job
     * @return 취소 요청이 전달되었으면 true
     */
    boolean cancelJob(JobId jobId);

    /**
     * 결과의 반환값 디코딩.
     *
     * @param result SUCCESS 결과
     * @param type 반환값 타입
     * @param <T> 반환값 타입
     * @return 디코딩된 값 (반환값이 없으면 null)
     * @throws com.ryuqq.scheduler.core.exception.JobExecutionException SUCCESS가 아닌 경우
     */
    <T> T decodeReturnValue(JobResult result, Class<T> type);

    // ============================================================
    // Events / lifecycle
    // ============================================================

    /**
     * 이벤트 구독.
     *
     * @param callback 이벤트 콜백
     * @param topics 구독할 토픽 (비어 있으면 전체)
     * @return 구독 핸들
     */
    Subscription subscribe(Consumer<? super Event> callback, Set<EventTopic> topics);

    /**
     * 시작. STOPPED에서만 호출할 수 있습니다.
     *
     * @throws IllegalStateException STOPPED가 아닌 경우
     */
    void start();

    /**
     * 정상 종료 (실행 중인 Job 완료와 리스 반납 후 종료).
     */
    void stop();

    /**
     * 종료.
     *
     * @param graceful false이면 실행 중인 Job에 인터럽트를 보내고 리스는 만료되도록 둠
     */
    void stop(boolean graceful);

    SchedulerState getState();

    InstanceId getInstanceId();
}
