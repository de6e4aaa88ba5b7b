package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.adapter.inmemory.store.InMemoryDataStore;
import com.ryuqq.scheduler.adapter.serialization.JsonSerializer;
import com.ryuqq.scheduler.core.exception.CallableResolutionException;
import com.ryuqq.scheduler.core.exception.TaskLookupException;
import com.ryuqq.scheduler.core.executor.JobExecutor;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.CallableRef;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Payload;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.statemachine.JobStatus;
import com.ryuqq.scheduler.testkit.MutableClock;
import com.ryuqq.scheduler.testkit.RecordingEventBroker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JobDispatcher 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>SUCCESS / FAILURE / MISSED / CANCELLED 결과 반납</li>
 *   <li>시작 불가 사유 (Task 없음, 실행기 없음)</li>
 *   <li>동시 실행 한도와 리스 연장</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JobDispatcherTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final InstanceId WORKER = InstanceId.of("worker-a");
    private static final Duration KEEP = Duration.ofHours(1);

    private MutableClock clock;
    private InMemoryDataStore dataStore;
    private JsonSerializer serializer;
    private RegistryCallableResolver registry;
    private WorkerConfig config;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        dataStore = new InMemoryDataStore(clock);
        dataStore.start(new RecordingEventBroker());
        serializer = new JsonSerializer();
        registry = new RegistryCallableResolver();
        config = new WorkerConfig();

        register("sum", context -> (Integer) context.arguments().positionalAt(0)
            + (Integer) context.arguments().positionalAt(1));
        register("boom", context -> {
            throw new IllegalStateException("report generation failed");
        });
        register("nothing", context -> null);
    }

    private void register(String taskId, TaskFunction function) {
        Task task = Task.of(TaskId.of(taskId), RegistryCallableResolver.refFor(TaskId.of(taskId)));
        registry.register(task.func(), function);
        dataStore.addTask(task);
    }

    private JobDispatcher dispatcher(JobExecutor executor) {
        return new JobDispatcher(dataStore, WORKER, clock, config, Map.of(executor.name(), executor),
            registry, serializer);
    }

    private JobId addJob(String taskId, JobArguments arguments) {
        Payload args = Payload.of(serializer.serialize(arguments));
        Job job = Job.create(TaskId.of(taskId), args, KEEP, clock.instant());
        dataStore.addJob(job);
        return job.id();
    }

    private JobResult resultOf(JobId jobId) {
        return dataStore.getJobResult(jobId).orElseThrow();
    }

    // ============================================================
    // 1. 실행 결과
    // ============================================================

    @Test
    void 성공한_Job은_반환값과_함께_SUCCESS로_반납됨() {
        // given
        JobId jobId = addJob("sum", JobArguments.of(1, 2));

        // when
        dispatcher(new ManualJobExecutor(true)).pump();

        // then
        JobResult result = resultOf(jobId);
        assertThat(result.status()).isEqualTo(JobStatus.SUCCESS);
        assertThat(serializer.deserialize(result.returnValue().getBytes(), Integer.class)).isEqualTo(3);
        assertThat(result.startedAt()).isEqualTo(T0);
        assertThat(dataStore.getJobs()).isEmpty();
    }

    @Test
    void null을_반환한_Job은_반환값_없이_SUCCESS임() {
        // given
        JobId jobId = addJob("nothing", JobArguments.none());

        // when
        dispatcher(new ManualJobExecutor(true)).pump();

        // then
        JobResult result = resultOf(jobId);
        assertThat(result.status()).isEqualTo(JobStatus.SUCCESS);
        assertThat(result.returnValue()).isNull();
    }

    @Test
    void 예외를_던진_Job은_FAILURE로_반납되고_재시도하지_않음() {
        // given
        JobId jobId = addJob("boom", JobArguments.none());
        JobDispatcher dispatcher = dispatcher(new ManualJobExecutor(true));

        // when
        dispatcher.pump();
        dispatcher.pump();

        // then
        JobResult result = resultOf(jobId);
        assertThat(result.status()).isEqualTo(JobStatus.FAILURE);
        assertThat(result.error().exceptionType()).isEqualTo(IllegalStateException.class.getName());
        assertThat(result.error().message()).isEqualTo("report generation failed");
        assertThat(dataStore.getJobs()).isEmpty();
    }

    @Test
    void 시작_마감이_지난_Job은_실행하지_않고_MISSED로_반납됨() {
        // given
        Job job = new Job(JobId.generate(), TaskId.of("sum"), Payload.empty(), null, null,
            T0.plusSeconds(10), KEEP, T0, JobStatus.PENDING, null, null);
        dataStore.addJob(job);
        clock.advance(Duration.ofSeconds(20));
        ManualJobExecutor executor = new ManualJobExecutor(false);

        // when
        dispatcher(executor).pump();

        // then
        assertThat(resultOf(job.id()).status()).isEqualTo(JobStatus.MISSED);
        assertThat(executor.pendingCount()).isZero();
    }

    // ============================================================
    // 2. 시작할 수 없는 Job
    // ============================================================

    @Test
    void Task가_삭제된_Job은_FAILURE로_반납됨() {
        // given
        JobId jobId = addJob("sum", JobArguments.of(1, 2));
        dataStore.removeTask(TaskId.of("sum"));

        // when
        dispatcher(new ManualJobExecutor(true)).pump();

        // then
        JobResult result = resultOf(jobId);
        assertThat(result.status()).isEqualTo(JobStatus.FAILURE);
        assertThat(result.error().exceptionType()).isEqualTo(TaskLookupException.class.getName());
    }

    @Test
    void 알_수_없는_실행기를_쓰는_Task의_Job은_FAILURE로_반납됨() {
        // given
        dataStore.addTask(Task.of(TaskId.of("remote"), CallableRef.of("registry:remote")).withExecutor("processpool"));
        JobId jobId = addJob("remote", JobArguments.none());

        // when
        dispatcher(new ManualJobExecutor(true)).pump();

        // then
        JobResult result = resultOf(jobId);
        assertThat(result.status()).isEqualTo(JobStatus.FAILURE);
        assertThat(result.error().exceptionType()).isEqualTo(CallableResolutionException.class.getName());
        assertThat(result.error().message()).contains("processpool");
    }

    @Test
    void 해석할_수_없는_함수의_Job은_FAILURE로_반납됨() {
        // given
        dataStore.addTask(Task.of(TaskId.of("unregistered"), CallableRef.of("registry:unregistered")));
        JobId jobId = addJob("unregistered", JobArguments.none());

        // when
        dispatcher(new ManualJobExecutor(true)).pump();

        // then
        assertThat(resultOf(jobId).error().exceptionType()).isEqualTo(CallableResolutionException.class.getName());
    }

    // ============================================================
    // 3. 동시 실행 / 취소 / 리스
    // ============================================================

    @Test
    void 동시_실행_한도만큼만_Job을_획득함() {
        // given
        config = config.withMaxConcurrentJobs(2);
        ManualJobExecutor executor = new ManualJobExecutor(false);
        JobDispatcher dispatcher = dispatcher(executor);
        JobId first = addJob("sum", JobArguments.of(1, 1));
        addJob("sum", JobArguments.of(2, 2));
        addJob("sum", JobArguments.of(3, 3));

        // when
        dispatcher.pump();
        dispatcher.pump();

        // then
        assertThat(dispatcher.runningJobCount()).isEqualTo(2);
        assertThat(dataStore.getJobs()).extracting(Job::status)
            .containsExactly(JobStatus.RUNNING, JobStatus.RUNNING, JobStatus.PENDING);

        // when
        executor.complete(first, 2);
        dispatcher.pump();

        // then
        assertThat(resultOf(first).status()).isEqualTo(JobStatus.SUCCESS);
        assertThat(dataStore.getJobs()).extracting(Job::status)
            .containsExactly(JobStatus.RUNNING, JobStatus.RUNNING);
    }

    @Test
    void 실행_중인_Job을_취소하면_CANCELLED로_반납됨() {
        // given
        ManualJobExecutor executor = new ManualJobExecutor(false);
        JobDispatcher dispatcher = dispatcher(executor);
        JobId jobId = addJob("sum", JobArguments.of(1, 2));
        dispatcher.pump();

        // when
        boolean cancelled = dispatcher.cancel(jobId);

        // then
        assertThat(cancelled).isTrue();
        assertThat(resultOf(jobId).status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(dispatcher.runningJobCount()).isZero();
        assertThat(dispatcher.cancel(jobId)).isFalse();
    }

    @Test
    void 강제_종료하면_실행_중인_Job을_모두_취소함() {
        // given
        JobDispatcher dispatcher = dispatcher(new ManualJobExecutor(false));
        JobId first = addJob("sum", JobArguments.of(1, 2));
        JobId second = addJob("sum", JobArguments.of(3, 4));
        dispatcher.pump();

        // when
        dispatcher.shutdown(false);

        // then
        assertThat(resultOf(first).status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(resultOf(second).status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void 리스_기간의_절반이_지나면_실행_중인_Job의_리스를_연장함() {
        // given
        JobDispatcher dispatcher = dispatcher(new ManualJobExecutor(false));
        JobId jobId = addJob("sum", JobArguments.of(1, 2));
        dispatcher.pump();
        clock.advance(Duration.ofSeconds(20));

        // when
        dispatcher.pump();

        // then
        Job running = dataStore.getJobs(List.of(jobId)).get(0);
        assertThat(running.acquiredUntil()).isEqualTo(T0.plusSeconds(50));
    }

    @Test
    void 생성자_의존성_검증() {
        assertThatThrownBy(() -> new JobDispatcher(dataStore, WORKER, clock, config, Map.of(), registry, serializer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("executors");
        assertThatThrownBy(() -> new JobDispatcher(null, WORKER, clock, config,
            Map.of("threadpool", new ManualJobExecutor(true)), registry, serializer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dataStore");
    }
}
