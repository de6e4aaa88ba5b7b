package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.adapter.inmemory.bus.InMemoryEventTransport;
import com.ryuqq.scheduler.adapter.inmemory.bus.LocalEventBroker;
import com.ryuqq.scheduler.adapter.inmemory.bus.TransportEventBroker;
import com.ryuqq.scheduler.adapter.inmemory.store.InMemoryDataStore;
import com.ryuqq.scheduler.adapter.serialization.JsonSerializer;
import com.ryuqq.scheduler.application.scheduler.JobOptions;
import com.ryuqq.scheduler.application.scheduler.ScheduleOptions;
import com.ryuqq.scheduler.application.scheduler.SchedulerRole;
import com.ryuqq.scheduler.application.scheduler.TaskOptions;
import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;
import com.ryuqq.scheduler.core.event.JobReleased;
import com.ryuqq.scheduler.core.event.SchedulerStarted;
import com.ryuqq.scheduler.core.event.SchedulerStopped;
import com.ryuqq.scheduler.core.exception.ConflictException;
import com.ryuqq.scheduler.core.exception.DataStoreUnavailableException;
import com.ryuqq.scheduler.core.exception.JobExecutionException;
import com.ryuqq.scheduler.core.exception.JobLookupException;
import com.ryuqq.scheduler.core.exception.JobTimeoutException;
import com.ryuqq.scheduler.core.exception.ScheduleLookupException;
import com.ryuqq.scheduler.core.exception.TaskLookupException;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.statemachine.JobStatus;
import com.ryuqq.scheduler.core.statemachine.SchedulerState;
import com.ryuqq.scheduler.core.trigger.DateTrigger;
import com.ryuqq.scheduler.core.trigger.IntervalTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * DefaultScheduler 통합 테스트.
 *
 * <p>InMemoryDataStore, LocalEventBroker, JsonSerializer로 실제 루프 스레드를 돌려 검증합니다:</p>
 * <ul>
 *   <li>runJob, Schedule 실행, 인자 전달</li>
 *   <li>Task/Schedule/Job 관리 API의 예외 규약</li>
 *   <li>생명주기와 치명적 오류 시 자동 종료</li>
 *   <li>DataStore를 공유하는 두 인스턴스의 중복 실행 방지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DefaultSchedulerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final TaskId SUM = TaskId.of("sum");

    private final List<DefaultScheduler> started = new ArrayList<>();
    private InMemoryDataStore dataStore;
    private DefaultScheduler scheduler;

    @BeforeEach
    void setUp() {
        dataStore = new InMemoryDataStore();
        scheduler = newScheduler(dataStore, new LocalEventBroker(), fastConfig());
        scheduler.configureTask(SUM, context -> (Integer) context.arguments().positionalAt(0)
            + (Integer) context.arguments().positionalAt(1), new TaskOptions());
    }

    @AfterEach
    void tearDown() {
        for (DefaultScheduler each : started) {
            each.stop(false);
        }
    }

    private static SchedulerConfig fastConfig() {
        return new SchedulerConfig()
            .withLoop(new SchedulerLoopConfig().withMaxWaitMs(200))
            .withWorker(new WorkerConfig().withPollingIntervalMs(50));
    }

    private DefaultScheduler newScheduler(DataStore store, EventBroker broker,
                                          SchedulerConfig config) {
        DefaultScheduler created = DefaultScheduler.builder()
            .dataStore(store)
            .eventBroker(broker)
            .serializer(new JsonSerializer())
            .config(config)
            .build();
        started.add(created);
        return created;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }

    // ============================================================
    // 1. Job 실행
    // ============================================================

    @Test
    void runJob_함수의_반환값을_돌려줌() {
        // given
        scheduler.start();

        // when
        Integer sum = scheduler.runJob(SUM, JobArguments.of(1, 2), Integer.class, WAIT);

        // then
        assertThat(sum).isEqualTo(3);
    }

    @Test
    void runJob_함수가_실패하면_JobExecutionException() {
        // given
        scheduler.configureTask(TaskId.of("boom"), context -> {
            throw new IllegalStateException("quarterly report failed");
        }, new TaskOptions());
        scheduler.start();

        // when & then
        assertThatThrownBy(() -> scheduler.runJob(TaskId.of("boom"), JobArguments.none(), Object.class, WAIT))
            .isInstanceOf(JobExecutionException.class)
            .hasMessageContaining("quarterly report failed")
            .satisfies(e -> assertThat(((JobExecutionException) e).getResult().status()).isEqualTo(JobStatus.FAILURE));
    }

    @Test
    void runJob_워커가_없으면_시간_초과() {
        // given
        DefaultScheduler schedulerOnly = newScheduler(new InMemoryDataStore(), new LocalEventBroker(),
            fastConfig().withRole(SchedulerRole.SCHEDULER));
        schedulerOnly.configureTask(SUM, context -> 0, new TaskOptions());
        schedulerOnly.start();

        // when & then
        assertThatThrownBy(() -> schedulerOnly.runJob(SUM, JobArguments.of(1, 2), Integer.class,
            Duration.ofMillis(300)))
            .isInstanceOf(JobTimeoutException.class);
    }

    @Test
    void Interval_Schedule은_반복_실행되고_인자가_전달됨() throws InterruptedException {
        // given
        BlockingQueue<Object> seen = new LinkedBlockingQueue<>();
        scheduler.configureTask(TaskId.of("tick"), context -> {
            seen.add(context.arguments().positionalAt(0));
            return null;
        }, new TaskOptions());
        scheduler.start();

        // when
        ScheduleId scheduleId = scheduler.addSchedule(TaskId.of("tick"),
            IntervalTrigger.every(Duration.ofMillis(200)),
            new ScheduleOptions().withArgs(JobArguments.of("ping")));

        // then
        for (int i = 0; i < 3; i++) {
            assertThat(seen.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isEqualTo("ping");
        }
        assertThat(scheduler.getSchedule(scheduleId).lastFireTime()).isNotNull();
    }

    @Test
    void 일회성_Schedule은_한_번_실행된_뒤_삭제됨() throws InterruptedException {
        // given
        AtomicInteger runs = new AtomicInteger();
        scheduler.configureTask(TaskId.of("once"), context -> runs.incrementAndGet(), new TaskOptions());
        scheduler.start();

        // when
        ScheduleId scheduleId = scheduler.addSchedule(TaskId.of("once"), new DateTrigger(Instant.now()),
            new ScheduleOptions());

        // then
        awaitCondition(() -> runs.get() == 1 && scheduler.getSchedules().isEmpty());
        assertThatThrownBy(() -> scheduler.getSchedule(scheduleId)).isInstanceOf(ScheduleLookupException.class);
    }

    @Test
    void 실행_중인_Job을_취소하면_CANCELLED_결과가_남음() throws InterruptedException {
        // given
        CountDownLatch running = new CountDownLatch(1);
        scheduler.configureTask(TaskId.of("slow"), context -> {
            running.countDown();
            Thread.sleep(10_000);
            return null;
        }, new TaskOptions());
        scheduler.start();
        JobId jobId = scheduler.addJob(TaskId.of("slow"), JobArguments.none(),
            JobOptions.retainingResultFor(Duration.ofMinutes(1)));
        assertThat(running.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();

        // when
        boolean cancelled = scheduler.cancelJob(jobId);

        // then
        assertThat(cancelled).isTrue();
        JobResult result = scheduler.awaitJobResult(jobId, WAIT).orElseThrow();
        assertThat(result.status()).isEqualTo(JobStatus.CANCELLED);
    }

    // ============================================================
    // 2. 관리 API
    // ============================================================

    @Test
    void 없는_Task로_Schedule이나_Job을_추가하면_TaskLookupException() {
        assertThatThrownBy(() -> scheduler.addSchedule(TaskId.of("missing"),
            IntervalTrigger.every(Duration.ofMinutes(1)), new ScheduleOptions()))
            .isInstanceOf(TaskLookupException.class);
        assertThatThrownBy(() -> scheduler.addJob(TaskId.of("missing"), JobArguments.none(), new JobOptions()))
            .isInstanceOf(TaskLookupException.class);
    }

    @Test
    void 같은_ID의_Schedule은_충돌_정책에_따라_처리됨() {
        // given
        ScheduleOptions options = new ScheduleOptions().withId(ScheduleId.of("nightly"));
        scheduler.addSchedule(SUM, IntervalTrigger.every(Duration.ofHours(1)), options);

        // when & then
        assertThatThrownBy(() -> scheduler.addSchedule(SUM, IntervalTrigger.every(Duration.ofHours(2)), options))
            .isInstanceOf(ConflictException.class);

        scheduler.addSchedule(SUM, IntervalTrigger.every(Duration.ofHours(2)),
            options.withConflictPolicy(ConflictPolicy.REPLACE));
        assertThat(scheduler.getSchedule(ScheduleId.of("nightly")).trigger())
            .isEqualTo(IntervalTrigger.every(Duration.ofHours(2)));
    }

    @Test
    void Schedule을_일시_정지하고_재개함() {
        // given
        ScheduleId scheduleId = scheduler.addSchedule(SUM, IntervalTrigger.every(Duration.ofHours(1)),
            new ScheduleOptions());

        // when
        scheduler.pauseSchedule(scheduleId);

        // then
        assertThat(scheduler.getSchedule(scheduleId).paused()).isTrue();

        // when
        scheduler.unpauseSchedule(scheduleId);

        // then
        assertThat(scheduler.getSchedule(scheduleId).paused()).isFalse();
        assertThatThrownBy(() -> scheduler.pauseSchedule(ScheduleId.of("unknown")))
            .isInstanceOf(ScheduleLookupException.class);
    }

    @Test
    void 대기_중인_Job을_취소하면_CANCELLED_결과가_저장됨() {
        // given
        JobId jobId = scheduler.addJob(SUM, JobArguments.of(1, 2), JobOptions.retainingResultFor(Duration.ofMinutes(1)));

        // when
        boolean cancelled = scheduler.cancelJob(jobId);

        // then
        assertThat(cancelled).isTrue();
        assertThat(scheduler.getJobResult(jobId)).get()
            .extracting(JobResult::status).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void 대기_중인_Job의_결과는_비어_있고_모르는_Job은_JobLookupException() {
        // given
        JobId jobId = scheduler.addJob(SUM, JobArguments.of(1, 2), new JobOptions());

        // when & then
        assertThat(scheduler.getJobResult(jobId)).isEmpty();
        assertThatThrownBy(() -> scheduler.getJobResult(JobId.generate()))
            .isInstanceOf(JobLookupException.class);
    }

    @Test
    void decodeReturnValue_SUCCESS가_아니면_JobExecutionException() {
        // given
        JobId jobId = scheduler.addJob(SUM, JobArguments.of(1, 2), JobOptions.retainingResultFor(Duration.ofMinutes(1)));
        scheduler.cancelJob(jobId);
        JobResult cancelled = scheduler.getJobResult(jobId).orElseThrow();

        // when & then
        assertThatThrownBy(() -> scheduler.decodeReturnValue(cancelled, Integer.class))
            .isInstanceOf(JobExecutionException.class)
            .hasMessageContaining("CANCELLED");
    }

    // ============================================================
    // 3. 생명주기
    // ============================================================

    @Test
    void 시작과_종료_시_이벤트를_발행하고_상태가_바뀜() throws InterruptedException {
        // given
        BlockingQueue<Event> events = new LinkedBlockingQueue<>();
        scheduler.subscribe(events::add, Set.of(EventTopic.SCHEDULER_STARTED, EventTopic.SCHEDULER_STOPPED));

        // when
        scheduler.start();

        // then
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.RUNNING);
        assertThat(events.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isInstanceOf(SchedulerStarted.class);
        assertThatThrownBy(() -> scheduler.start()).isInstanceOf(IllegalStateException.class);

        // when
        scheduler.stop();

        // then
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.STOPPED);
        SchedulerStopped stopped = (SchedulerStopped) events.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertThat(stopped).isNotNull();
        assertThat(stopped.error()).isNull();
        assertThat(scheduler.getFailure()).isEmpty();
    }

    @Test
    void 종료된_스케줄러를_다시_시작할_수_있음() {
        // given
        scheduler.start();
        scheduler.stop();

        // when
        scheduler.start();

        // then
        assertThat(scheduler.getState()).isEqualTo(SchedulerState.RUNNING);
        assertThat(scheduler.runJob(SUM, JobArguments.of(2, 3), Integer.class, WAIT)).isEqualTo(5);
    }

    @Test
    void 재시작해도_사용자_구독은_유지됨() throws InterruptedException {
        // given
        BlockingQueue<Event> events = new LinkedBlockingQueue<>();
        scheduler.subscribe(events::add, Set.of(EventTopic.SCHEDULER_STARTED));
        scheduler.start();
        assertThat(events.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isInstanceOf(SchedulerStarted.class);

        // when
        scheduler.stop();
        scheduler.start();

        // then
        assertThat(events.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isInstanceOf(SchedulerStarted.class);
    }

    @Test
    void DataStore_장애가_계속되면_스스로_종료하고_오류를_남김() throws InterruptedException {
        // given
        InMemoryDataStore failing = spy(new InMemoryDataStore());
        doThrow(new DataStoreUnavailableException("database down"))
            .when(failing).acquireSchedules(any(InstanceId.class), any(Duration.class), anyInt());
        DefaultScheduler broken = newScheduler(failing, new LocalEventBroker(),
            fastConfig().withRetry(DataStoreRetryConfig.noRetry()));

        // when
        broken.start();

        // then
        awaitCondition(() -> broken.getState() == SchedulerState.STOPPED);
        assertThat(broken.getFailure()).get().isInstanceOf(DataStoreUnavailableException.class);
    }

    // ============================================================
    // 4. 여러 인스턴스
    // ============================================================

    @Test
    void DataStore를_공유하는_두_인스턴스는_Schedule을_한_번씩만_실행함() throws InterruptedException {
        // given
        InMemoryEventTransport transport = new InMemoryEventTransport();
        InMemoryDataStore shared = new InMemoryDataStore();
        DefaultScheduler first = newScheduler(shared,
            new TransportEventBroker(transport, new JsonSerializer()), fastConfig());
        DefaultScheduler second = newScheduler(shared,
            new TransportEventBroker(transport, new JsonSerializer()), fastConfig());

        AtomicInteger runs = new AtomicInteger();
        TaskId countTask = TaskId.of("count");
        first.configureTask(countTask, context -> runs.incrementAndGet(), new TaskOptions());
        second.configureTask(countTask, context -> runs.incrementAndGet(), new TaskOptions());
        first.start();
        second.start();

        BlockingQueue<Event> released = new LinkedBlockingQueue<>();
        first.subscribe(released::add, Set.of(EventTopic.JOB_COMPLETED));

        // when
        int scheduleCount = 30;
        for (int i = 0; i < scheduleCount; i++) {
            ScheduleOptions options = new ScheduleOptions().withId(ScheduleId.of("once-" + i));
            (i % 2 == 0 ? first : second).addSchedule(countTask, new DateTrigger(Instant.now()), options);
        }

        // then
        awaitCondition(() -> runs.get() >= scheduleCount && shared.getSchedules().isEmpty());
        Thread.sleep(300);
        assertThat(runs.get()).isEqualTo(scheduleCount);
        assertThat(first.getInstanceId()).isNotEqualTo(second.getInstanceId());
        assertThat(released.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isInstanceOf(JobReleased.class);
    }
}
