package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.scheduler.JobOptions;
import com.ryuqq.scheduler.application.scheduler.ScheduleOptions;
import com.ryuqq.scheduler.application.scheduler.Scheduler;
import com.ryuqq.scheduler.application.scheduler.TaskOptions;
import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;
import com.ryuqq.scheduler.core.event.JobReleased;
import com.ryuqq.scheduler.core.event.SchedulerStarted;
import com.ryuqq.scheduler.core.event.SchedulerStopped;
import com.ryuqq.scheduler.core.exception.JobExecutionException;
import com.ryuqq.scheduler.core.exception.JobLookupException;
import com.ryuqq.scheduler.core.exception.JobTimeoutException;
import com.ryuqq.scheduler.core.exception.ScheduleLookupException;
import com.ryuqq.scheduler.core.exception.TaskLookupException;
import com.ryuqq.scheduler.core.exception.TriggerExhaustedException;
import com.ryuqq.scheduler.core.executor.CallableResolver;
import com.ryuqq.scheduler.core.executor.JobExecutor;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Payload;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.Serializer;
import com.ryuqq.scheduler.core.spi.Subscription;
import com.ryuqq.scheduler.core.statemachine.JobStatus;
import com.ryuqq.scheduler.core.statemachine.SchedulerState;
import com.ryuqq.scheduler.core.statemachine.SchedulerStateTransition;
import com.ryuqq.scheduler.core.trigger.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * {@link Scheduler} 기본 구현체.
 *
 * <p>Schedule 루프, 워커 루프, 정리 루프를 각각 전용 스레드에서 실행합니다.
 * 루프는 관련 이벤트(schedule_added, schedule_updated, job_added, job_completed)로 깨어나고,
 * 이벤트가 없으면 설정된 주기로 DataStore를 다시 확인합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * STOPPED → start() → STARTING → RUNNING
 * RUNNING → stop() 또는 치명적 오류 → STOPPING → STOPPED
 * </pre>
 *
 * <p>루프에서 복구할 수 없는 예외(재시도를 모두 소진한 DataStore 장애 등)가 발생하면
 * 별도 스레드에서 강제 종료하고, SchedulerStopped 이벤트에 오류를 담습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DefaultScheduler scheduler = DefaultScheduler.builder()
 *     .dataStore(new InMemoryDataStore())
 *     .eventBroker(new LocalEventBroker())
 *     .serializer(new JsonSerializer())
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    /**
     * runJob이 결과를 받기 위해 보관하는 기간.
     */
    static final Duration RUN_JOB_RESULT_EXPIRATION = Duration.ofMinutes(15);

    private static final long LOOP_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final DataStore dataStore;
    private final EventBroker eventBroker;
    private final Serializer serializer;
    private final Clock clock;
    private final InstanceId instanceId;
    private final SchedulerConfig config;
    private final Map<String, JobExecutor> executors;
    private final RegistryCallableResolver registry;

    private final ScheduleProcessor scheduleProcessor;
    private final JobDispatcher jobDispatcher;
    private final DataStoreCleaner cleaner;

    private final LoopWaker scheduleWaker = new LoopWaker();
    private final LoopWaker workerWaker = new LoopWaker();
    private final LoopWaker cleanerWaker = new LoopWaker();

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile SchedulerState state = SchedulerState.STOPPED;
    private volatile Throwable failure;
    private ExecutorService loopThreads;
    private Subscription wakeSubscription;

    private DefaultScheduler(Builder builder) {
        this.dataStore = new RetryingDataStore(builder.dataStore, builder.config.retry());
        this.eventBroker = builder.eventBroker;
        this.serializer = builder.serializer;
        this.clock = builder.clock;
        this.instanceId = builder.instanceId;
        this.config = builder.config;
        this.registry = new RegistryCallableResolver();

        Map<String, JobExecutor> executorMap = new LinkedHashMap<>();
        for (JobExecutor executor : builder.executors) {
            if (executorMap.putIfAbsent(executor.name(), executor) != null) {
                throw new IllegalArgumentException("Duplicate executor name: " + executor.name());
            }
        }
        executorMap.computeIfAbsent(Task.DEFAULT_EXECUTOR, name ->
            new ThreadPoolJobExecutor(name, config.worker().maxConcurrentJobs(), config.worker().jobTimeout()));
        this.executors = Map.copyOf(executorMap);

        List<CallableResolver> resolvers = new ArrayList<>();
        resolvers.add(registry);
        resolvers.addAll(builder.resolvers);
        if (builder.resolvers.isEmpty()) {
            resolvers.add(new ReflectiveCallableResolver());
        }

        this.scheduleProcessor = new ScheduleProcessor(dataStore, instanceId, clock, config.loop());
        this.jobDispatcher = new JobDispatcher(dataStore, instanceId, clock, config.worker(), executors,
            new CompositeCallableResolver(resolvers), serializer);
        this.cleaner = new DataStoreCleaner(dataStore);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ============================================================
    // Tasks
    // ============================================================

    @Override
    public Task configureTask(TaskId taskId, TaskFunction function, TaskOptions options) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        TaskOptions resolved = options != null ? options : new TaskOptions();
        Task task = new Task(taskId, RegistryCallableResolver.refFor(taskId), resolved.executor(),
            resolved.maxRunningJobs(), resolved.misfireGraceTime());
        registry.register(task.func(), function);
        dataStore.addTask(task);
        return task;
    }

    @Override
    public void addTask(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        dataStore.addTask(task);
    }

    @Override
    public List<Task> getTasks() {
        return dataStore.getTasks();
    }

    @Override
    public void removeTask(TaskId taskId) {
        dataStore.removeTask(taskId);
    }

    // ============================================================
    // Schedules
    // ============================================================

    @Override
    public ScheduleId addSchedule(TaskId taskId, Trigger trigger, ScheduleOptions options) {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        requireTask(taskId);
        ScheduleOptions resolved = options != null ? options : new ScheduleOptions();

        Instant firstFireTime = trigger.next(null, clock.instant())
            .orElseThrow(() -> new TriggerExhaustedException("Trigger produces no fire time: " + trigger));
        ScheduleId scheduleId = resolved.id() != null ? resolved.id() : ScheduleId.generate();

        Schedule schedule = Schedule.of(scheduleId, taskId, trigger, firstFireTime)
            .withArgs(encodeArguments(resolved.args()))
            .withCoalesce(resolved.coalesce())
            .withMisfireGraceTime(resolved.misfireGraceTime())
            .withPaused(resolved.paused())
            .withJobResultExpirationTime(resolved.jobResultExpirationTime());
        dataStore.addSchedule(schedule, resolved.conflictPolicy());
        log.info("Schedule {} added for task {}, first fire time {}", scheduleId, taskId, firstFireTime);
        return scheduleId;
    }

    @Override
    public void removeSchedule(ScheduleId scheduleId) {
        if (scheduleId == null) {
            throw new IllegalArgumentException("scheduleId cannot be null");
        }
        dataStore.removeSchedules(List.of(scheduleId));
    }

    @Override
    public Schedule getSchedule(ScheduleId scheduleId) {
        if (scheduleId == null) {
            throw new IllegalArgumentException("scheduleId cannot be null");
        }
        return dataStore.getSchedules(List.of(scheduleId)).stream()
            .findFirst()
            .orElseThrow(() -> new ScheduleLookupException(scheduleId));
    }

    @Override
    public List<Schedule> getSchedules() {
        return dataStore.getSchedules();
    }

    @Override
    public void pauseSchedule(ScheduleId scheduleId) {
        setPaused(scheduleId, true);
    }

    @Override
    public void unpauseSchedule(ScheduleId scheduleId) {
        setPaused(scheduleId, false);
    }

    private void setPaused(ScheduleId scheduleId, boolean paused) {
        Schedule schedule = getSchedule(scheduleId);
        if (schedule.paused() == paused) {
            return;
        }
        dataStore.addSchedule(schedule.withPaused(paused), ConflictPolicy.REPLACE);
        log.info("Schedule {} {}", scheduleId, paused ? "paused" : "unpaused");
    }

    // ============================================================
    // Jobs
    // ============================================================

    @Override
    public JobId addJob(TaskId taskId, JobArguments arguments, JobOptions options) {
        requireTask(taskId);
        JobOptions resolved = options != null ? options : new JobOptions();
        Job job = Job.create(taskId, encodeArguments(arguments), resolved.resultExpirationTime(), clock.instant());
        dataStore.addJob(job);
        return job.id();
    }

    @Override
    public Optional<JobResult> getJobResult(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        Optional<JobResult> result = dataStore.getJobResult(jobId);
        if (result.isPresent()) {
            return result;
        }
        if (dataStore.getJobs(List.of(jobId)).isEmpty()) {
            throw new JobLookupException(jobId);
        }
        return Optional.empty();
    }

    @Override
    public Optional<JobResult> awaitJobResult(JobId jobId, Duration timeout) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        CountDownLatch released = new CountDownLatch(1);
        // 조회 전에 구독해야 그 사이의 완료 이벤트를 놓치지 않음
        Subscription subscription = eventBroker.subscribe(event -> {
            if (jobId.equals(((JobReleased) event).jobId())) {
                released.countDown();
            }
        }, Set.of(EventTopic.JOB_COMPLETED));
        try {
            Optional<JobResult> result = dataStore.getJobResult(jobId);
            if (result.isPresent()) {
                return result;
            }
            if (dataStore.getJobs(List.of(jobId)).isEmpty()) {
                // 조회 사이에 반납되었을 수 있음
                result = dataStore.getJobResult(jobId);
                if (result.isPresent()) {
                    return result;
                }
                throw new JobLookupException(jobId);
            }
            if (!released.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Optional.empty();
            }
            return dataStore.getJobResult(jobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            subscription.unsubscribe();
        }
    }

    @Override
    public <T> T runJob(TaskId taskId, JobArguments arguments, Class<T> resultType, Duration timeout) {
        if (resultType == null) {
            throw new IllegalArgumentException("resultType cannot be null");
        }
        JobId jobId = addJob(taskId, arguments, JobOptions.retainingResultFor(RUN_JOB_RESULT_EXPIRATION));
        JobResult result = awaitJobResult(jobId, timeout)
            .orElseThrow(() -> new JobTimeoutException(
                "Job " + jobId.getValue() + " did not finish within " + timeout));
        return decodeReturnValue(result, resultType);
    }

    @Override
    public boolean cancelJob(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (dataStore.cancelJob(jobId)) {
            log.info("Pending job {} cancelled", jobId);
            return true;
        }
        return jobDispatcher.cancel(jobId);
    }

    @Override
    public <T> T decodeReturnValue(JobResult result, Class<T> type) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (result.status() != JobStatus.SUCCESS) {
            throw new JobExecutionException(result);
        }
        if (result.returnValue() == null) {
            return null;
        }
        return serializer.deserialize(result.returnValue().getBytes(), type);
    }

    // ============================================================
    // Events / lifecycle
    // ============================================================

    @Override
    public Subscription subscribe(Consumer<? super Event> callback, Set<EventTopic> topics) {
        return eventBroker.subscribe(callback, topics != null ? topics : Set.of());
    }

    @Override
    public void start() {
        stateLock.lock();
        try {
            state = SchedulerStateTransition.transition(state, SchedulerState.STARTING);
            failure = null;
            try {
                doStart();
            } catch (RuntimeException e) {
                log.error("Scheduler {} failed to start", instanceId, e);
                state = SchedulerStateTransition.transition(state, SchedulerState.STOPPING);
                releaseResources(false);
                state = SchedulerStateTransition.transition(state, SchedulerState.STOPPED);
                throw e;
            }
            state = SchedulerStateTransition.transition(state, SchedulerState.RUNNING);
        } finally {
            stateLock.unlock();
        }
        eventBroker.publish(new SchedulerStarted(clock.instant(), instanceId));
        log.info("Scheduler {} started (role: {})", instanceId, config.role());
    }

    private void doStart() {
        eventBroker.start();
        dataStore.start(eventBroker);
        executors.values().forEach(JobExecutor::start);
        wakeSubscription = eventBroker.subscribe(this::onWakeEvent, Set.of(
            EventTopic.SCHEDULE_ADDED, EventTopic.SCHEDULE_UPDATED,
            EventTopic.JOB_ADDED, EventTopic.JOB_COMPLETED));

        loopThreads = Executors.newCachedThreadPool(loopThreadFactory());
        if (config.role().processesSchedules()) {
            loopThreads.submit(this::runScheduleLoop);
        }
        if (config.role().processesJobs()) {
            loopThreads.submit(this::runWorkerLoop);
        }
        loopThreads.submit(this::runCleanerLoop);
    }

    @Override
    public void stop() {
        stop(true);
    }

    @Override
    public void stop(boolean graceful) {
        stateLock.lock();
        try {
            if (state != SchedulerState.RUNNING) {
                log.debug("Scheduler {} is {}, ignoring stop request", instanceId, state);
                return;
            }
            state = SchedulerStateTransition.transition(state, SchedulerState.STOPPING);
            log.info("Scheduler {} stopping (graceful: {})", instanceId, graceful);
            releaseResources(graceful);
            state = SchedulerStateTransition.transition(state, SchedulerState.STOPPED);
        } finally {
            stateLock.unlock();
        }
        log.info("Scheduler {} stopped", instanceId);
    }

    private void releaseResources(boolean graceful) {
        if (loopThreads != null) {
            scheduleWaker.wake();
            workerWaker.wake();
            cleanerWaker.wake();
            if (graceful) {
                loopThreads.shutdown();
            } else {
                loopThreads.shutdownNow();
            }
            awaitLoopThreads();
            loopThreads = null;
        }

        jobDispatcher.shutdown(graceful);
        for (JobExecutor executor : executors.values()) {
            try {
                executor.shutdown(graceful);
            } catch (RuntimeException e) {
                log.error("Failed to shut down executor {}", executor.name(), e);
            }
        }

        if (wakeSubscription != null) {
            wakeSubscription.unsubscribe();
            wakeSubscription = null;
        }
        Throwable cause = failure;
        try {
            eventBroker.publish(new SchedulerStopped(clock.instant(), instanceId,
                cause != null ? cause.toString() : null));
        } catch (RuntimeException e) {
            log.warn("Failed to publish SchedulerStopped for {}", instanceId, e);
        }
        dataStore.stop();
        eventBroker.stop();
    }

    private void awaitLoopThreads() {
        try {
            if (!loopThreads.awaitTermination(LOOP_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scheduler loops did not finish within {}s, interrupting", LOOP_SHUTDOWN_TIMEOUT_SECONDS);
                loopThreads.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopThreads.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public SchedulerState getState() {
        return state;
    }

    @Override
    public InstanceId getInstanceId() {
        return instanceId;
    }

    /**
     * 마지막 치명적 오류 (정상 종료했으면 empty).
     *
     * @return 스케줄러를 멈춘 오류
     */
    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    // ============================================================
    // Loops
    // ============================================================

    private void onWakeEvent(Event event) {
        switch (event.topic()) {
            case SCHEDULE_ADDED, SCHEDULE_UPDATED -> scheduleWaker.wake();
            case JOB_ADDED, JOB_COMPLETED -> workerWaker.wake();
            default -> {
            }
        }
    }

    private void runScheduleLoop() {
        log.debug("Schedule loop started");
        try {
            while (isRunning()) {
                int acquired = scheduleProcessor.processBatch();
                if (acquired >= config.loop().batchSize()) {
                    // 배치가 가득 찼으면 더 남아 있을 수 있음
                    continue;
                }
                scheduleWaker.await(scheduleWaitTime());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            onLoopFailure("schedule", e);
        }
        log.debug("Schedule loop finished");
    }

    private Duration scheduleWaitTime() {
        Duration maxWait = Duration.ofMillis(config.loop().maxWaitMs());
        Optional<Instant> next = dataStore.getNextScheduleRunTime();
        if (next.isEmpty()) {
            return maxWait;
        }
        Duration untilNext = Duration.between(clock.instant(), next.get());
        if (untilNext.isNegative()) {
            return Duration.ZERO;
        }
        return untilNext.compareTo(maxWait) < 0 ? untilNext : maxWait;
    }

    private void runWorkerLoop() {
        log.debug("Worker loop started");
        try {
            while (isRunning()) {
                jobDispatcher.pump();
                workerWaker.await(config.worker().pollingIntervalMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            onLoopFailure("worker", e);
        }
        log.debug("Worker loop finished");
    }

    private void runCleanerLoop() {
        try {
            while (isRunning()) {
                cleaner.pump();
                cleanerWaker.await(config.cleaner().cleanupIntervalMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean isRunning() {
        return state == SchedulerState.RUNNING && !Thread.currentThread().isInterrupted();
    }

    private void onLoopFailure(String loop, RuntimeException e) {
        if (!isRunning()) {
            log.debug("The {} loop ended during shutdown: {}", loop, e.toString());
            return;
        }
        log.error("The {} loop of scheduler {} failed, stopping the scheduler", loop, instanceId, e);
        failure = e;
        // 루프 스레드에서 직접 멈추면 자기 자신의 종료를 기다리게 됨
        Thread stopper = new Thread(() -> stop(false), "scheduler-stopper-" + instanceId.getValue());
        stopper.setDaemon(true);
        stopper.start();
    }

    private ThreadFactory loopThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "scheduler-loop-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ============================================================
    // Helpers
    // ============================================================

    private void requireTask(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (dataStore.getTask(taskId).isEmpty()) {
            throw new TaskLookupException(taskId);
        }
    }

    private Payload encodeArguments(JobArguments arguments) {
        if (arguments == null || arguments.equals(JobArguments.none())) {
            return Payload.empty();
        }
        return Payload.of(serializer.serialize(arguments));
    }

    /**
     * DefaultScheduler 빌더.
     *
     * <p>dataStore, eventBroker, serializer는 필수입니다.
     * 실행기를 지정하지 않으면 워커 설정으로 "threadpool" 실행기를 만들고,
     * Resolver를 지정하지 않으면 {@link ReflectiveCallableResolver}를 사용합니다.
     * configureTask로 등록한 함수는 항상 먼저 조회됩니다.</p>
     */
    public static final class Builder {

        private DataStore dataStore;
        private EventBroker eventBroker;
        private Serializer serializer;
        private Clock clock = Clock.systemUTC();
        private InstanceId instanceId;
        private SchedulerConfig config = new SchedulerConfig();
        private final List<JobExecutor> executors = new ArrayList<>();
        private final List<CallableResolver> resolvers = new ArrayList<>();

        private Builder() {
        }

        public Builder dataStore(DataStore dataStore) {
            this.dataStore = dataStore;
            return this;
        }

        public Builder eventBroker(EventBroker eventBroker) {
            this.eventBroker = eventBroker;
            return this;
        }

        public Builder serializer(Serializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder instanceId(InstanceId instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder config(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder executor(JobExecutor executor) {
            if (executor == null) {
                throw new IllegalArgumentException("executor cannot be null");
            }
            this.executors.add(executor);
            return this;
        }

        public Builder callableResolver(CallableResolver resolver) {
            if (resolver == null) {
                throw new IllegalArgumentException("resolver cannot be null");
            }
            this.resolvers.add(resolver);
            return this;
        }

        public DefaultScheduler build() {
            if (dataStore == null) {
                throw new IllegalArgumentException("dataStore cannot be null");
            }
            if (eventBroker == null) {
                throw new IllegalArgumentException("eventBroker cannot be null");
            }
            if (serializer == null) {
                throw new IllegalArgumentException("serializer cannot be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            if (instanceId == null) {
                instanceId = InstanceId.generate();
            }
            return new DefaultScheduler(this);
        }
    }
}
