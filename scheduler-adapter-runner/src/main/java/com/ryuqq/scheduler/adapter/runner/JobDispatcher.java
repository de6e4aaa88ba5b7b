package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.runtime.Runtime;
import com.ryuqq.scheduler.core.exception.CallableResolutionException;
import com.ryuqq.scheduler.core.exception.DataStoreUnavailableException;
import com.ryuqq.scheduler.core.exception.LeaseExpiredException;
import com.ryuqq.scheduler.core.exception.SerializationException;
import com.ryuqq.scheduler.core.exception.TaskLookupException;
import com.ryuqq.scheduler.core.executor.CallableResolver;
import com.ryuqq.scheduler.core.executor.JobContext;
import com.ryuqq.scheduler.core.executor.JobExecutor;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobError;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Payload;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.spi.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Job을 획득해 실행기에 넘기고 결과를 반납하는 워커 Runtime.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * 실행 중인 Job 리스 연장 (리스 기간 절반마다)
 *   ↓
 * acquireJobs(min(batchSize, 남은 슬롯))
 *   ↓
 * For each Job:
 *   1. 시작 마감 초과 → MISSED 반납
 *   2. Task 조회, 실행기 선택, 함수 해석, 인자 디코딩 (실패 → FAILURE 반납)
 *   3. executor.execute() → 비동기 실행
 *   ↓
 * 완료 콜백: SUCCESS / FAILURE / CANCELLED 결과 반납
 * </pre>
 *
 * <p>자동 재시도는 없습니다. 함수 예외는 FAILURE 결과로 한 번 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobDispatcher implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private static final long GRACEFUL_WAIT_SECONDS = 60;

    private final DataStore dataStore;
    private final InstanceId instanceId;
    private final Clock clock;
    private final WorkerConfig config;
    private final Map<String, JobExecutor> executors;
    private final CallableResolver callableResolver;
    private final Serializer serializer;

    private final Map<JobId, RunningJob> runningJobs = new ConcurrentHashMap<>();
    private volatile Instant lastLeaseExtension;

    private record RunningJob(Job job, CompletableFuture<Object> future) {
    }

    public JobDispatcher(DataStore dataStore, InstanceId instanceId, Clock clock, WorkerConfig config,
                         Map<String, JobExecutor> executors, CallableResolver callableResolver,
                         Serializer serializer) {
        if (dataStore == null) {
            throw new IllegalArgumentException("dataStore cannot be null");
        }
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (executors == null || executors.isEmpty()) {
            throw new IllegalArgumentException("executors cannot be null or empty");
        }
        if (callableResolver == null) {
            throw new IllegalArgumentException("callableResolver cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.dataStore = dataStore;
        this.instanceId = instanceId;
        this.clock = clock;
        this.config = config;
        this.executors = Map.copyOf(executors);
        this.callableResolver = callableResolver;
        this.serializer = serializer;
        this.lastLeaseExtension = clock.instant();
    }

    @Override
    public void pump() {
        extendLeasesIfDue();

        int freeSlots = config.maxConcurrentJobs() - runningJobs.size();
        if (freeSlots <= 0) {
            return;
        }
        List<Job> jobs = dataStore.acquireJobs(instanceId, config.leaseDuration(),
            Math.min(config.batchSize(), freeSlots));
        for (Job job : jobs) {
            try {
                dispatch(job);
            } catch (DataStoreUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.error("Failed to dispatch job {}", job.id(), e);
                release(job, JobResult.failure(job, JobError.from(e), null, clock.instant()));
            }
        }
    }

    /**
     * 이 인스턴스에서 실행 중인 Job 취소 (실행 스레드 인터럽트).
     *
     * @param jobId 취소할 Job
     * @return 실행 중이어서 취소를 요청했으면 true
     */
    public boolean cancel(JobId jobId) {
        RunningJob running = runningJobs.get(jobId);
        if (running == null) {
            return false;
        }
        log.info("Cancelling running job {}", jobId);
        return running.future().cancel(true);
    }

    public int runningJobCount() {
        return runningJobs.size();
    }

    /**
     * 실행 중인 Job 정리.
     *
     * <p>graceful이면 실행 중인 Job이 끝나 결과가 반납될 때까지 기다리고,
     * 아니면 모두 취소합니다 (CANCELLED로 반납).</p>
     *
     * @param graceful 완료 대기 여부
     */
    public void shutdown(boolean graceful) {
        List<RunningJob> snapshot = new ArrayList<>(runningJobs.values());
        if (snapshot.isEmpty()) {
            return;
        }
        if (!graceful) {
            log.info("Cancelling {} running job(s)", snapshot.size());
            snapshot.forEach(running -> running.future().cancel(true));
            return;
        }
        log.info("Waiting for {} running job(s) to finish", snapshot.size());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(GRACEFUL_WAIT_SECONDS);
        for (RunningJob running : snapshot) {
            long remaining = deadline - System.nanoTime();
            try {
                running.future().get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (TimeoutException e) {
                log.warn("Job {} still running after {}s, leaving its lease to expire",
                    running.job().id(), GRACEFUL_WAIT_SECONDS);
            } catch (ExecutionException | CancellationException e) {
                // 결과는 완료 콜백에서 반납됨
                log.debug("Job {} ended with {} during shutdown", running.job().id(), e.toString());
            }
        }
    }

    private void dispatch(Job job) {
        Instant now = clock.instant();
        if (job.deadlinePassedAt(now)) {
            log.info("Job {} missed its start deadline {}", job.id(), job.startDeadline());
            release(job, JobResult.missed(job, now));
            return;
        }

        Optional<Task> task = dataStore.getTask(job.taskId());
        if (task.isEmpty()) {
            fail(job, new TaskLookupException(job.taskId()));
            return;
        }
        JobExecutor executor = executors.get(task.get().executor());
        if (executor == null) {
            fail(job, new CallableResolutionException("Unknown executor " + task.get().executor()
                + " for task " + job.taskId().getValue()));
            return;
        }

        TaskFunction function;
        JobArguments arguments;
        try {
            function = callableResolver.resolve(task.get().func());
            arguments = decodeArguments(job.args());
        } catch (CallableResolutionException | SerializationException e) {
            fail(job, e);
            return;
        }

        JobContext context = new JobContext(job.id(), job.taskId(), job.scheduleId(), job.scheduledFireTime(), arguments);
        Instant startedAt = clock.instant();
        CompletableFuture<Object> future = executor.execute(context, function);
        runningJobs.put(job.id(), new RunningJob(job, future));
        // 이미 완료된 future면 콜백이 바로 실행되므로 put 이후에 등록
        future.whenComplete((value, error) -> onFinished(job, startedAt, value, error));
        log.debug("Job {} of task {} started on executor {}", job.id(), job.taskId(), executor.name());
    }

    private JobArguments decodeArguments(Payload args) {
        if (args.size() == 0) {
            return JobArguments.none();
        }
        return serializer.deserialize(args.getBytes(), JobArguments.class);
    }

    private void onFinished(Job job, Instant startedAt, Object value, Throwable error) {
        runningJobs.remove(job.id());
        Instant finishedAt = clock.instant();
        JobResult result;
        if (error == null) {
            result = success(job, value, startedAt, finishedAt);
        } else {
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                log.info("Job {} was cancelled", job.id());
                result = JobResult.cancelled(job, startedAt, finishedAt);
            } else {
                log.warn("Job {} of task {} failed: {}", job.id(), job.taskId(), cause.toString());
                result = JobResult.failure(job, JobError.from(cause), startedAt, finishedAt);
            }
        }
        release(job, result);
    }

    private JobResult success(Job job, Object value, Instant startedAt, Instant finishedAt) {
        try {
            Payload returnValue = value == null ? null : Payload.of(serializer.serialize(value));
            log.debug("Job {} of task {} succeeded", job.id(), job.taskId());
            return JobResult.success(job, returnValue, startedAt, finishedAt);
        } catch (SerializationException e) {
            log.warn("Return value of job {} cannot be serialized", job.id(), e);
            return JobResult.failure(job, JobError.from(e), startedAt, finishedAt);
        }
    }

    private void fail(Job job, Exception cause) {
        log.warn("Job {} cannot be started: {}", job.id(), cause.getMessage());
        release(job, JobResult.failure(job, JobError.from(cause), null, clock.instant()));
    }

    private void release(Job job, JobResult result) {
        try {
            dataStore.releaseJob(instanceId, job.taskId(), result);
        } catch (LeaseExpiredException e) {
            log.warn("Lease of job {} expired before its {} result was released", job.id(), result.status());
        } catch (Exception e) {
            log.error("Failed to release job {} with status {}", job.id(), result.status(), e);
        }
    }

    private void extendLeasesIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(lastLeaseExtension.plus(config.leaseDuration().dividedBy(2)))) {
            return;
        }
        lastLeaseExtension = now;
        if (runningJobs.isEmpty()) {
            return;
        }
        try {
            dataStore.extendJobLeases(instanceId, new ArrayList<>(runningJobs.keySet()), config.leaseDuration());
        } catch (LeaseExpiredException e) {
            log.warn("Lost job leases while running: {}", e.getLostIds());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
