package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.DataStoreUnavailableException;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.ScheduleUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 일시적 장애를 재시도하는 DataStore 데코레이터.
 *
 * <p>{@link DataStoreUnavailableException}만 재시도 대상입니다. ConflictException,
 * LeaseExpiredException 등 업무 예외는 즉시 전파됩니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ol>
 *   <li>호출 실패 시 {@link BackoffCalculator}로 계산한 시간만큼 대기</li>
 *   <li>maxAttempts까지 반복</li>
 *   <li>모두 실패하면 마지막 예외를 그대로 전파 (호출한 루프가 스케줄러를 중지)</li>
 * </ol>
 *
 * <p>대기 중 인터럽트되면 인터럽트 플래그를 복원하고 마지막 예외를 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryingDataStore implements DataStore {

    private static final Logger log = LoggerFactory.getLogger(RetryingDataStore.class);

    /**
     * 재시도 대기 방식 (테스트에서 교체).
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final DataStore delegate;
    private final int maxAttempts;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    public RetryingDataStore(DataStore delegate, DataStoreRetryConfig config) {
        this(delegate, config, Thread::sleep);
    }

    RetryingDataStore(DataStore delegate, DataStoreRetryConfig config, Sleeper sleeper) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.delegate = delegate;
        this.maxAttempts = config.maxAttempts();
        this.backoffCalculator = config.toBackoffCalculator();
        this.sleeper = sleeper;
    }

    public DataStore getDelegate() {
        return delegate;
    }

    @Override
    public void start(EventBroker eventBroker) {
        run("start", () -> delegate.start(eventBroker));
    }

    @Override
    public void stop() {
        delegate.stop();
    }

    @Override
    public void addTask(Task task) {
        run("addTask", () -> delegate.addTask(task));
    }

    @Override
    public Optional<Task> getTask(TaskId taskId) {
        return call("getTask", () -> delegate.getTask(taskId));
    }

    @Override
    public List<Task> getTasks() {
        return call("getTasks", delegate::getTasks);
    }

    @Override
    public void removeTask(TaskId taskId) {
        run("removeTask", () -> delegate.removeTask(taskId));
    }

    @Override
    public void addSchedule(Schedule schedule, ConflictPolicy conflictPolicy) {
        run("addSchedule", () -> delegate.addSchedule(schedule, conflictPolicy));
    }

    @Override
    public void removeSchedules(Collection<ScheduleId> scheduleIds) {
        run("removeSchedules", () -> delegate.removeSchedules(scheduleIds));
    }

    @Override
    public List<Schedule> getSchedules() {
        return call("getSchedules", () -> delegate.getSchedules());
    }

    @Override
    public List<Schedule> getSchedules(Collection<ScheduleId> scheduleIds) {
        return call("getSchedules", () -> delegate.getSchedules(scheduleIds));
    }

    @Override
    public List<Schedule> acquireSchedules(InstanceId schedulerId, Duration leaseDuration, int limit) {
        return call("acquireSchedules", () -> delegate.acquireSchedules(schedulerId, leaseDuration, limit));
    }

    @Override
    public void releaseSchedules(InstanceId schedulerId, List<ScheduleUpdate> updates) {
        run("releaseSchedules", () -> delegate.releaseSchedules(schedulerId, updates));
    }

    @Override
    public void extendScheduleLeases(InstanceId schedulerId, Collection<ScheduleId> scheduleIds, Duration leaseDuration) {
        run("extendScheduleLeases", () -> delegate.extendScheduleLeases(schedulerId, scheduleIds, leaseDuration));
    }

    @Override
    public Optional<Instant> getNextScheduleRunTime() {
        return call("getNextScheduleRunTime", delegate::getNextScheduleRunTime);
    }

    @Override
    public void addJob(Job job) {
        run("addJob", () -> delegate.addJob(job));
    }

    @Override
    public List<Job> getJobs() {
        return call("getJobs", () -> delegate.getJobs());
    }

    @Override
    public List<Job> getJobs(Collection<JobId> jobIds) {
        return call("getJobs", () -> delegate.getJobs(jobIds));
    }

    @Override
    public List<Job> acquireJobs(InstanceId workerId, Duration leaseDuration, int limit) {
        return call("acquireJobs", () -> delegate.acquireJobs(workerId, leaseDuration, limit));
    }

    @Override
    public void extendJobLeases(InstanceId workerId, Collection<JobId> jobIds, Duration leaseDuration) {
        run("extendJobLeases", () -> delegate.extendJobLeases(workerId, jobIds, leaseDuration));
    }

    @Override
    public void releaseJob(InstanceId workerId, TaskId taskId, JobResult result) {
        run("releaseJob", () -> delegate.releaseJob(workerId, taskId, result));
    }

    @Override
    public boolean cancelJob(JobId jobId) {
        return call("cancelJob", () -> delegate.cancelJob(jobId));
    }

    @Override
    public Optional<JobResult> getJobResult(JobId jobId) {
        return call("getJobResult", () -> delegate.getJobResult(jobId));
    }

    @Override
    public void cleanup() {
        run("cleanup", delegate::cleanup);
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (DataStoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.error("DataStore operation {} failed after {} attempts", operation, attempt, e);
                    throw e;
                }
                long delayMs = backoffCalculator.calculate(attempt);
                log.warn("DataStore operation {} failed (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }
}
