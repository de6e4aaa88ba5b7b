package com.ryuqq.scheduler.adapter.inmemory.store;

import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.JobAcquired;
import com.ryuqq.scheduler.core.event.JobAdded;
import com.ryuqq.scheduler.core.event.JobReleased;
import com.ryuqq.scheduler.core.event.ScheduleAdded;
import com.ryuqq.scheduler.core.event.ScheduleRemoved;
import com.ryuqq.scheduler.core.event.ScheduleUpdated;
import com.ryuqq.scheduler.core.event.TaskAdded;
import com.ryuqq.scheduler.core.event.TaskRemoved;
import com.ryuqq.scheduler.core.event.TaskUpdated;
import com.ryuqq.scheduler.core.exception.ConflictException;
import com.ryuqq.scheduler.core.exception.LeaseExpiredException;
import com.ryuqq.scheduler.core.exception.TaskLookupException;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.JobError;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.ScheduleUpdate;
import com.ryuqq.scheduler.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DataStore} SPI for tests and single-process deployments.
 *
 * <p>Each logical table has its own {@link ReentrantLock} (tasks, schedules, jobs with their
 * results and running counts), so every SPI call is atomic with respect to other callers sharing
 * this instance. No call holds two table locks at once. Events are collected while a lock is
 * held and published after it is released, so subscribers never run under a lock.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>tasks:</strong> LinkedHashMap&lt;TaskId, Task&gt;</li>
 *   <li><strong>schedules:</strong> LinkedHashMap&lt;ScheduleId, Schedule&gt;</li>
 *   <li><strong>jobs:</strong> LinkedHashMap&lt;JobId, Job&gt; - insertion order is acquisition order</li>
 *   <li><strong>results:</strong> HashMap&lt;JobId, JobResult&gt; - read-once, removed on expiry</li>
 *   <li><strong>runningJobCounts:</strong> HashMap&lt;TaskId, Integer&gt; - RUNNING jobs per task</li>
 * </ul>
 *
 * <p><strong>Time:</strong> every lease and expiry comparison uses the injected {@link Clock}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Shared only by schedulers inside the same JVM</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDataStore implements DataStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDataStore.class);

    static final String ABANDONED_JOB_ERROR = "AbandonedJob";

    private final Clock clock;
    private final ReentrantLock taskLock = new ReentrantLock();
    private final ReentrantLock scheduleLock = new ReentrantLock();
    private final ReentrantLock jobLock = new ReentrantLock();

    private final Map<TaskId, Task> tasks = new LinkedHashMap<>();
    private final Map<ScheduleId, Schedule> schedules = new LinkedHashMap<>();
    private final Map<JobId, Job> jobs = new LinkedHashMap<>();
    private final Map<JobId, JobResult> results = new HashMap<>();
    private final Map<TaskId, Integer> runningJobCounts = new HashMap<>();

    private volatile EventBroker eventBroker;

    public InMemoryDataStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDataStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void start(EventBroker eventBroker) {
        if (eventBroker == null) {
            throw new IllegalArgumentException("eventBroker cannot be null");
        }
        this.eventBroker = eventBroker;
        log.debug("InMemoryDataStore started");
    }

    @Override
    public void stop() {
        this.eventBroker = null;
        log.debug("InMemoryDataStore stopped");
    }

    // ============================================================
    // Tasks
    // ============================================================

    @Override
    public void addTask(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        Event event;
        taskLock.lock();
        try {
            Task previous = tasks.put(task.id(), task);
            event = previous == null
                    ? new TaskAdded(clock.instant(), task.id())
                    : new TaskUpdated(clock.instant(), task.id());
        } finally {
            taskLock.unlock();
        }
        publish(List.of(event));
    }

    @Override
    public Optional<Task> getTask(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        taskLock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            taskLock.unlock();
        }
    }

    @Override
    public List<Task> getTasks() {
        taskLock.lock();
        try {
            return List.copyOf(tasks.values());
        } finally {
            taskLock.unlock();
        }
    }

    @Override
    public void removeTask(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        taskLock.lock();
        try {
            if (tasks.remove(taskId) == null) {
                throw new TaskLookupException(taskId);
            }
        } finally {
            taskLock.unlock();
        }
        publish(List.of(new TaskRemoved(clock.instant(), taskId)));
    }

    // ============================================================
    // Schedules
    // ============================================================

    @Override
    public void addSchedule(Schedule schedule, ConflictPolicy conflictPolicy) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule cannot be null");
        }
        if (conflictPolicy == null) {
            throw new IllegalArgumentException("conflictPolicy cannot be null");
        }
        Event event;
        scheduleLock.lock();
        try {
            Schedule existing = schedules.get(schedule.id());
            if (existing == null) {
                event = new ScheduleAdded(clock.instant(), schedule.id(), schedule.taskId(), schedule.nextFireTime());
            } else {
                switch (conflictPolicy) {
                    case EXCEPTION -> throw new ConflictException(
                            "Schedule already exists: " + schedule.id().getValue());
                    case DO_NOTHING -> {
                        return;
                    }
                    default -> {
                    }
                }
                event = new ScheduleUpdated(clock.instant(), schedule.id(), schedule.taskId(), schedule.nextFireTime());
            }
            // 처리 중인 Schedule을 교체해도 리스 소유자는 유지 (반납 시 새 설정 위에 실행 시각만 반영)
            Schedule stored = existing != null && existing.leaseLiveAt(clock.instant())
                    ? schedule.withLease(existing.acquiredBy(), existing.acquiredUntil())
                    : schedule.withoutLease();
            schedules.put(schedule.id(), stored);
        } finally {
            scheduleLock.unlock();
        }
        publish(List.of(event));
    }

    @Override
    public void removeSchedules(Collection<ScheduleId> scheduleIds) {
        if (scheduleIds == null) {
            throw new IllegalArgumentException("scheduleIds cannot be null");
        }
        List<Event> events = new ArrayList<>();
        scheduleLock.lock();
        try {
            Instant now = clock.instant();
            for (ScheduleId scheduleId : scheduleIds) {
                Schedule removed = schedules.remove(scheduleId);
                if (removed != null) {
                    events.add(new ScheduleRemoved(now, scheduleId, removed.taskId(), false));
                }
            }
        } finally {
            scheduleLock.unlock();
        }
        publish(events);
    }

    @Override
    public List<Schedule> getSchedules() {
        scheduleLock.lock();
        try {
            return List.copyOf(schedules.values());
        } finally {
            scheduleLock.unlock();
        }
    }

    @Override
    public List<Schedule> getSchedules(Collection<ScheduleId> scheduleIds) {
        if (scheduleIds == null) {
            throw new IllegalArgumentException("scheduleIds cannot be null");
        }
        scheduleLock.lock();
        try {
            return scheduleIds.stream()
                    .map(schedules::get)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
        } finally {
            scheduleLock.unlock();
        }
    }

    @Override
    public List<Schedule> acquireSchedules(InstanceId schedulerId, Duration leaseDuration, int limit) {
        validateLeaseRequest(schedulerId, leaseDuration, limit);
        scheduleLock.lock();
        try {
            Instant now = clock.instant();
            Instant acquiredUntil = now.plus(leaseDuration);
            List<Schedule> acquired = schedules.values().stream()
                    .filter(schedule -> schedule.dueAt(now))
                    .filter(schedule -> !schedule.leaseLiveAt(now))
                    .sorted(Comparator.comparing(Schedule::nextFireTime))
                    .limit(limit)
                    .map(schedule -> schedule.withLease(schedulerId, acquiredUntil))
                    .collect(Collectors.toList());
            for (Schedule schedule : acquired) {
                schedules.put(schedule.id(), schedule);
            }
            return acquired;
        } finally {
            scheduleLock.unlock();
        }
    }

    @Override
    public void releaseSchedules(InstanceId schedulerId, List<ScheduleUpdate> updates) {
        if (schedulerId == null) {
            throw new IllegalArgumentException("schedulerId cannot be null");
        }
        if (updates == null) {
            throw new IllegalArgumentException("updates cannot be null");
        }
        List<Event> events = new ArrayList<>();
        List<String> lost = new ArrayList<>();
        scheduleLock.lock();
        try {
            Instant now = clock.instant();
            for (ScheduleUpdate update : updates) {
                Schedule current = schedules.get(update.scheduleId());
                if (current == null) {
                    // removed while leased
                    continue;
                }
                if (!schedulerId.equals(current.acquiredBy())) {
                    lost.add(update.scheduleId().getValue());
                    continue;
                }
                if (update.finished()) {
                    schedules.remove(update.scheduleId());
                    events.add(new ScheduleRemoved(now, current.id(), current.taskId(), true));
                } else {
                    Schedule released = current
                            .withFireTimes(update.nextFireTime(), update.lastFireTime())
                            .withoutLease();
                    schedules.put(released.id(), released);
                    events.add(new ScheduleUpdated(now, released.id(), released.taskId(), released.nextFireTime()));
                }
            }
        } finally {
            scheduleLock.unlock();
        }
        publish(events);
        if (!lost.isEmpty()) {
            throw new LeaseExpiredException("Schedule leases no longer held by " + schedulerId.getValue(), lost);
        }
    }

    @Override
    public void extendScheduleLeases(InstanceId schedulerId, Collection<ScheduleId> scheduleIds, Duration leaseDuration) {
        if (schedulerId == null || scheduleIds == null || leaseDuration == null) {
            throw new IllegalArgumentException("schedulerId, scheduleIds and leaseDuration cannot be null");
        }
        List<String> lost = new ArrayList<>();
        scheduleLock.lock();
        try {
            Instant acquiredUntil = clock.instant().plus(leaseDuration);
            for (ScheduleId scheduleId : scheduleIds) {
                Schedule current = schedules.get(scheduleId);
                if (current == null || !schedulerId.equals(current.acquiredBy())) {
                    lost.add(scheduleId.getValue());
                    continue;
                }
                schedules.put(scheduleId, current.withLease(schedulerId, acquiredUntil));
            }
        } finally {
            scheduleLock.unlock();
        }
        if (!lost.isEmpty()) {
            throw new LeaseExpiredException("Schedule leases no longer held by " + schedulerId.getValue(), lost);
        }
    }

    @Override
    public Optional<Instant> getNextScheduleRunTime() {
        scheduleLock.lock();
        try {
            Instant now = clock.instant();
            return schedules.values().stream()
                    .filter(schedule -> !schedule.paused() && schedule.nextFireTime() != null)
                    .map(schedule -> schedule.leaseLiveAt(now) && schedule.acquiredUntil().isAfter(schedule.nextFireTime())
                            ? schedule.acquiredUntil()
                            : schedule.nextFireTime())
                    .min(Comparator.naturalOrder());
        } finally {
            scheduleLock.unlock();
        }
    }

    // ============================================================
    // Jobs
    // ============================================================

    @Override
    public void addJob(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (job.status() != JobStatus.PENDING && job.status() != JobStatus.MISSED) {
            throw new IllegalArgumentException("job must be PENDING or MISSED, but was: " + job.status());
        }
        List<Event> events = new ArrayList<>();
        jobLock.lock();
        try {
            Instant now = clock.instant();
            events.add(new JobAdded(now, job.id(), job.taskId(), job.scheduleId()));
            if (job.status() == JobStatus.MISSED) {
                JobResult result = JobResult.missed(job, now);
                storeResult(result);
                events.add(released(now, job, result));
            } else {
                jobs.put(job.id(), job);
            }
        } finally {
            jobLock.unlock();
        }
        publish(events);
    }

    @Override
    public List<Job> getJobs() {
        jobLock.lock();
        try {
            return List.copyOf(jobs.values());
        } finally {
            jobLock.unlock();
        }
    }

    @Override
    public List<Job> getJobs(Collection<JobId> jobIds) {
        if (jobIds == null) {
            throw new IllegalArgumentException("jobIds cannot be null");
        }
        jobLock.lock();
        try {
            return jobIds.stream()
                    .map(jobs::get)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
        } finally {
            jobLock.unlock();
        }
    }

    @Override
    public List<Job> acquireJobs(InstanceId workerId, Duration leaseDuration, int limit) {
        validateLeaseRequest(workerId, leaseDuration, limit);
        Map<TaskId, Integer> limits = maxRunningJobsByTask();
        List<Event> events = new ArrayList<>();
        List<Job> acquired = new ArrayList<>();
        jobLock.lock();
        try {
            Instant now = clock.instant();
            releaseAbandonedJobs(now, events);

            Instant acquiredUntil = now.plus(leaseDuration);
            for (Job job : List.copyOf(jobs.values())) {
                if (acquired.size() >= limit) {
                    break;
                }
                if (job.status() != JobStatus.PENDING || !hasFreeSlot(job.taskId(), limits)) {
                    continue;
                }
                Job running = job.withStatus(JobStatus.RUNNING).withLease(workerId, acquiredUntil);
                jobs.put(running.id(), running);
                runningJobCounts.merge(running.taskId(), 1, Integer::sum);
                acquired.add(running);
                events.add(new JobAcquired(now, running.id(), running.taskId(), running.scheduleId(), workerId));
            }
        } finally {
            jobLock.unlock();
        }
        publish(events);
        return acquired;
    }

    @Override
    public void extendJobLeases(InstanceId workerId, Collection<JobId> jobIds, Duration leaseDuration) {
        if (workerId == null || jobIds == null || leaseDuration == null) {
            throw new IllegalArgumentException("workerId, jobIds and leaseDuration cannot be null");
        }
        List<String> lost = new ArrayList<>();
        jobLock.lock();
        try {
            Instant acquiredUntil = clock.instant().plus(leaseDuration);
            for (JobId jobId : jobIds) {
                Job current = jobs.get(jobId);
                if (current == null || !workerId.equals(current.acquiredBy())) {
                    lost.add(jobId.getValue());
                    continue;
                }
                jobs.put(jobId, current.withLease(workerId, acquiredUntil));
            }
        } finally {
            jobLock.unlock();
        }
        if (!lost.isEmpty()) {
            throw new LeaseExpiredException("Job leases no longer held by " + workerId.getValue(), lost);
        }
    }

    @Override
    public void releaseJob(InstanceId workerId, TaskId taskId, JobResult result) {
        if (workerId == null || taskId == null || result == null) {
            throw new IllegalArgumentException("workerId, taskId and result cannot be null");
        }
        Event event;
        jobLock.lock();
        try {
            Job current = jobs.get(result.jobId());
            if (current == null || !workerId.equals(current.acquiredBy())) {
                throw new LeaseExpiredException("Job lease no longer held by " + workerId.getValue(),
                        List.of(result.jobId().getValue()));
            }
            jobs.remove(current.id());
            decrementRunning(taskId);
            storeResult(result);
            event = released(clock.instant(), current, result);
        } finally {
            jobLock.unlock();
        }
        publish(List.of(event));
    }

    @Override
    public boolean cancelJob(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        Event event;
        jobLock.lock();
        try {
            Job current = jobs.get(jobId);
            if (current == null || current.status() != JobStatus.PENDING) {
                return false;
            }
            jobs.remove(jobId);
            Instant now = clock.instant();
            JobResult result = JobResult.cancelled(current, null, now);
            storeResult(result);
            event = released(now, current, result);
        } finally {
            jobLock.unlock();
        }
        publish(List.of(event));
        return true;
    }

    @Override
    public Optional<JobResult> getJobResult(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        jobLock.lock();
        try {
            JobResult result = results.remove(jobId);
            if (result == null || result.expiredAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(result);
        } finally {
            jobLock.unlock();
        }
    }

    @Override
    public void cleanup() {
        List<Event> events = new ArrayList<>();
        int expired;
        jobLock.lock();
        try {
            Instant now = clock.instant();
            int before = results.size();
            results.values().removeIf(result -> result.expiredAt(now));
            expired = before - results.size();
            releaseAbandonedJobs(now, events);
        } finally {
            jobLock.unlock();
        }
        publish(events);
        if (expired > 0 || !events.isEmpty()) {
            log.debug("Cleanup removed {} expired results and released {} abandoned jobs", expired, events.size());
        }
    }

    // ============================================================
    // Test helpers
    // ============================================================

    /**
     * Clears all tables. Test helper method.
     */
    public void clear() {
        taskLock.lock();
        try {
            tasks.clear();
        } finally {
            taskLock.unlock();
        }
        scheduleLock.lock();
        try {
            schedules.clear();
        } finally {
            scheduleLock.unlock();
        }
        jobLock.lock();
        try {
            jobs.clear();
            results.clear();
            runningJobCounts.clear();
        } finally {
            jobLock.unlock();
        }
    }

    /**
     * Returns the number of RUNNING jobs for a task. Test helper method.
     *
     * @param taskId task id
     * @return running job count
     */
    public int runningJobCount(TaskId taskId) {
        jobLock.lock();
        try {
            return runningJobCounts.getOrDefault(taskId, 0);
        } finally {
            jobLock.unlock();
        }
    }

    // ============================================================
    // Internals (caller holds jobLock unless noted)
    // ============================================================

    private void releaseAbandonedJobs(Instant now, List<Event> events) {
        Iterator<Job> iterator = jobs.values().iterator();
        while (iterator.hasNext()) {
            Job job = iterator.next();
            if (job.status() != JobStatus.RUNNING || job.leaseLiveAt(now)) {
                continue;
            }
            iterator.remove();
            decrementRunning(job.taskId());
            JobError error = JobError.of(ABANDONED_JOB_ERROR,
                    "Worker " + job.acquiredBy().getValue() + " lost the job lease at " + job.acquiredUntil());
            JobResult result = JobResult.failure(job, error, null, now);
            storeResult(result);
            events.add(released(now, job, result));
            log.warn("Released abandoned job {} of task {} (worker: {})",
                    job.id().getValue(), job.taskId().getValue(), job.acquiredBy().getValue());
        }
    }

    private Map<TaskId, Integer> maxRunningJobsByTask() {
        taskLock.lock();
        try {
            Map<TaskId, Integer> limits = new HashMap<>();
            for (Task task : tasks.values()) {
                if (task.maxRunningJobs() != null) {
                    limits.put(task.id(), task.maxRunningJobs());
                }
            }
            return limits;
        } finally {
            taskLock.unlock();
        }
    }

    private boolean hasFreeSlot(TaskId taskId, Map<TaskId, Integer> limits) {
        Integer limit = limits.get(taskId);
        if (limit == null) {
            return true;
        }
        return runningJobCounts.getOrDefault(taskId, 0) < limit;
    }

    private void decrementRunning(TaskId taskId) {
        runningJobCounts.computeIfPresent(taskId, (key, count) -> count > 1 ? count - 1 : null);
    }

    private void storeResult(JobResult result) {
        if (result.expiresAt().isAfter(result.finishedAt())) {
            results.put(result.jobId(), result);
        }
    }

    private static JobReleased released(Instant now, Job job, JobResult result) {
        return new JobReleased(now, job.id(), job.taskId(), job.scheduleId(), result.status(), job.scheduledFireTime());
    }

    private static void validateLeaseRequest(InstanceId instanceId, Duration leaseDuration, int limit) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (leaseDuration == null || leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive, but was: " + leaseDuration);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
    }

    private void publish(List<Event> events) {
        EventBroker broker = this.eventBroker;
        if (broker == null) {
            return;
        }
        for (Event event : events) {
            try {
                broker.publish(event);
            } catch (RuntimeException e) {
                log.error("Failed to publish {} after commit", event.topic().getValue(), e);
            }
        }
    }
}
