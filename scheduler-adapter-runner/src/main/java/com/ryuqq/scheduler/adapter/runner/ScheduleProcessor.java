package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.runtime.Runtime;
import com.ryuqq.scheduler.core.exception.DataStoreUnavailableException;
import com.ryuqq.scheduler.core.exception.LeaseExpiredException;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Job;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.scheduling.FireOccurrence;
import com.ryuqq.scheduler.core.scheduling.FirePlan;
import com.ryuqq.scheduler.core.scheduling.FirePlanner;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.spi.ScheduleUpdate;
import com.ryuqq.scheduler.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 도래한 Schedule을 Job으로 바꾸는 Runtime.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * acquireSchedules(batchSize) → 리스 획득
 *   ↓
 * For each Schedule:
 *   1. FirePlanner.plan() → 실행 시각 목록 (coalesce, misfire 적용)
 *   2. 시각마다 addJob (grace 초과 시각은 MISSED로 기록)
 *   3. ScheduleUpdate 생성 (next/last fire time)
 *   ↓
 * releaseSchedules(updates) → 리스 반납, 완료된 Schedule 삭제
 * </pre>
 *
 * <p>배치 처리가 리스 기간의 절반을 넘기면 배치 전체의 리스를 연장합니다.
 * 개별 Schedule 처리 실패는 로그만 남기고, 이미 추가한 Job까지만 진행한 것으로 반납합니다.
 * DataStore 장애는 그때까지 처리한 Schedule을 반납한 뒤 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScheduleProcessor implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(ScheduleProcessor.class);

    private final DataStore dataStore;
    private final InstanceId instanceId;
    private final Clock clock;
    private final SchedulerLoopConfig config;
    private final FirePlanner firePlanner;

    public ScheduleProcessor(DataStore dataStore, InstanceId instanceId, Clock clock, SchedulerLoopConfig config) {
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
        this.dataStore = dataStore;
        this.instanceId = instanceId;
        this.clock = clock;
        this.config = config;
        this.firePlanner = new FirePlanner(config.maxCatchUp());
    }

    @Override
    public void pump() {
        processBatch();
    }

    /**
     * 한 배치 처리.
     *
     * @return 획득한 Schedule 수 (batchSize와 같으면 더 남아 있을 수 있음)
     */
    public int processBatch() {
        Duration leaseDuration = config.leaseDuration();
        List<Schedule> schedules = dataStore.acquireSchedules(instanceId, leaseDuration, config.batchSize());
        if (schedules.isEmpty()) {
            return 0;
        }
        log.debug("Acquired {} due schedules", schedules.size());

        Map<TaskId, Optional<Task>> tasks = new HashMap<>();
        Set<ScheduleId> lost = new HashSet<>();
        List<ScheduleUpdate> updates = new ArrayList<>(schedules.size());
        Instant heartbeatAt = clock.instant().plus(leaseDuration.dividedBy(2));

        try {
            for (int i = 0; i < schedules.size(); i++) {
                Schedule schedule = schedules.get(i);
                if (!clock.instant().isBefore(heartbeatAt)) {
                    extendLeases(schedules, lost);
                    heartbeatAt = clock.instant().plus(leaseDuration.dividedBy(2));
                }
                if (lost.contains(schedule.id())) {
                    continue;
                }
                processSchedule(schedule, tasks, updates);
            }
        } catch (DataStoreUnavailableException e) {
            // Job을 만든 실행 시각은 전파 전에 반납
            log.warn("Batch aborted, releasing {} processed schedule(s)", updates.size());
            try {
                release(updates);
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }

        release(updates);
        return schedules.size();
    }

    private void release(List<ScheduleUpdate> updates) {
        if (updates.isEmpty()) {
            return;
        }
        try {
            dataStore.releaseSchedules(instanceId, updates);
        } catch (LeaseExpiredException e) {
            log.warn("Schedule leases expired before release: {}", e.getLostIds());
        }
    }

    private void processSchedule(Schedule schedule, Map<TaskId, Optional<Task>> tasks, List<ScheduleUpdate> updates) {
        FirePlan plan = null;
        int created = 0;
        try {
            Instant now = clock.instant();
            Optional<Task> task = tasks.computeIfAbsent(schedule.taskId(), dataStore::getTask);
            plan = firePlanner.plan(schedule, task.orElse(null), now);

            if (plan.truncated()) {
                log.warn("Schedule {} exceeded {} catch-up fire times, older ones were dropped",
                    schedule.id(), config.maxCatchUp());
            }
            if (task.isEmpty()) {
                if (!plan.occurrences().isEmpty()) {
                    log.warn("Task {} of schedule {} does not exist, skipping {} fire time(s)",
                        schedule.taskId(), schedule.id(), plan.occurrences().size());
                }
            } else {
                for (FireOccurrence occurrence : plan.occurrences()) {
                    addJob(schedule, occurrence, now);
                    created++;
                }
            }
            if (plan.finished()) {
                log.info("Schedule {} has no more fire times and will be removed", schedule.id());
            }
            updates.add(new ScheduleUpdate(schedule.id(), plan.nextFireTime(), plan.lastFireTime()));

        } catch (DataStoreUnavailableException e) {
            updates.add(progressUpdate(schedule, plan, created));
            throw e;
        } catch (Exception e) {
            log.error("Failed to process schedule {} after {} job(s)", schedule.id(), created, e);
            updates.add(progressUpdate(schedule, plan, created));
        }
    }

    /**
     * 처리 도중 실패한 Schedule의 반납 내용.
     *
     * <p>이미 추가된 Job의 실행 시각은 지나간 것으로 기록하고,
     * 실패한 실행 시각부터 다음 사이클에서 다시 처리합니다.</p>
     */
    private static ScheduleUpdate progressUpdate(Schedule schedule, FirePlan plan, int created) {
        if (plan == null || created == 0) {
            return ScheduleUpdate.unchanged(schedule);
        }
        List<FireOccurrence> occurrences = plan.occurrences();
        if (created >= occurrences.size()) {
            return new ScheduleUpdate(schedule.id(), plan.nextFireTime(), plan.lastFireTime());
        }
        return new ScheduleUpdate(schedule.id(), occurrences.get(created).fireTime(),
            occurrences.get(created - 1).fireTime());
    }

    private void addJob(Schedule schedule, FireOccurrence occurrence, Instant now) {
        Job job = Job.forSchedule(schedule, occurrence.fireTime(), occurrence.startDeadline(), now);
        if (occurrence.missed()) {
            log.info("Schedule {} missed fire time {} (deadline {})",
                schedule.id(), occurrence.fireTime(), occurrence.startDeadline());
            job = job.withStatus(JobStatus.MISSED);
        }
        dataStore.addJob(job);
    }

    /**
     * 배치의 모든 Schedule 리스 연장. 처리가 끝난 Schedule도 반납 전까지는 리스가 필요합니다.
     */
    private void extendLeases(List<Schedule> batch, Set<ScheduleId> lost) {
        List<ScheduleId> ids = new ArrayList<>(batch.size());
        for (Schedule schedule : batch) {
            if (!lost.contains(schedule.id())) {
                ids.add(schedule.id());
            }
        }
        try {
            dataStore.extendScheduleLeases(instanceId, ids, config.leaseDuration());
        } catch (LeaseExpiredException e) {
            log.warn("Lost schedule leases during batch: {}", e.getLostIds());
            for (String id : e.getLostIds()) {
                lost.add(ScheduleId.of(id));
            }
        }
    }
}
