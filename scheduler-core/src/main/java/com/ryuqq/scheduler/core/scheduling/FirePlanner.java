package com.ryuqq.scheduler.core.scheduling;

import com.ryuqq.scheduler.core.exception.TriggerExhaustedException;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.trigger.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 도래한 Schedule의 실행 시각 계산 (병합, 지연 판정, 다음 시각).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. nextFireTime부터 Trigger를 반복 호출하여 now 이전의 실행 시각을 모두 수집
 *    (최근 maxCatchUp개만 유지, 넘으면 오래된 시각부터 버림)
 * 2. 병합 정책 적용
 *    - LATEST: 마지막 하나
 *    - EARLIEST: 처음 하나
 *    - ALL: 수집한 전부
 * 3. 지연 판정: now &gt; fireTime + misfireGraceTime 이면 missed
 * 4. now 이후의 첫 실행 시각을 nextFireTime으로 (없으면 null = 종료)
 * </pre>
 *
 * <p>misfireGraceTime은 Schedule 설정이 우선이며, 없으면 Task 설정을 따릅니다.
 * 둘 다 없으면 지연 허용 시간은 무제한입니다.</p>
 *
 * <p>이 클래스는 상태가 없고 스레드 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FirePlanner {

    public static final int DEFAULT_MAX_CATCH_UP = 1000;

    private final int maxCatchUp;

    public FirePlanner() {
        this(DEFAULT_MAX_CATCH_UP);
    }

    /**
     * 생성자.
     *
     * @param maxCatchUp 한 번에 수집할 최대 실행 시각 수 (양수)
     * @throws IllegalArgumentException maxCatchUp이 양수가 아닌 경우
     */
    public FirePlanner(int maxCatchUp) {
        if (maxCatchUp <= 0) {
            throw new IllegalArgumentException("maxCatchUp must be positive (current: " + maxCatchUp + ")");
        }
        this.maxCatchUp = maxCatchUp;
    }

    /**
     * 실행 계획 계산.
     *
     * @param schedule 획득한 Schedule
     * @param task Schedule의 Task (없으면 null)
     * @param now 현재 시각
     * @return 실행 계획
     */
    public FirePlan plan(Schedule schedule, Task task, Instant now) {
        Trigger trigger = schedule.trigger();
        Deque<Instant> window = new ArrayDeque<>();
        Instant fireTime = schedule.nextFireTime();
        boolean truncated = false;

        try {
            while (fireTime != null && !fireTime.isAfter(now)) {
                if (window.size() >= maxCatchUp) {
                    // 상한 초과: 가장 오래된 시각을 버림 (Trigger 격자는 그대로 따라감)
                    window.pollFirst();
                    truncated = true;
                }
                window.addLast(fireTime);
                fireTime = trigger.next(fireTime, now).orElse(null);
            }
        } catch (TriggerExhaustedException e) {
            fireTime = null;
        }
        List<Instant> collected = new ArrayList<>(window);

        Duration grace = resolveGraceTime(schedule, task);
        List<FireOccurrence> occurrences = new ArrayList<>();
        for (Instant selected : coalesce(schedule, collected)) {
            Instant deadline = grace != null ? selected.plus(grace) : null;
            boolean missed = deadline != null && now.isAfter(deadline);
            occurrences.add(new FireOccurrence(selected, deadline, missed));
        }

        Instant lastFireTime = collected.isEmpty() ? schedule.lastFireTime() : collected.get(collected.size() - 1);
        return new FirePlan(occurrences, fireTime, lastFireTime, truncated);
    }

    private static List<Instant> coalesce(Schedule schedule, List<Instant> collected) {
        if (collected.isEmpty()) {
            return List.of();
        }
        return switch (schedule.coalesce()) {
            case LATEST -> List.of(collected.get(collected.size() - 1));
            case EARLIEST -> List.of(collected.get(0));
            case ALL -> collected;
        };
    }

    private static Duration resolveGraceTime(Schedule schedule, Task task) {
        if (schedule.misfireGraceTime() != null) {
            return schedule.misfireGraceTime();
        }
        return task != null ? task.misfireGraceTime() : null;
    }

    public int getMaxCatchUp() {
        return maxCatchUp;
    }
}
