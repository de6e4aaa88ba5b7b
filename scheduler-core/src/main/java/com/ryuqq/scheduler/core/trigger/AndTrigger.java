package com.ryuqq.scheduler.core.trigger;

import com.ryuqq.scheduler.core.exception.MaxIterationsReachedException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 모든 하위 Trigger가 (threshold 이내로) 동의하는 시각에 실행.
 *
 * <p>하위 Trigger의 다음 시각이 서로 threshold 이내이면 그중 가장 이른 시각을 반환합니다.
 * 그렇지 않으면 가장 이른 시각과 threshold 이내에 있는 Trigger들을 각자의 다음 시각으로
 * 전진시키고 다시 비교합니다.</p>
 *
 * <p>하위 Trigger 중 하나라도 종료되면 이 Trigger도 종료됩니다.
 * maxIterations 안에 수렴하지 못하면 {@link MaxIterationsReachedException}이 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param triggers 하위 Trigger (1개 이상)
 * @param threshold 허용 시각 차이 (기본 1초)
 * @param maxIterations 최대 반복 횟수 (기본 10000)
 */
public record AndTrigger(List<Trigger> triggers, Duration threshold, int maxIterations) implements Trigger {

    public static final Duration DEFAULT_THRESHOLD = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    public AndTrigger {
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("triggers cannot be null or empty");
        }
        triggers = List.copyOf(triggers);
        if (threshold == null) {
            threshold = DEFAULT_THRESHOLD;
        }
        if (threshold.isNegative()) {
            throw new IllegalArgumentException("threshold cannot be negative (current: " + threshold + ")");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive (current: " + maxIterations + ")");
        }
    }

    /**
     * 기본 threshold와 반복 상한으로 생성.
     *
     * @param triggers 하위 Trigger
     * @return AndTrigger 인스턴스
     */
    public static AndTrigger of(Trigger... triggers) {
        return new AndTrigger(List.of(triggers), DEFAULT_THRESHOLD, DEFAULT_MAX_ITERATIONS);
    }

    @Override
    public Optional<Instant> next(Instant previousFireTime, Instant now) {
        List<Instant> fireTimes = new ArrayList<>(triggers.size());
        for (Trigger trigger : triggers) {
            Optional<Instant> fireTime = trigger.next(previousFireTime, now);
            if (fireTime.isEmpty()) {
                return Optional.empty();
            }
            fireTimes.add(fireTime.get());
        }

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Instant earliest = fireTimes.get(0);
            Instant latest = fireTimes.get(0);
            for (Instant fireTime : fireTimes) {
                if (fireTime.isBefore(earliest)) {
                    earliest = fireTime;
                }
                if (fireTime.isAfter(latest)) {
                    latest = fireTime;
                }
            }

            if (Duration.between(earliest, latest).compareTo(threshold) <= 0) {
                return Optional.of(earliest);
            }

            for (int i = 0; i < triggers.size(); i++) {
                Instant fireTime = fireTimes.get(i);
                if (Duration.between(earliest, fireTime).compareTo(threshold) <= 0) {
                    Optional<Instant> advanced = triggers.get(i).next(fireTime, now);
                    if (advanced.isEmpty()) {
                        return Optional.empty();
                    }
                    fireTimes.set(i, advanced.get());
                }
            }
        }
        throw new MaxIterationsReachedException(maxIterations);
    }
}
