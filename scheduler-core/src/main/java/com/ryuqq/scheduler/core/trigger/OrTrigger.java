package com.ryuqq.scheduler.core.trigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 하위 Trigger들의 실행 시각을 시간 순으로 모두 사용.
 *
 * <p>여러 하위 Trigger가 같은 시각을 만들면 한 번만 실행합니다.
 * 모든 하위 Trigger가 종료되어야 이 Trigger도 종료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param triggers 하위 Trigger (1개 이상)
 */
public record OrTrigger(List<Trigger> triggers) implements Trigger {

    public OrTrigger {
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("triggers cannot be null or empty");
        }
        triggers = List.copyOf(triggers);
    }

    public static OrTrigger of(Trigger... triggers) {
        return new OrTrigger(List.of(triggers));
    }

    @Override
    public Optional<Instant> next(Instant previousFireTime, Instant now) {
        Instant earliest = null;
        for (Trigger trigger : triggers) {
            Optional<Instant> fireTime = trigger.next(previousFireTime, now);
            if (fireTime.isPresent() && (earliest == null || fireTime.get().isBefore(earliest))) {
                earliest = fireTime.get();
            }
        }
        return Optional.ofNullable(earliest);
    }
}
