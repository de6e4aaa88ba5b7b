package com.ryuqq.scheduler.core.trigger;

import java.time.Instant;
import java.util.Optional;

/**
 * 지정한 시각에 한 번만 실행.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runTime 실행 시각
 */
public record DateTrigger(Instant runTime) implements Trigger {

    public DateTrigger {
        if (runTime == null) {
            throw new IllegalArgumentException("runTime cannot be null");
        }
    }

    @Override
    public Optional<Instant> next(Instant previousFireTime, Instant now) {
        if (previousFireTime == null || runTime.isAfter(previousFireTime)) {
            return Optional.of(runTime);
        }
        return Optional.empty();
    }
}
