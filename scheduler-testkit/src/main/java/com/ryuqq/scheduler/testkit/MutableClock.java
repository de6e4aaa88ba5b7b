package com.ryuqq.scheduler.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose current instant is moved explicitly by the test.
 *
 * <p>Lease expiry, result expiry and misfire checks all read the DataStore clock,
 * so contract tests advance this clock instead of sleeping.</p>
 *
 * <p>Thread-safe: the instant is held in an {@link AtomicReference}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MutableClock extends Clock {

    private final AtomicReference<Instant> instant;
    private final ZoneId zone;

    public MutableClock(Instant initial) {
        this(initial, ZoneOffset.UTC);
    }

    public MutableClock(Instant initial, ZoneId zone) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        this.instant = new AtomicReference<>(initial);
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (must not be negative)
     * @return the new current instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative, but was: " + duration);
        }
        return instant.updateAndGet(current -> current.plus(duration));
    }

    public void setInstant(Instant newInstant) {
        if (newInstant == null) {
            throw new IllegalArgumentException("newInstant cannot be null");
        }
        instant.set(newInstant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new MutableClock(instant.get(), newZone);
    }

    @Override
    public Instant instant() {
        return instant.get();
    }
}
