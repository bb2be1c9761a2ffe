package com.ryuqq.workflow.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose current instant is set by the test.
 *
 * <p>Used to test TTL expiry and elapsed-time bookkeeping without sleeping.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> instant;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(new AtomicReference<>(start), ZoneOffset.UTC);
    }

    private MutableClock(AtomicReference<Instant> instant, ZoneId zone) {
        if (instant.get() == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param amount the amount to advance by
     */
    public void advance(Duration amount) {
        instant.updateAndGet(current -> current.plus(amount));
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

    /**
     * Returns a view in another zone that shares this clock's instant.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant.get();
    }
}
