package io.entityforge.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/** Manually driven clock for tests and simulations. Copies from {@link #withZone} share the same time. */
public final class ArtificialClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public ArtificialClock(Instant start) {
        this(new AtomicReference<>(Objects.requireNonNull(start)), ZoneOffset.UTC);
    }

    private ArtificialClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    public Instant advance(Duration by) {
        if (by.isNegative()) throw new IllegalArgumentException("cannot move time backwards: " + by);
        return now.updateAndGet(t -> t.plus(by));
    }

    public void set(Instant instant) {
        now.set(Objects.requireNonNull(instant));
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ArtificialClock(now, zone);
    }

    @Override
    public String toString() {
        return "ArtificialClock[" + now.get() + "]";
    }
}
