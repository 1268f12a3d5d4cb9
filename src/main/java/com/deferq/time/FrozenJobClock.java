package com.deferq.time;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that only moves when told to. {@link #sleep(Duration)} returns
 * immediately after advancing the frozen instant, so worker loops can be
 * driven deterministically.
 */
public class FrozenJobClock implements JobClock {

    private final AtomicReference<Instant> current;
    private final ZoneId zone;

    public FrozenJobClock(Instant start, ZoneId zone) {
        this.current = new AtomicReference<>(start.truncatedTo(ChronoUnit.MICROS));
        this.zone = zone;
    }

    public FrozenJobClock(OffsetDateTime start) {
        this(start.toInstant(), start.getOffset());
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.ofInstant(current.get(), zone);
    }

    @Override
    public ZoneId zone() {
        return zone;
    }

    public void freeze(Instant instant) {
        current.set(instant.truncatedTo(ChronoUnit.MICROS));
    }

    public void advance(Duration duration) {
        current.updateAndGet(instant -> instant.plus(duration).truncatedTo(ChronoUnit.MICROS));
    }

    @Override
    public void sleep(Duration duration) {
        advance(duration);
    }
}
