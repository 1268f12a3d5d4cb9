package com.deferq.time;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Source of "now" for everything that reads or writes job timestamps.
 * Implementations return values truncated to microseconds so they survive a
 * round trip through a {@code timestamptz} column unchanged.
 */
public interface JobClock {

    OffsetDateTime now();

    /**
     * Zone in which recurring frequencies are applied and dates are rendered.
     */
    ZoneId zone();

    default OffsetDateTime fromNow(Duration offset) {
        return now().plus(offset);
    }

    default OffsetDateTime ago(Duration offset) {
        return now().minus(offset);
    }

    /**
     * Blocks the calling thread for the given duration, or advances a frozen
     * clock by the same amount.
     */
    void sleep(Duration duration) throws InterruptedException;
}
