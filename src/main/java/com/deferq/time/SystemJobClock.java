package com.deferq.time;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

public class SystemJobClock implements JobClock {

    private final Clock clock;

    public SystemJobClock(ZoneId zone) {
        this(Clock.system(zone));
    }

    SystemJobClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    @Override
    public ZoneId zone() {
        return clock.getZone();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        Thread.sleep(duration.toMillis());
    }
}
