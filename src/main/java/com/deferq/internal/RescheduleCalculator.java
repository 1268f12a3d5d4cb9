package com.deferq.internal;

import com.deferq.Frequency;
import com.deferq.Job;
import com.deferq.SchedulingInvariantViolationException;
import com.deferq.time.JobClock;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

/**
 * Computes the next {@code perform_at} of a job after a run.
 */
@Component
public class RescheduleCalculator {

    private static final long MAX_BACKOFF_ATTEMPTS = 1_000;

    private final JobClock clock;

    public RescheduleCalculator(JobClock clock) {
        this.clock = clock;
    }

    /**
     * Applies the job's frequency to its current {@code perform_at} until the
     * result is strictly after now.
     *
     * @throws SchedulingInvariantViolationException if an application does not
     *         move time forward, or the frequency cannot be parsed
     */
    public OffsetDateTime nextOccurrence(Job job) {
        Frequency frequency;
        try {
            frequency = Frequency.parse(job.getFrequency());
        } catch (IllegalArgumentException e) {
            throw new SchedulingInvariantViolationException(job.getName(), job.getFrequency(), e);
        }

        OffsetDateTime now = clock.now();
        ZonedDateTime date = job.getPerformAt().atZoneSameInstant(clock.zone());
        while (!date.toOffsetDateTime().isAfter(now)) {
            ZonedDateTime next = frequency.applyTo(date);
            if (!next.isAfter(date)) {
                throw new SchedulingInvariantViolationException(job.getName(), job.getFrequency());
            }
            date = next;
        }
        return date.toOffsetDateTime();
    }

    public OffsetDateTime nextRetry(long attempts) {
        return clock.now().plus(retryDelay(attempts));
    }

    public OffsetDateTime nextPerformAtAfterFailure(Job job) {
        if (job.isRecurring()) {
            return nextOccurrence(job);
        }
        return nextRetry(job.getNumberAttempts());
    }

    /**
     * {@code 5 + attempts^4} seconds.
     */
    public static Duration retryDelay(long attempts) {
        long bounded = Math.max(0, Math.min(attempts, MAX_BACKOFF_ATTEMPTS));
        return Duration.ofSeconds(5 + bounded * bounded * bounded * bounded);
    }
}
