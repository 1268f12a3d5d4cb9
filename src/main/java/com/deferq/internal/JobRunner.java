package com.deferq.internal;

import com.deferq.Job;
import com.deferq.JobRepository;
import com.deferq.RunOutcome;
import com.deferq.RunResult;
import com.deferq.SchedulingInvariantViolationException;
import com.deferq.time.JobClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Executes one job: lock it, count the attempt, invoke it, then reschedule,
 * delete or record the failure. Every step is persisted before the next one
 * starts.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobLoader jobLoader;
    private final RecordLocker recordLocker;
    private final JobRepository jobRepository;
    private final RescheduleCalculator rescheduleCalculator;
    private final JobClock clock;

    public JobRunner(
            JobLoader jobLoader,
            RecordLocker recordLocker,
            JobRepository jobRepository,
            RescheduleCalculator rescheduleCalculator,
            JobClock clock) {
        this.jobLoader = jobLoader;
        this.recordLocker = recordLocker;
        this.jobRepository = jobRepository;
        this.rescheduleCalculator = rescheduleCalculator;
        this.clock = clock;
    }

    /**
     * Runs the job now, whatever its {@code perform_at}.
     *
     * @throws SchedulingInvariantViolationException if the job is recurring and
     *         its frequency does not move time forward; the failure is stored on
     *         the record and its lock released before this is thrown
     */
    public RunResult run(long id) {
        Optional<LoadedJob> loaded = jobLoader.load(id);
        if (loaded.isEmpty()) {
            log.debug("Job {} does not exist", id);
            return RunResult.notFound(id);
        }

        Job job = loaded.get().job();
        RegisteredJobType type = loaded.get().type();

        if (type.isMalformed()) {
            log.error("{} class does not declare any usable perform() method. Removing job {}.",
                    job.getName(), id);
            jobRepository.deleteJobById(id);
            return new RunResult(id, job.getName(), RunOutcome.MALFORMED_JOB_TYPE, Duration.ZERO);
        }

        if (!recordLocker.acquire(job)) {
            log.debug("Job {} ({}) is locked by another worker", id, job.getName());
            return new RunResult(id, job.getName(), RunOutcome.LOCK_CONTENTION, Duration.ZERO);
        }

        long started = System.nanoTime();

        jobRepository.incrementAttempts(id, clock.now());
        job.setNumberAttempts(job.getNumberAttempts() + 1);

        try {
            type.invoker().invoke(job.getArguments());
        } catch (Exception | LinkageError | AssertionError | StackOverflowError e) {
            log.error("Job {} ({}) failed on attempt {}", id, job.getName(), job.getNumberAttempts(), e);
            recordFailure(job, e);
            return new RunResult(id, job.getName(), RunOutcome.FAILED, elapsedSince(started));
        }

        if (job.isRecurring()) {
            OffsetDateTime next = nextOccurrenceOrFail(job);
            jobRepository.reschedule(id, next, clock.now());
            job.setPerformAt(next);
            recordLocker.release(job);
            log.debug("Job {} ({}) done, next run at {}", id, job.getName(), next);
        } else {
            jobRepository.deleteJobById(id);
            log.debug("Job {} ({}) done and removed", id, job.getName());
        }
        return new RunResult(id, job.getName(), RunOutcome.DONE, elapsedSince(started));
    }

    private void recordFailure(Job job, Throwable error) {
        OffsetDateTime next;
        try {
            next = rescheduleCalculator.nextPerformAtAfterFailure(job);
        } catch (SchedulingInvariantViolationException violation) {
            violation.addSuppressed(error);
            storeViolation(job, violation);
            throw violation;
        }
        OffsetDateTime now = clock.now();
        jobRepository.markFailed(job.getId(), stackTraceOf(error), next, now);
        job.setLastError(stackTraceOf(error));
        job.setFailedAt(now);
        job.setPerformAt(next);
        recordLocker.release(job);
    }

    private OffsetDateTime nextOccurrenceOrFail(Job job) {
        try {
            return rescheduleCalculator.nextOccurrence(job);
        } catch (SchedulingInvariantViolationException violation) {
            storeViolation(job, violation);
            throw violation;
        }
    }

    private void storeViolation(Job job, SchedulingInvariantViolationException violation) {
        log.error("Job {} ({}) cannot be rescheduled", job.getId(), job.getName(), violation);
        OffsetDateTime now = clock.now();
        jobRepository.markFailed(job.getId(), stackTraceOf(violation), job.getPerformAt(), now);
        job.setLastError(stackTraceOf(violation));
        job.setFailedAt(now);
        recordLocker.release(job);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString().stripTrailing();
    }
}
