package com.deferq.internal;

import com.deferq.Job;
import com.deferq.JobArguments;
import com.deferq.JobRepository;
import com.deferq.time.JobClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;

/**
 * Makes sure every job type declared with {@code @Job(frequency = "...")} has
 * one record in the store when the application starts.
 */
@Component
@ConditionalOnProperty(prefix = "deferq.jobs", name = "bootstrap-recurring", havingValue = "true", matchIfMissing = true)
public class RecurringJobBootstrap implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecurringJobBootstrap.class);
    private static final long BOOTSTRAP_ADVISORY_LOCK_KEY = 5_174_402_377_120_661_223L;

    private final JobRepository jobRepository;
    private final JobTypeRegistry jobTypeRegistry;
    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final JobClock clock;
    private boolean running = false;

    public RecurringJobBootstrap(
            JobRepository jobRepository,
            JobTypeRegistry jobTypeRegistry,
            TransactionTemplate transactionTemplate,
            JdbcTemplate jdbcTemplate,
            JobClock clock) {
        this.jobRepository = jobRepository;
        this.jobTypeRegistry = jobTypeRegistry;
        this.transactionTemplate = transactionTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public void start() {
        log.info("Checking for recurring jobs to bootstrap...");
        for (RegisteredJobType type : jobTypeRegistry.all()) {
            if (type.isRecurring()) {
                bootstrapRecurringJob(type);
            }
        }
        this.running = true;
    }

    private void bootstrapRecurringJob(RegisteredJobType type) {
        try {
            Boolean created = transactionTemplate.execute(status -> {
                // serialises concurrent startups of several workers
                jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", rs -> null, BOOTSTRAP_ADVISORY_LOCK_KEY);
                if (jobRepository.existsByNameAndFrequencyNot(type.type(), "")) {
                    return false;
                }
                OffsetDateTime now = clock.now();
                Job job = new Job(type.type(), JobArguments.empty(), now, type.queue(), type.frequency());
                job.setCreatedAt(now);
                job.setUpdatedAt(now);
                jobRepository.save(job);
                return true;
            });
            if (Boolean.TRUE.equals(created)) {
                log.info("Bootstrapped recurring job {} with frequency '{}'", type.type(), type.frequency());
            } else {
                log.debug("Recurring job {} is already scheduled.", type.type());
            }
        } catch (Exception e) {
            log.error("Failed to bootstrap recurring job {} with frequency '{}'", type.type(), type.frequency(), e);
        }
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        // before the worker loop starts
        return Integer.MAX_VALUE - 1;
    }
}
