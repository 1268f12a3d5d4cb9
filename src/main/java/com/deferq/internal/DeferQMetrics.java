package com.deferq.internal;

import com.deferq.JobRepository;
import com.deferq.config.DeferQProperties;
import com.deferq.time.JobClock;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class DeferQMetrics {

    private static final Logger log = LoggerFactory.getLogger(DeferQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final JobClock clock;
    private final DeferQProperties properties;
    private final Object snapshotMonitor = new Object();

    private volatile StatusSnapshot cachedSnapshot = StatusSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public DeferQMetrics(JobRepository jobRepository, MeterRegistry meterRegistry, JobClock clock,
            DeferQProperties properties) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.properties = properties;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering DeferQ gauges...");

        for (Status status : Status.values()) {
            Gauge.builder("deferq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of DeferQ jobs")
                    .tag("status", status.tag)
                    .register(meterRegistry);
        }

        Gauge.builder("deferq.jobs.total", this, metrics -> metrics.getSnapshot().total())
                .description("Total number of DeferQ jobs in the database")
                .register(meterRegistry);
    }

    private double countFor(Status status) {
        StatusSnapshot snapshot = getSnapshot();
        return switch (status) {
            case SCHEDULED -> snapshot.scheduled();
            case LOCKED -> snapshot.locked();
            case FAILED -> snapshot.failed();
            case RECURRING -> snapshot.recurring();
        };
    }

    private StatusSnapshot getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private StatusSnapshot loadSnapshot() {
        try {
            JobRepository.StatusCounts counts = jobRepository.countStatuses(
                    clock.ago(properties.getJobs().getLockTimeout()));
            return new StatusSnapshot(
                    countOrZero(counts.getScheduledCount()),
                    countOrZero(counts.getLockedCount()),
                    countOrZero(counts.getFailedCount()),
                    countOrZero(counts.getRecurringCount()),
                    countOrZero(counts.getTotalCount()));
        } catch (Exception e) {
            log.trace("Failed to query status counts for metrics: {}", e.getMessage());
            return StatusSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private enum Status {
        SCHEDULED("scheduled"),
        LOCKED("locked"),
        FAILED("failed"),
        RECURRING("recurring");

        private final String tag;

        Status(String tag) {
            this.tag = tag;
        }
    }

    private record StatusSnapshot(long scheduled, long locked, long failed, long recurring, long total) {
        private static StatusSnapshot empty() {
            return new StatusSnapshot(0, 0, 0, 0, 0);
        }
    }
}
