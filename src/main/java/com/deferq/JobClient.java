package com.deferq;

import com.deferq.config.DeferQProperties;
import com.deferq.internal.JobTypeRegistry;
import com.deferq.internal.RegisteredJobType;
import com.deferq.time.JobClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Schedules jobs. Queue and frequency default to the values declared on the
 * job type's {@link com.deferq.annotation.Job} annotation.
 */
@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobRepository jobRepository;
    private final JobTypeRegistry jobTypeRegistry;
    private final DeferQProperties properties;
    private final JobClock clock;

    public JobClient(JobRepository jobRepository, JobTypeRegistry jobTypeRegistry, DeferQProperties properties,
            JobClock clock) {
        this.jobRepository = jobRepository;
        this.jobTypeRegistry = jobTypeRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Schedule a job to run as soon as a worker is free.
     */
    public long performAsap(String type, Object... args) {
        return enqueue(type, clock.now(), null, null, JobArguments.of(args));
    }

    /**
     * Schedule a job to run at the given date-time.
     */
    public long performLater(String type, OffsetDateTime performAt, Object... args) {
        return enqueue(type, normalizeRequiredPerformAt(performAt), null, null, JobArguments.of(args));
    }

    /**
     * Schedule a job to run at the given instant.
     */
    public long performLater(String type, Instant performAt, Object... args) {
        if (performAt == null) {
            throw new IllegalArgumentException("performAt must not be null");
        }
        return enqueue(type, OffsetDateTime.ofInstant(performAt, clock.zone()), null, null, JobArguments.of(args));
    }

    /**
     * Full enqueue method with all options. A null {@code queue} or
     * {@code frequency} falls back to the job type's declared value.
     */
    public long enqueue(String type, OffsetDateTime performAt, String queue, String frequency,
            JobArguments arguments) {
        String normalizedType = normalizeRequiredType(type);
        OffsetDateTime resolvedPerformAt = normalizeRequiredPerformAt(performAt);
        Optional<RegisteredJobType> registered = jobTypeRegistry.find(normalizedType);
        String resolvedQueue = resolveQueue(queue, registered);
        String resolvedFrequency = resolveFrequency(frequency, registered, resolvedPerformAt);

        OffsetDateTime now = clock.now();
        Job job = new Job(normalizedType, arguments == null ? JobArguments.empty() : arguments,
                resolvedPerformAt, resolvedQueue, resolvedFrequency);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        Job saved = jobRepository.save(job);
        log.debug("Enqueued job {} of type {} in queue {} at {}", saved.getId(), normalizedType, resolvedQueue,
                resolvedPerformAt);
        return saved.getId();
    }

    private String normalizeRequiredType(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        return trimmed;
    }

    private OffsetDateTime normalizeRequiredPerformAt(OffsetDateTime performAt) {
        if (performAt == null) {
            throw new IllegalArgumentException("performAt must not be null");
        }
        return performAt;
    }

    private String resolveQueue(String queue, Optional<RegisteredJobType> registered) {
        if (queue != null && !queue.isBlank()) {
            return queue.trim();
        }
        return registered.map(RegisteredJobType::queue).orElse(properties.getJobs().getDefaultQueue());
    }

    private String resolveFrequency(String frequency, Optional<RegisteredJobType> registered,
            OffsetDateTime performAt) {
        String candidate = frequency != null ? frequency.trim()
                : registered.map(RegisteredJobType::frequency).orElse("");
        if (candidate.isEmpty()) {
            return "";
        }
        Frequency parsed = Frequency.parse(candidate);
        if (!parsed.advances(performAt, clock.zone())) {
            throw new IllegalArgumentException("Frequency '" + candidate + "' does not move time forward");
        }
        return candidate;
    }
}
