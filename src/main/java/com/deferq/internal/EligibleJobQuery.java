package com.deferq.internal;

import com.deferq.JobRepository;
import com.deferq.config.DeferQProperties;
import com.deferq.time.JobClock;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Finds the id of the earliest due job a worker may take.
 */
@Component
public class EligibleJobQuery {

    public static final String ALL_QUEUES = "all";

    private static final Pageable FIRST_ONLY = PageRequest.of(0, 1);

    private final JobRepository jobRepository;
    private final JobClock clock;
    private final DeferQProperties properties;

    public EligibleJobQuery(JobRepository jobRepository, JobClock clock, DeferQProperties properties) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.properties = properties;
    }

    public Optional<Long> findNextEligible(String queue) {
        String normalizedQueue = normalizeQueue(queue);
        OffsetDateTime now = clock.now();
        OffsetDateTime lockThreshold = now.minus(properties.getJobs().getLockTimeout());
        long maxAttempts = properties.getJobs().getMaxAttempts();

        List<Long> ids = ALL_QUEUES.equals(normalizedQueue)
                ? jobRepository.findEligibleIds(now, lockThreshold, maxAttempts, FIRST_ONLY)
                : jobRepository.findEligibleIdsInQueue(normalizedQueue, now, lockThreshold, maxAttempts, FIRST_ONLY);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    /**
     * Strips trailing digits so that {@code fetchers1} and {@code fetchers2}
     * both watch {@code fetchers}. A blank name, or one made only of digits,
     * means every queue.
     */
    public static String normalizeQueue(String queue) {
        if (queue == null) {
            return ALL_QUEUES;
        }
        String trimmed = queue.trim();
        int end = trimmed.length();
        while (end > 0 && Character.isDigit(trimmed.charAt(end - 1)) && trimmed.charAt(end - 1) < 128) {
            end--;
        }
        String normalized = trimmed.substring(0, end);
        return normalized.isEmpty() ? ALL_QUEUES : normalized;
    }
}
