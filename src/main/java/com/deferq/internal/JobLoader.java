package com.deferq.internal;

import com.deferq.Job;
import com.deferq.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Loads a job record together with the registered type its {@code name}
 * refers to. Unknown names load as empty, the same as a missing row.
 */
@Component
public class JobLoader {

    private static final Logger log = LoggerFactory.getLogger(JobLoader.class);

    private final JobRepository jobRepository;
    private final JobTypeRegistry jobTypeRegistry;

    public JobLoader(JobRepository jobRepository, JobTypeRegistry jobTypeRegistry) {
        this.jobRepository = jobRepository;
        this.jobTypeRegistry = jobTypeRegistry;
    }

    public Optional<LoadedJob> load(long id) {
        Optional<Job> job = jobRepository.findById(id);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        Optional<RegisteredJobType> type = jobTypeRegistry.find(job.get().getName());
        if (type.isEmpty()) {
            log.warn("Job {} refers to unregistered job type '{}'", id, job.get().getName());
            return Optional.empty();
        }
        return Optional.of(new LoadedJob(job.get(), type.get()));
    }
}
