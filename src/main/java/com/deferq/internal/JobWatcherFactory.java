package com.deferq.internal;

import com.deferq.time.JobClock;
import org.springframework.stereotype.Component;

@Component
public class JobWatcherFactory {

    private final EligibleJobQuery eligibleJobQuery;
    private final JobRunner jobRunner;
    private final StoreConnectionRecycler connectionRecycler;
    private final JobClock clock;

    public JobWatcherFactory(
            EligibleJobQuery eligibleJobQuery,
            JobRunner jobRunner,
            StoreConnectionRecycler connectionRecycler,
            JobClock clock) {
        this.eligibleJobQuery = eligibleJobQuery;
        this.jobRunner = jobRunner;
        this.connectionRecycler = connectionRecycler;
        this.clock = clock;
    }

    public JobWatcher create() {
        return new JobWatcher(eligibleJobQuery, jobRunner, connectionRecycler, clock);
    }
}
