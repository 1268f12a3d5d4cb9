package com.deferq.internal;

import com.deferq.config.DeferQProperties;

import java.time.Duration;

/**
 * @param queue         queue to watch; trailing digits are ignored and {@code all} watches every queue
 * @param stopAfter     number of executed jobs after which the loop stops, 0 for no limit
 * @param sleepDuration pause when no job is due
 */
public record WatchOptions(String queue, long stopAfter, Duration sleepDuration) {

    public WatchOptions {
        if (queue == null || queue.isBlank()) {
            queue = EligibleJobQuery.ALL_QUEUES;
        }
        if (stopAfter < 0) {
            throw new IllegalArgumentException("stopAfter must be >= 0");
        }
        if (sleepDuration == null || sleepDuration.isNegative()) {
            throw new IllegalArgumentException("sleepDuration must be a positive duration");
        }
    }

    public static WatchOptions from(DeferQProperties.Worker worker) {
        return new WatchOptions(worker.getQueue(), worker.getStopAfter(), worker.getSleepDuration());
    }
}
