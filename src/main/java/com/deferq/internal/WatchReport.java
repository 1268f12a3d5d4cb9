package com.deferq.internal;

/**
 * Final status of a finished watch loop. {@code failure} is set when the loop
 * was stopped by a job whose schedule cannot advance.
 */
public record WatchReport(String queue, long executedJobs, RuntimeException failure) {

    public boolean isFailed() {
        return failure != null;
    }
}
