package com.deferq;

import java.time.Duration;
import java.util.Locale;

/**
 * Outcome of one runner invocation. {@code elapsed} covers the work between
 * taking the lock and releasing or deleting the record.
 */
public record RunResult(long jobId, String jobName, RunOutcome outcome, Duration elapsed) {

    public static RunResult notFound(long jobId) {
        return new RunResult(jobId, null, RunOutcome.NOT_FOUND, Duration.ZERO);
    }

    public boolean isOk() {
        return outcome == RunOutcome.DONE;
    }

    /**
     * {@code job#<id> (<name>): done|failed (in S.sss seconds)}, or
     * {@code Job <id> does not exist.} when nothing was loaded.
     */
    public String describe() {
        if (outcome == RunOutcome.NOT_FOUND) {
            return "Job " + jobId + " does not exist.";
        }
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        return String.format(Locale.ROOT, "job#%d (%s): %s (in %.3f seconds)",
                jobId, jobName, isOk() ? "done" : "failed", seconds);
    }
}
