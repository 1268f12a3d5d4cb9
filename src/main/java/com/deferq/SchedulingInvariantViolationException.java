package com.deferq;

/**
 * Raised when a recurring job's frequency does not move its next run strictly
 * forward. This is a configuration defect and is never swallowed by the runner.
 */
public class SchedulingInvariantViolationException extends IllegalStateException {

    private final String jobName;
    private final String frequency;

    public SchedulingInvariantViolationException(String jobName, String frequency) {
        super(jobName + " has a frequency going backward");
        this.jobName = jobName;
        this.frequency = frequency;
    }

    public SchedulingInvariantViolationException(String jobName, String frequency, Throwable cause) {
        super(jobName + " has an unusable frequency '" + frequency + "'", cause);
        this.jobName = jobName;
        this.frequency = frequency;
    }

    public String getJobName() {
        return jobName;
    }

    public String getFrequency() {
        return frequency;
    }
}
