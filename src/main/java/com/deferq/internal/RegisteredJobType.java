package com.deferq.internal;

/**
 * A job type known to this process. {@code invoker} is null when the type was
 * declared without a usable {@code perform} method; such jobs are removed
 * instead of executed.
 */
public record RegisteredJobType(String type, String queue, String frequency, JobInvoker invoker, String source) {

    public boolean isMalformed() {
        return invoker == null;
    }

    public boolean isRecurring() {
        return frequency != null && !frequency.isBlank();
    }
}
