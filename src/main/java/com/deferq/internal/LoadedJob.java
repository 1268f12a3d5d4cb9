package com.deferq.internal;

import com.deferq.Job;
import com.deferq.JobArguments;

public record LoadedJob(Job job, RegisteredJobType type) {

    public JobArguments arguments() {
        return job.getArguments();
    }
}
