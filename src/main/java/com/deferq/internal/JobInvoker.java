package com.deferq.internal;

import com.deferq.JobArguments;

@FunctionalInterface
public interface JobInvoker {
    void invoke(JobArguments arguments) throws Exception;
}
