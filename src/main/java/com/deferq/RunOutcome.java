package com.deferq;

public enum RunOutcome {
    DONE,
    FAILED,
    NOT_FOUND,
    LOCK_CONTENTION,
    MALFORMED_JOB_TYPE
}
