package com.deferq;

import java.time.OffsetDateTime;

/**
 * A table row that can be locked through its {@code locked_at} column.
 */
public interface Lockable {

    Long getId();

    OffsetDateTime getLockedAt();

    void setLockedAt(OffsetDateTime lockedAt);
}
