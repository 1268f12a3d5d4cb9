package com.deferq.internal;

import com.deferq.Lockable;
import com.deferq.time.JobClock;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.regex.Pattern;

/**
 * Row lock stored in a {@code locked_at} column. Acquisition is a single
 * conditional UPDATE so that concurrent workers cannot both win.
 */
public class RecordLocker {

    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final JobClock clock;
    private final Duration lockTimeout;
    private final String acquireSql;
    private final String releaseSql;

    public RecordLocker(JdbcTemplate jdbcTemplate, String tableName, JobClock clock, Duration lockTimeout) {
        if (tableName == null || !SAFE_TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Unsupported lockable table name: " + tableName);
        }
        if (lockTimeout == null || lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must be a positive duration");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.lockTimeout = lockTimeout;
        this.acquireSql = "UPDATE " + tableName
                + " SET locked_at = ? WHERE id = ? AND (locked_at IS NULL OR locked_at <= ?)";
        this.releaseSql = "UPDATE " + tableName + " SET locked_at = NULL WHERE id = ?";
    }

    /**
     * Takes the lock if the record is unlocked or its lock is older than the
     * configured timeout.
     */
    public boolean acquire(Lockable record) {
        return acquire(record, staleThreshold());
    }

    /**
     * Takes the lock if the record is unlocked or was locked at or before
     * {@code staleThreshold}. On success the in-memory record carries the new
     * lock time; on failure nothing is changed.
     */
    public boolean acquire(Lockable record, OffsetDateTime staleThreshold) {
        OffsetDateTime now = clock.now();
        int updated = jdbcTemplate.update(acquireSql, now, record.getId(), staleThreshold);
        if (updated != 1) {
            return false;
        }
        record.setLockedAt(now);
        return true;
    }

    public void release(Lockable record) {
        jdbcTemplate.update(releaseSql, record.getId());
        record.setLockedAt(null);
    }

    public boolean isLocked(Lockable record) {
        OffsetDateTime lockedAt = record.getLockedAt();
        return lockedAt != null && lockedAt.isAfter(staleThreshold());
    }

    public OffsetDateTime staleThreshold() {
        return clock.ago(lockTimeout);
    }
}
