package com.deferq.internal;

import com.deferq.Job;
import com.deferq.JobArguments;
import com.deferq.time.FrozenJobClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecordLockerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final String ACQUIRE_SQL =
            "UPDATE deferq_jobs SET locked_at = ? WHERE id = ? AND (locked_at IS NULL OR locked_at <= ?)";

    private JdbcTemplate jdbcTemplate;
    private RecordLocker locker;
    private Job job;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        locker = new RecordLocker(jdbcTemplate, "deferq_jobs", new FrozenJobClock(NOW), Duration.ofHours(1));
        job = new Job("Report", JobArguments.empty(), NOW, "default", "");
        job.setId(7L);
    }

    @Test
    void shouldSetLockTimeWhenConditionalUpdateMatches() {
        when(jdbcTemplate.update(ACQUIRE_SQL, NOW, 7L, NOW.minusHours(1))).thenReturn(1);

        assertTrue(locker.acquire(job));
        assertEquals(NOW, job.getLockedAt());
    }

    @Test
    void shouldLeaveRecordUntouchedWhenAnotherWorkerHoldsTheLock() {
        OffsetDateTime heldSince = NOW.minusMinutes(5);
        job.setLockedAt(heldSince);
        when(jdbcTemplate.update(anyString(), any(), any(), any())).thenReturn(0);

        assertFalse(locker.acquire(job));
        assertEquals(heldSince, job.getLockedAt());
    }

    @Test
    void shouldPassExplicitStaleThreshold() {
        OffsetDateTime threshold = NOW.minusMinutes(10);
        when(jdbcTemplate.update(ACQUIRE_SQL, NOW, 7L, threshold)).thenReturn(1);

        assertTrue(locker.acquire(job, threshold));
    }

    @Test
    void shouldClearLockOnRelease() {
        job.setLockedAt(NOW);

        locker.release(job);

        verify(jdbcTemplate).update(eq("UPDATE deferq_jobs SET locked_at = NULL WHERE id = ?"), eq(7L));
        assertNull(job.getLockedAt());
    }

    @Test
    void shouldTreatOldLocksAsReleased() {
        assertFalse(locker.isLocked(job));

        job.setLockedAt(NOW.minusMinutes(59));
        assertTrue(locker.isLocked(job));

        job.setLockedAt(NOW.minusHours(1));
        assertFalse(locker.isLocked(job));
    }

    @Test
    void shouldRejectUnsafeTableNames() {
        assertThatThrownBy(() -> new RecordLocker(jdbcTemplate, "jobs; DROP TABLE x", new FrozenJobClock(NOW),
                Duration.ofHours(1))).isInstanceOf(IllegalArgumentException.class);
    }
}
