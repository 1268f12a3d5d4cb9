package com.deferq.internal;

import com.deferq.JobRepository;
import com.deferq.config.DeferQProperties;
import com.deferq.time.FrozenJobClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EligibleJobQueryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private JobRepository jobRepository;
    private EligibleJobQuery query;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        DeferQProperties properties = new DeferQProperties();
        properties.getJobs().setLockTimeout(Duration.ofMinutes(30));
        properties.getJobs().setMaxAttempts(10);
        query = new EligibleJobQuery(jobRepository, new FrozenJobClock(NOW), properties);
    }

    @Test
    void shouldQueryEveryQueueForAll() {
        when(jobRepository.findEligibleIds(eq(NOW), eq(NOW.minusMinutes(30)), eq(10L), any(Pageable.class)))
                .thenReturn(List.of(4L));

        assertEquals(Optional.of(4L), query.findNextEligible("all"));
        verify(jobRepository, never()).findEligibleIdsInQueue(any(), any(), any(), anyLong(), any());
    }

    @Test
    void shouldStripWorkerNumberFromQueueName() {
        when(jobRepository.findEligibleIdsInQueue(eq("fetchers"), eq(NOW), eq(NOW.minusMinutes(30)), eq(10L),
                any(Pageable.class))).thenReturn(List.of(9L));

        assertEquals(Optional.of(9L), query.findNextEligible("fetchers2"));
    }

    @Test
    void shouldReturnEmptyWhenNothingIsDue() {
        when(jobRepository.findEligibleIds(any(), any(), anyLong(), any())).thenReturn(List.of());

        assertTrue(query.findNextEligible(null).isEmpty());
    }

    @Test
    void shouldNormalizeQueueNames() {
        assertEquals("fetchers", EligibleJobQuery.normalizeQueue("fetchers12"));
        assertEquals("mail", EligibleJobQuery.normalizeQueue(" mail "));
        assertEquals("v2api", EligibleJobQuery.normalizeQueue("v2api"));
        assertEquals("all", EligibleJobQuery.normalizeQueue("all"));
        assertEquals("all", EligibleJobQuery.normalizeQueue("123"));
        assertEquals("all", EligibleJobQuery.normalizeQueue(""));
        assertEquals("all", EligibleJobQuery.normalizeQueue(null));
    }
}
