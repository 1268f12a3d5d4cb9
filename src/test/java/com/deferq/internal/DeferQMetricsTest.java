package com.deferq.internal;

import com.deferq.JobRepository;
import com.deferq.config.DeferQProperties;
import com.deferq.time.FrozenJobClock;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeferQMetricsTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private JobRepository jobRepository;
    private MeterRegistry meterRegistry;
    private DeferQMetrics metrics;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        DeferQProperties properties = new DeferQProperties();
        properties.getJobs().setLockTimeout(Duration.ofMinutes(10));
        metrics = new DeferQMetrics(jobRepository, meterRegistry, new FrozenJobClock(NOW), properties);
    }

    @Test
    void shouldRegisterGaugesForJobStatuses() {
        JobRepository.StatusCounts counts = mock(JobRepository.StatusCounts.class);
        when(counts.getScheduledCount()).thenReturn(10L);
        when(counts.getLockedCount()).thenReturn(2L);
        when(counts.getFailedCount()).thenReturn(3L);
        when(counts.getRecurringCount()).thenReturn(4L);
        when(counts.getTotalCount()).thenReturn(12L);
        when(jobRepository.countStatuses(NOW.minusMinutes(10))).thenReturn(counts);

        metrics.registerMetrics();

        assertThat(gauge("scheduled").value()).isEqualTo(10.0);
        assertThat(gauge("locked").value()).isEqualTo(2.0);
        assertThat(gauge("failed").value()).isEqualTo(3.0);
        assertThat(gauge("recurring").value()).isEqualTo(4.0);
        Gauge totalGauge = meterRegistry.find("deferq.jobs.total").gauge();
        assertThat(totalGauge).isNotNull();
        assertThat(totalGauge.value()).isEqualTo(12.0);

        verify(jobRepository, times(1)).countStatuses(any());
    }

    @Test
    void shouldReportZeroWhenStoreIsUnavailable() {
        when(jobRepository.countStatuses(any())).thenThrow(new IllegalStateException("no connection"));

        metrics.registerMetrics();

        assertThat(gauge("scheduled").value()).isEqualTo(0.0);
    }

    private Gauge gauge(String status) {
        Gauge gauge = meterRegistry.find("deferq.jobs.count").tag("status", status).gauge();
        assertThat(gauge).isNotNull();
        return gauge;
    }
}
