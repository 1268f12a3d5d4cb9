package com.deferq;

import com.deferq.config.DeferQProperties;
import com.deferq.internal.DeferQMetrics;
import com.deferq.time.JobClock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = DeferQAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
public class DeferQMetricsAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public DeferQMetrics deferqMetrics(JobRepository jobRepository, MeterRegistry meterRegistry, JobClock clock,
            DeferQProperties properties) {
        return new DeferQMetrics(jobRepository, meterRegistry, clock, properties);
    }
}
