package com.deferq;

import com.deferq.config.DeferQProperties;
import com.deferq.internal.RecordLocker;
import com.deferq.time.JobClock;
import com.deferq.time.SystemJobClock;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationExcludeFilter;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.TypeExcludeFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Locale;

@AutoConfiguration(before = HibernateJpaAutoConfiguration.class)
@AutoConfigurationPackage(basePackages = "com.deferq")
@ComponentScan(basePackages = "com.deferq",
        excludeFilters = {
                @ComponentScan.Filter(type = FilterType.CUSTOM, classes = TypeExcludeFilter.class),
                @ComponentScan.Filter(type = FilterType.CUSTOM, classes = AutoConfigurationExcludeFilter.class) })
@EnableConfigurationProperties(DeferQProperties.class)
public class DeferQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JobClock deferqJobClock(DeferQProperties properties) {
        return new SystemJobClock(properties.getJobs().resolveTimeZone());
    }

    @Bean
    @ConditionalOnMissingBean(name = "deferqJobLocker")
    public RecordLocker deferqJobLocker(JdbcTemplate jdbcTemplate, JobClock clock, DeferQProperties properties) {
        String tableName = JobSchemaInitializer.normalizePrefix(properties.getDatabase().getTablePrefix())
                + "deferq_jobs";
        return new RecordLocker(jdbcTemplate, tableName, clock, properties.getJobs().getLockTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(name = "deferqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer deferqHibernatePropertiesCustomizer(DeferQProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                String trimmedPrefix = prefix.trim();
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                if (original.getText().toLowerCase(Locale.ROOT).startsWith("deferq_")) {
                                    return new Identifier(trimmedPrefix + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }
}
