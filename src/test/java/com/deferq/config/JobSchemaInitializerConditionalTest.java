package com.deferq.config;

import com.deferq.JobSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class JobSchemaInitializerConditionalTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(JobSchemaInitializer.class)
            .withBean(DeferQProperties.class, JobSchemaInitializerConditionalTest::lenientProperties)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(JobSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("deferq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(JobSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldFailStartupWhenMigrationFailsByDefault() {
        new ApplicationContextRunner()
                .withUserConfiguration(JobSchemaInitializer.class)
                .withBean(DeferQProperties.class, DeferQProperties::new)
                .withBean(DataSource.class, () -> mock(DataSource.class))
                .run(context -> assertTrue(context.getStartupFailure() != null));
    }

    private static DeferQProperties lenientProperties() {
        DeferQProperties properties = new DeferQProperties();
        properties.getDatabase().setFailOnMigrationError(false);
        return properties;
    }
}
