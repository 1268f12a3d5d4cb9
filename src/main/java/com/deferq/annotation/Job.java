package com.deferq.annotation;

import java.lang.annotation.*;

/**
 * Marks a bean as the handler of a job type and declares the defaults new
 * records of that type are created with.
 */
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The job type key stored in the {@code name} column.
     */
    String value();

    /**
     * Queue new records are placed in. Blank means the configured default queue.
     */
    String queue() default "";

    /**
     * Relative modifier such as {@code "+1 hour"}. When set, the job is recurring:
     * it is kept and rescheduled after every run, and one record is bootstrapped
     * at startup.
     */
    String frequency() default "";
}
