package com.deferq;

import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

/**
 * A bean that executes jobs of one type. Beans that do not implement this
 * interface can instead be annotated with {@link com.deferq.annotation.Job}
 * and declare a {@code perform(...)} method whose parameters receive the
 * stored arguments positionally.
 */
public interface JobWorker {

    /**
     * Returns the job type key this worker executes. By default, this is read
     * from the {@link com.deferq.annotation.Job} annotation.
     */
    default String getJobType() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        com.deferq.annotation.Job annotation = AnnotationUtils.findAnnotation(targetClass,
                com.deferq.annotation.Job.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalStateException("JobWorker " + targetClass.getName()
                    + " must either be annotated with @Job or override getJobType()");
        }
        return annotation.value();
    }

    /**
     * Executes one job. Any exception marks the attempt as failed; the job is
     * kept and retried later.
     *
     * @param arguments the stored arguments of the job
     * @throws Exception if the work failed
     */
    void perform(JobArguments arguments) throws Exception;
}
