package com.deferq.internal;

import com.deferq.Frequency;
import com.deferq.JobWorker;
import com.deferq.config.DeferQProperties;
import com.deferq.time.JobClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps job type keys to the code that executes them. Populated once all
 * singletons exist, from {@link JobWorker} beans and from beans annotated
 * with {@link com.deferq.annotation.Job}.
 */
@Component
public class JobTypeRegistry implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(JobTypeRegistry.class);

    private final ObjectProvider<JobWorker> workers;
    private final ListableBeanFactory beanFactory;
    private final DeferQProperties properties;
    private final JobClock clock;
    private volatile Map<String, RegisteredJobType> typesByKey = Map.of();

    public JobTypeRegistry(
            ObjectProvider<JobWorker> workers,
            ListableBeanFactory beanFactory,
            DeferQProperties properties,
            JobClock clock) {
        this.workers = workers;
        this.beanFactory = beanFactory;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, RegisteredJobType> registrations = new LinkedHashMap<>();

        workers.orderedStream().forEach(worker -> registerWorker(registrations, worker));

        Map<String, Object> annotatedBeans = beanFactory.getBeansWithAnnotation(com.deferq.annotation.Job.class);
        for (Object bean : annotatedBeans.values()) {
            if (bean instanceof JobWorker) {
                continue;
            }
            registerAnnotatedBean(registrations, bean);
        }

        this.typesByKey = Map.copyOf(registrations);
        log.info("DeferQ registered {} job type(s): {}", typesByKey.size(), typesByKey.keySet());
    }

    public Optional<RegisteredJobType> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(typesByKey.get(type));
    }

    public Collection<RegisteredJobType> all() {
        return typesByKey.values();
    }

    private void registerWorker(Map<String, RegisteredJobType> registrations, JobWorker worker) {
        Class<?> targetClass = ClassUtils.getUserClass(worker);
        String source = "JobWorker bean " + targetClass.getName();
        String type = normalizeRequiredType(worker.getJobType(), source);
        com.deferq.annotation.Job annotation = findJobAnnotation(worker);
        register(registrations, new RegisteredJobType(
                type,
                resolveQueue(annotation),
                resolveFrequency(annotation, type),
                worker::perform,
                source));
    }

    private void registerAnnotatedBean(Map<String, RegisteredJobType> registrations, Object bean) {
        com.deferq.annotation.Job annotation = findJobAnnotation(bean);
        if (annotation == null) {
            return;
        }
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        String source = "@Job bean " + targetClass.getName();
        String type = normalizeRequiredType(annotation.value(), source);

        Method performMethod = resolvePerformMethod(targetClass);
        JobInvoker invoker = performMethod == null ? null : new PerformMethodInvoker(bean, performMethod);
        register(registrations, new RegisteredJobType(
                type,
                resolveQueue(annotation),
                resolveFrequency(annotation, type),
                invoker,
                source));
    }

    private void register(Map<String, RegisteredJobType> registrations, RegisteredJobType registration) {
        RegisteredJobType existing = registrations.putIfAbsent(registration.type(), registration);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate job type '" + registration.type() + "' detected while registering "
                            + registration.source() + " (already registered by " + existing.source()
                            + "). Each job type must be unique.");
        }
    }

    private Method resolvePerformMethod(Class<?> targetClass) {
        List<Method> performMethods = Arrays.stream(ReflectionUtils.getAllDeclaredMethods(targetClass))
                .filter(method -> method.getName().equals("perform"))
                .filter(method -> !Modifier.isStatic(method.getModifiers()))
                .filter(method -> !method.isBridge() && !method.isSynthetic())
                .toList();

        if (performMethods.isEmpty()) {
            log.warn("{} class does not declare any perform() method. Its jobs will be removed when run.",
                    targetClass.getName());
            return null;
        }
        if (performMethods.size() > 1) {
            throw new IllegalStateException(
                    "Ambiguous perform(...) overloads on " + targetClass.getName()
                            + ". Keep exactly one perform method.");
        }

        Method method = performMethods.get(0);
        if (!PerformMethodInvoker.supports(method)) {
            log.warn("{}.perform(...) has unsupported parameter types {}. Supported: String, long, int, boolean, "
                    + "their wrappers, Object, JobArg and a trailing JobArguments. Its jobs will be removed when run.",
                    targetClass.getName(), Arrays.toString(method.getParameterTypes()));
            return null;
        }
        return method;
    }

    private String resolveQueue(com.deferq.annotation.Job annotation) {
        if (annotation == null || annotation.queue().isBlank()) {
            return properties.getJobs().getDefaultQueue();
        }
        return annotation.queue().trim();
    }

    private String resolveFrequency(com.deferq.annotation.Job annotation, String type) {
        if (annotation == null || annotation.frequency().isBlank()) {
            return "";
        }
        String frequency = annotation.frequency().trim();
        Frequency parsed;
        try {
            parsed = Frequency.parse(frequency);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid frequency '" + frequency + "' for job type '" + type + "'", e);
        }
        if (!parsed.advances(clock.now(), clock.zone())) {
            throw new IllegalStateException(
                    "Frequency '" + frequency + "' of job type '" + type + "' does not move time forward");
        }
        return frequency;
    }

    private com.deferq.annotation.Job findJobAnnotation(Object bean) {
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        return AnnotationUtils.findAnnotation(targetClass, com.deferq.annotation.Job.class);
    }

    private String normalizeRequiredType(String type, String source) {
        if (type == null) {
            throw new IllegalStateException("Job type must not be null for " + source);
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalStateException("Job type must not be blank for " + source);
        }
        return trimmed;
    }
}
