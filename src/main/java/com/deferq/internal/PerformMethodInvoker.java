package com.deferq.internal;

import com.deferq.JobArg;
import com.deferq.JobArguments;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Set;

/**
 * Calls a reflectively resolved {@code perform(...)} method, converting the
 * stored arguments to the declared parameter types. A trailing
 * {@link JobArguments} parameter receives the remaining arguments.
 */
class PerformMethodInvoker implements JobInvoker {

    private static final Set<Class<?>> SUPPORTED_PARAMETER_TYPES = Set.of(
            String.class, long.class, Long.class, int.class, Integer.class,
            boolean.class, Boolean.class, Object.class, JobArg.class);

    private final Object bean;
    private final Method method;
    private final Class<?>[] parameterTypes;
    private final boolean takesRest;
    private final int positionalCount;

    PerformMethodInvoker(Object bean, Method method) {
        this.bean = bean;
        this.method = method;
        this.parameterTypes = method.getParameterTypes();
        this.takesRest = parameterTypes.length > 0
                && parameterTypes[parameterTypes.length - 1] == JobArguments.class;
        this.positionalCount = takesRest ? parameterTypes.length - 1 : parameterTypes.length;
        ReflectionUtils.makeAccessible(method);
    }

    static boolean supports(Method method) {
        Class<?>[] types = method.getParameterTypes();
        for (int i = 0; i < types.length; i++) {
            boolean last = i == types.length - 1;
            if (last && types[i] == JobArguments.class) {
                continue;
            }
            if (!SUPPORTED_PARAMETER_TYPES.contains(types[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void invoke(JobArguments arguments) throws Exception {
        if (arguments.size() < positionalCount) {
            throw new IllegalArgumentException("Method " + method.getName() + " on "
                    + method.getDeclaringClass().getName() + " expects " + positionalCount
                    + " argument(s) but the job stores " + arguments.size());
        }
        Object[] values = new Object[parameterTypes.length];
        for (int i = 0; i < positionalCount; i++) {
            values[i] = convert(arguments.get(i), parameterTypes[i], i);
        }
        if (takesRest) {
            values[positionalCount] = arguments.tail(positionalCount);
        }

        try {
            method.invoke(bean, values);
        } catch (InvocationTargetException invocationTargetException) {
            Throwable target = invocationTargetException.getTargetException();
            if (target instanceof Exception ex) {
                throw ex;
            }
            if (target instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(target);
        }
    }

    private Object convert(JobArg arg, Class<?> type, int index) {
        if (type == JobArg.class) {
            return arg;
        }
        if (type == Object.class) {
            return arg.value();
        }
        if (arg.isNull()) {
            if (type.isPrimitive()) {
                throw new IllegalArgumentException("Argument " + index + " is NULL but parameter type is " + type);
            }
            return null;
        }
        if (type == String.class && arg.kind() == JobArg.Kind.STRING) {
            return arg.value();
        }
        if ((type == long.class || type == Long.class) && arg.kind() == JobArg.Kind.INTEGER) {
            return arg.value();
        }
        if ((type == int.class || type == Integer.class) && arg.kind() == JobArg.Kind.INTEGER) {
            return Math.toIntExact((Long) arg.value());
        }
        if ((type == boolean.class || type == Boolean.class) && arg.kind() == JobArg.Kind.BOOLEAN) {
            return arg.value();
        }
        throw new IllegalArgumentException("Argument " + index + " of kind " + arg.kind()
                + " cannot be passed as " + type.getSimpleName());
    }
}
