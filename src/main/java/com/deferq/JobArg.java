package com.deferq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A single positional job argument. Only scalar values are storable: strings,
 * 64-bit integers, booleans and null.
 */
public record JobArg(Kind kind, Object value) {

    public static final JobArg NULL = new JobArg(Kind.NULL, null);

    public enum Kind {
        STRING,
        INTEGER,
        BOOLEAN,
        NULL
    }

    public JobArg {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        switch (kind) {
            case STRING -> requireType(value, String.class, kind);
            case INTEGER -> requireType(value, Long.class, kind);
            case BOOLEAN -> requireType(value, Boolean.class, kind);
            case NULL -> {
                if (value != null) {
                    throw new IllegalArgumentException("NULL argument must not carry a value");
                }
            }
        }
    }

    public static JobArg of(String value) {
        return value == null ? NULL : new JobArg(Kind.STRING, value);
    }

    public static JobArg of(long value) {
        return new JobArg(Kind.INTEGER, value);
    }

    public static JobArg of(boolean value) {
        return new JobArg(Kind.BOOLEAN, value);
    }

    /**
     * Wraps a plain Java value. Accepts {@code String}, integral boxed numbers,
     * {@code Boolean}, {@code null} and existing {@link JobArg}s.
     */
    public static JobArg from(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof JobArg arg) {
            return arg;
        }
        if (value instanceof String s) {
            return of(s);
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        throw new IllegalArgumentException(
                "Unsupported job argument type " + value.getClass().getName()
                        + ". Supported: String, Long, Integer, Short, Byte, Boolean, null.");
    }

    public static JobArg fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return NULL;
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return of(node.longValue());
        }
        throw new IllegalArgumentException("Unsupported stored job argument: " + node);
    }

    public JsonNode toJson(JsonNodeFactory factory) {
        return switch (kind) {
            case STRING -> factory.textNode((String) value);
            case INTEGER -> factory.numberNode((Long) value);
            case BOOLEAN -> factory.booleanNode((Boolean) value);
            case NULL -> factory.nullNode();
        };
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Renders the argument as a literal: strings single-quoted with quotes and
     * backslashes escaped, integers as digits, {@code true}/{@code false}, {@code NULL}.
     */
    public String render() {
        return switch (kind) {
            case STRING -> "'" + ((String) value).replace("\\", "\\\\").replace("'", "\\'") + "'";
            case INTEGER, BOOLEAN -> String.valueOf(value);
            case NULL -> "NULL";
        };
    }

    private static void requireType(Object value, Class<?> type, Kind kind) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(kind + " argument requires a " + type.getSimpleName() + " value");
        }
    }
}
