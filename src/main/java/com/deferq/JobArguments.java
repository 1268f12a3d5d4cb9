package com.deferq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable positional argument list of a job, stored as a JSON array.
 */
public final class JobArguments implements Iterable<JobArg> {

    private static final JobArguments EMPTY = new JobArguments(List.of());

    private final List<JobArg> values;

    private JobArguments(List<JobArg> values) {
        this.values = values;
    }

    public static JobArguments empty() {
        return EMPTY;
    }

    public static JobArguments of(Object... values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }
        return ofList(Arrays.asList(values));
    }

    public static JobArguments ofList(List<?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        List<JobArg> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(JobArg.from(value));
        }
        return new JobArguments(List.copyOf(converted));
    }

    /**
     * Decodes the stored column value. A missing or JSON-null column is an empty
     * list; anything other than an array of scalars is rejected.
     */
    public static JobArguments fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Stored job arguments must be a JSON array but were: " + node);
        }
        List<JobArg> decoded = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            decoded.add(JobArg.fromJson(element));
        }
        return decoded.isEmpty() ? EMPTY : new JobArguments(List.copyOf(decoded));
    }

    public JsonNode toJson() {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(values.size());
        for (JobArg value : values) {
            array.add(value.toJson(JsonNodeFactory.instance));
        }
        return array;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public JobArg get(int index) {
        return values.get(index);
    }

    public String getString(int index) {
        return (String) expect(index, JobArg.Kind.STRING).value();
    }

    public long getLong(int index) {
        return (Long) expect(index, JobArg.Kind.INTEGER).value();
    }

    public int getInt(int index) {
        return Math.toIntExact(getLong(index));
    }

    public boolean getBoolean(int index) {
        return (Boolean) expect(index, JobArg.Kind.BOOLEAN).value();
    }

    public boolean isNull(int index) {
        return values.get(index).isNull();
    }

    /**
     * Arguments from {@code fromIndex} onwards.
     */
    public JobArguments tail(int fromIndex) {
        if (fromIndex >= values.size()) {
            return EMPTY;
        }
        return new JobArguments(values.subList(fromIndex, values.size()));
    }

    public List<JobArg> asList() {
        return values;
    }

    /**
     * Comma separated literals, or {@code none} when there are no arguments.
     */
    public String render() {
        if (values.isEmpty()) {
            return "none";
        }
        return values.stream().map(JobArg::render).collect(Collectors.joining(", "));
    }

    private JobArg expect(int index, JobArg.Kind kind) {
        JobArg arg = values.get(index);
        if (arg.kind() != kind) {
            throw new IllegalArgumentException(
                    "Argument " + index + " is " + arg.kind() + ", expected " + kind);
        }
        return arg;
    }

    @Override
    public Iterator<JobArg> iterator() {
        return values.iterator();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof JobArguments that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
