package io.snapshots.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered, immutable mapping from column name to value. Values are numbers, strings, instants,
 * lists of strings or null.
 */
public final class Record {
    private final Map<String, Object> values;

    private Record(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Record of(Map<String, ?> values) {
        return new Record(new LinkedHashMap<>(values));
    }

    public static Builder builder() { return new Builder(); }

    public Object get(String column) { return values.get(column); }
    public boolean has(String column) { return values.containsKey(column); }
    public Set<String> columns() { return values.keySet(); }
    public Map<String, Object> asMap() { return values; }
    public int size() { return values.size(); }

    public String getString(String column) {
        Object v = values.get(column);
        return v == null ? null : v.toString();
    }

    public Number getNumber(String column) {
        Object v = values.get(column);
        return (v instanceof Number n) ? n : null;
    }

    public Instant getInstant(String column) {
        Object v = values.get(column);
        return (v instanceof Instant i) ? i : null;
    }

    /** Copy of this record with the column set (appended when new, replaced in place otherwise). */
    public Record with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new Record(copy);
    }

    public Record without(String column) {
        if (!values.containsKey(column)) return this;
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(column);
        return new Record(copy);
    }

    /** Projection onto the given columns, in that order; absent columns become null. */
    public Record select(List<String> columns) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String c : columns) out.put(c, values.get(c));
        return new Record(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Record" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder put(String column, Object value) { values.put(column, value); return this; }
        public Record build() { return new Record(new LinkedHashMap<>(values)); }
    }
}
