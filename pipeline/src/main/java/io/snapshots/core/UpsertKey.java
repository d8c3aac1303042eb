package io.snapshots.core;

import io.snapshots.error.ConfigurationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered tuple of column names whose values identify the same logical row, e.g. symbol + hour bucket.
 */
public record UpsertKey(List<String> columns) {
    public UpsertKey {
        if (columns == null || columns.isEmpty()) throw new ConfigurationException("upsert key needs at least one column");
        columns = List.copyOf(columns);
    }

    public static UpsertKey of(String... columns) {
        return new UpsertKey(List.of(columns));
    }

    /** False when any key column is missing, null or blank. */
    public boolean isComplete(Record record) {
        for (String c : columns) {
            Object v = record.get(c);
            if (v == null) return false;
            if (v instanceof String s && s.isBlank()) return false;
        }
        return true;
    }

    public KeyValue valuesOf(Record record) {
        List<Object> out = new ArrayList<>(columns.size());
        for (String c : columns) out.add(normalize(record.get(c)));
        return new KeyValue(out);
    }

    // numbers compare by value so 1 (Integer) and 1L (Long) identify the same row
    private static Object normalize(Object v) {
        if (!(v instanceof Number n)) return v;
        BigDecimal d = Numbers.toBigDecimal(n);
        return d == null ? v : d.stripTrailingZeros();
    }

    /** Concrete values of an upsert key for one record. */
    public record KeyValue(List<Object> values) {
        public KeyValue {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }
}
