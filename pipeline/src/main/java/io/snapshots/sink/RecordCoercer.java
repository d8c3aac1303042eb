package io.snapshots.sink;

import io.snapshots.core.Record;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Puts a record into the exact shape of a {@link TableSchema}: canonical column order, coerced values,
 * defaults for NOT NULL columns, recorded-at, version and bucket columns filled in. Unknown columns are dropped.
 * Key columns are never defaulted, so a record with an unusable key stays recognisable as such.
 */
public class RecordCoercer {
    private final TableSchema schema;
    private final Clock clock;

    public RecordCoercer(TableSchema schema, Clock clock) {
        this.schema = schema;
        this.clock = clock;
    }

    public Record coerce(Record in) {
        String recordedAtCol = schema.recordedAtColumn().orElse(null);
        Map<String, Object> out = new LinkedHashMap<>();
        for (ColumnSpec c : schema.columns()) {
            Object v = c.type().coerce(in.get(c.name()));
            if (v == null && !c.nullable() && !isDerived(c.name())) v = c.type().defaultValue();
            out.put(c.name(), v);
        }

        Instant recordedAt = null;
        if (recordedAtCol != null) {
            recordedAt = (Instant) out.get(recordedAtCol);
            if (recordedAt == null) {
                recordedAt = (Instant) ColumnType.TIMESTAMP.coerce(clock.instant());
                out.put(recordedAtCol, recordedAt);
            }
        }

        if (out.get(schema.versionColumn()) == null) {
            out.put(schema.versionColumn(), recordedAt != null ? recordedAt.toEpochMilli() : clock.millis());
        }

        if (recordedAt != null) {
            for (BucketColumn b : schema.buckets()) {
                ColumnType type = schema.column(b.name()).type();
                out.put(b.name(), type == ColumnType.STRING ? b.scope().label(recordedAt) : type.coerce(b.scope().truncate(recordedAt)));
            }
        }
        return Record.of(out);
    }

    // filled from other columns or the clock rather than defaulted
    private boolean isDerived(String column) {
        return schema.isKeyColumn(column)
                || column.equals(schema.versionColumn())
                || column.equals(schema.recordedAtColumn().orElse(null))
                || schema.buckets().stream().anyMatch(b -> b.name().equals(column));
    }

    public TableSchema schema() { return schema; }
}
