package io.snapshots.transform;

import io.snapshots.core.Record;

/**
 * Maps one record to another. Returning null drops the record; throwing drops it and counts a failure.
 */
@FunctionalInterface
public interface RecordFunction {
    Record apply(Record record) throws Exception;

    default RecordFunction andThen(RecordFunction next) {
        return r -> {
            Record out = apply(r);
            return out == null ? null : next.apply(out);
        };
    }
}
