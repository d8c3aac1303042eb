package io.snapshots.sink;

import io.snapshots.core.TimeScope;

/** A column holding the {@link TimeScope} bucket of the row's recorded-at instant. */
public record BucketColumn(String name, TimeScope scope) {
}
