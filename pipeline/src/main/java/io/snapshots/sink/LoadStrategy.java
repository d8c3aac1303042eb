package io.snapshots.sink;

/**
 * How a table is kept free of duplicate keys. Fixed per table.
 */
public enum LoadStrategy {
    /** Replace stored rows for incoming keys inside one transaction. */
    DELETE_INSERT,
    /** Append everything with a version; duplicates collapse on compaction or deduplicated reads. */
    VERSIONED_APPEND
}
