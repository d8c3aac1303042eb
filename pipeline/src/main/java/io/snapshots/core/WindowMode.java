package io.snapshots.core;

public enum WindowMode {
    INCREMENTAL,
    BACKFILL
}
