package io.snapshots.core;

import io.snapshots.error.ConfigurationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Time range a pipeline run processes. In INCREMENTAL mode the bounds were derived from the watermark and
 * the clock; in BACKFILL mode both bounds are pinned.
 */
public record TimeWindow(Instant start, Instant end, WindowMode mode) {
    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(mode, "mode");
        if (start.isAfter(end)) {
            throw new ConfigurationException("window start " + start + " is after end " + end);
        }
    }

    public static TimeWindow incremental(Instant start, Instant end) { return new TimeWindow(start, end, WindowMode.INCREMENTAL); }
    public static TimeWindow backfill(Instant start, Instant end) { return new TimeWindow(start, end, WindowMode.BACKFILL); }

    public boolean isBackfill() { return mode == WindowMode.BACKFILL; }
    public Duration length() { return Duration.between(start, end); }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }
}
