package io.snapshots.backfill;

/**
 * What {@link BackfillContext#advanceWatermark} does while a backfill window is active.
 */
public enum BackfillWatermarkPolicy {
    /** Backfilled data never moves the incremental watermark. */
    IGNORE,
    /** The watermark moves forward when the new time is later than the stored one. */
    ADVANCE_IF_NEWER
}
