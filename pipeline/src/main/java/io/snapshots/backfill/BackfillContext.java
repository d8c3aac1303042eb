package io.snapshots.backfill;

import io.snapshots.core.TimeWindow;
import io.snapshots.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks which time range a job is processing. Each job owns its own instance, so concurrent backfills of
 * different jobs never see each other's window.
 *
 * <p>Two states: INCREMENTAL (no pinned window; {@link #getWindow()} derives {@code (watermark, now)}) and
 * BACKFILL (entered by {@link #setWindow}, left by {@link #clear()}).
 */
public class BackfillContext {
    private static final Logger log = LoggerFactory.getLogger(BackfillContext.class);

    private final String job;
    private final WatermarkStore watermarks;
    private final Duration defaultLookback;
    private final Clock clock;
    private final BackfillWatermarkPolicy policy;

    private TimeWindow backfillWindow;
    private String owner;

    public BackfillContext(String job, WatermarkStore watermarks, Duration defaultLookback, Clock clock, BackfillWatermarkPolicy policy) {
        this.job = Objects.requireNonNull(job, "job");
        this.watermarks = Objects.requireNonNull(watermarks, "watermarks");
        this.defaultLookback = Objects.requireNonNull(defaultLookback, "defaultLookback");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (defaultLookback.isNegative()) throw new ConfigurationException("default lookback must not be negative");
    }

    public BackfillContext(String job, WatermarkStore watermarks) {
        this(job, watermarks, Duration.ofHours(1), Clock.systemUTC(), BackfillWatermarkPolicy.IGNORE);
    }

    /** Pins a window and enters BACKFILL mode, replacing any window already pinned. */
    public synchronized void setWindow(Instant start, Instant end, String owner) {
        if (start == null || end == null) throw new ConfigurationException("backfill window bounds are required");
        if (start.isAfter(end)) {
            throw new ConfigurationException("backfill start " + start + " is after end " + end + " for " + job);
        }
        if (owner == null || owner.isBlank()) throw new ConfigurationException("backfill window needs an owner");
        this.backfillWindow = TimeWindow.backfill(start, end);
        this.owner = owner;
        log.info("Backfill window for {} set by {}: {} to {}", job, owner, start, end);
    }

    /** The pinned backfill window if any, otherwise an incremental window ending now. */
    public synchronized TimeWindow getWindow() {
        if (backfillWindow != null) return backfillWindow;
        Instant now = clock.instant();
        Instant start = watermarks.get(job).orElse(now.minus(defaultLookback));
        // a watermark ahead of the clock (clock skew, manual edit) collapses to an empty window
        if (start.isAfter(now)) start = now;
        return TimeWindow.incremental(start, now);
    }

    /**
     * Records {@code newTime} as processed. Never moves the watermark backwards. While a backfill window is
     * active the configured {@link BackfillWatermarkPolicy} decides whether the call has any effect.
     */
    public synchronized void advanceWatermark(Instant newTime) {
        Objects.requireNonNull(newTime, "newTime");
        if (backfillWindow != null && policy == BackfillWatermarkPolicy.IGNORE) {
            log.debug("Ignoring watermark advance to {} for {} during backfill", newTime, job);
            return;
        }
        Optional<Instant> current = watermarks.get(job);
        if (current.isPresent() && !newTime.isAfter(current.get())) return;
        watermarks.put(job, newTime);
        log.info("Watermark for {} advanced to {}", job, newTime);
    }

    /** Drops the pinned window and returns to incremental derivation. Safe to call when not in backfill. */
    public synchronized void clear() {
        if (backfillWindow == null) return;
        log.info("Cleared backfill window for {} (owner {})", job, owner);
        backfillWindow = null;
        owner = null;
    }

    public synchronized boolean isBackfill() { return backfillWindow != null; }
    public synchronized Optional<String> activeOwner() { return Optional.ofNullable(owner); }
    public Optional<Instant> lastWatermark() { return watermarks.get(job); }
    public String job() { return job; }
    public BackfillWatermarkPolicy policy() { return policy; }
    public Clock clock() { return clock; }
}
