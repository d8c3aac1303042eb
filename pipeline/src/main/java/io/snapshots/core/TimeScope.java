package io.snapshots.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Granularity at which snapshots are bucketed for storage and querying. Buckets are computed in UTC.
 */
public enum TimeScope {
    LATEST("yyyy-MM-dd HH:mm:ss"),
    HOURLY("yyyy-MM-dd HH:00:00"),
    DAILY("yyyy-MM-dd"),
    WEEKLY("yyyy-MM-dd"),
    MONTHLY("yyyy-MM"),
    YEARLY("yyyy");

    private final DateTimeFormatter format;

    TimeScope(String pattern) {
        this.format = DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withZone(ZoneOffset.UTC);
    }

    /** Start of the bucket containing {@code t}. Weeks start on Monday. */
    public Instant truncate(Instant t) {
        ZonedDateTime z = t.atZone(ZoneOffset.UTC);
        return switch (this) {
            case LATEST -> t.truncatedTo(ChronoUnit.SECONDS);
            case HOURLY -> z.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAILY -> z.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEKLY -> z.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
            case MONTHLY -> z.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).toInstant();
            case YEARLY -> z.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1).toInstant();
        };
    }

    /** Bucket label stored alongside the row, e.g. {@code 2024-05-01 13:00:00} for HOURLY. */
    public String label(Instant t) {
        return format.format(truncate(t));
    }

    public static TimeScope parse(String s) {
        return TimeScope.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
