package io.snapshots.sink;

import io.snapshots.core.Numbers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Storage types of target columns. Each type knows how to coerce a loosely typed source value, how to bind
 * it to a statement and how to read it back.
 */
public enum ColumnType {
    STRING("VARCHAR(1024)", Types.VARCHAR),
    DECIMAL("DECIMAL(38,8)", Types.DECIMAL),
    LONG("BIGINT", Types.BIGINT),
    INT("INTEGER", Types.INTEGER),
    TIMESTAMP("TIMESTAMP WITH TIME ZONE", Types.TIMESTAMP_WITH_TIMEZONE),
    DATE("DATE", Types.DATE);

    /** Fractional digits kept for DECIMAL columns. */
    public static final int SCALE = 8;

    private final String sqlType;
    private final int jdbcType;

    ColumnType(String sqlType, int jdbcType) {
        this.sqlType = sqlType;
        this.jdbcType = jdbcType;
    }

    public String sqlType() { return sqlType; }

    /** Value used for a missing or unparseable value in a NOT NULL column. */
    public Object defaultValue() {
        return switch (this) {
            case STRING -> "";
            case DECIMAL -> BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
            case LONG -> 0L;
            case INT -> 0;
            case TIMESTAMP -> Instant.EPOCH;
            case DATE -> LocalDate.EPOCH;
        };
    }

    /** Canonical form of {@code v} for this type, or null when it cannot be interpreted. */
    public Object coerce(Object v) {
        if (v == null) return null;
        return switch (this) {
            case STRING -> toText(v);
            case DECIMAL -> {
                BigDecimal d = toDecimal(v);
                yield d == null ? null : d.setScale(SCALE, RoundingMode.HALF_UP);
            }
            case LONG -> {
                if (v instanceof Instant i) yield i.toEpochMilli();
                BigDecimal d = toDecimal(v);
                yield d == null ? null : longOrNull(d);
            }
            case INT -> {
                BigDecimal d = toDecimal(v);
                Long l = d == null ? null : longOrNull(d);
                yield (l == null || l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) ? null : l.intValue();
            }
            case TIMESTAMP -> {
                Instant i = toInstant(v);
                yield i == null ? null : i.truncatedTo(ChronoUnit.MICROS);
            }
            case DATE -> {
                if (v instanceof LocalDate d) yield d;
                if (v instanceof String s) {
                    try {
                        yield LocalDate.parse(s.trim());
                    } catch (DateTimeParseException e) {
                        // fall through to instant forms
                    }
                }
                Instant i = toInstant(v);
                yield i == null ? null : LocalDate.ofInstant(i, ZoneOffset.UTC);
            }
        };
    }

    void bind(PreparedStatement ps, int index, Object v) throws SQLException {
        if (v == null) {
            ps.setNull(index, jdbcType);
            return;
        }
        switch (this) {
            case STRING -> ps.setString(index, (String) v);
            case DECIMAL -> ps.setBigDecimal(index, (BigDecimal) v);
            case LONG -> ps.setLong(index, (Long) v);
            case INT -> ps.setInt(index, (Integer) v);
            case TIMESTAMP -> ps.setObject(index, ((Instant) v).atOffset(ZoneOffset.UTC));
            case DATE -> ps.setObject(index, v);
        }
    }

    Object read(ResultSet rs, int index) throws SQLException {
        return switch (this) {
            case STRING -> rs.getString(index);
            case DECIMAL -> rs.getBigDecimal(index);
            case LONG -> {
                long l = rs.getLong(index);
                yield rs.wasNull() ? null : l;
            }
            case INT -> {
                int i = rs.getInt(index);
                yield rs.wasNull() ? null : i;
            }
            case TIMESTAMP -> {
                OffsetDateTime t = rs.getObject(index, OffsetDateTime.class);
                yield t == null ? null : t.toInstant();
            }
            case DATE -> rs.getObject(index, LocalDate.class);
        };
    }

    private static String toText(Object v) {
        if (v instanceof Collection<?> c) return c.stream().map(String::valueOf).collect(Collectors.joining(","));
        return v.toString();
    }

    private static BigDecimal toDecimal(Object v) {
        if (v instanceof Number n) return Numbers.toBigDecimal(n);
        if (v instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Long longOrNull(BigDecimal d) {
        try {
            return d.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Instant toInstant(Object v) {
        if (v instanceof Instant i) return i;
        if (v instanceof OffsetDateTime o) return o.toInstant();
        if (v instanceof ZonedDateTime z) return z.toInstant();
        if (v instanceof LocalDate d) return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        if (v instanceof Long || v instanceof Integer) return Instant.ofEpochMilli(((Number) v).longValue());
        if (v instanceof String s) {
            String t = s.trim();
            try {
                return Instant.parse(t);
            } catch (DateTimeParseException e) {
                try {
                    return OffsetDateTime.parse(t).toInstant();
                } catch (DateTimeParseException e2) {
                    return null;
                }
            }
        }
        return null;
    }
}
