package io.snapshots.jobs;

import io.snapshots.error.ConfigurationException;

import java.util.List;
import java.util.Locale;

/**
 * Syntax check for standard 5-field cron expressions (minute, hour, day of month, month, day of week).
 * Fields accept {@code *}, numbers, ranges {@code a-b}, steps on a range or on a star ({@code a-b/n}),
 * comma lists, and three-letter month and weekday names.
 */
public final class CronExpressions {
    private CronExpressions() {}

    private record Field(String label, int min, int max, List<String> names) {}

    private static final List<Field> FIELDS = List.of(
            new Field("minute", 0, 59, List.of()),
            new Field("hour", 0, 23, List.of()),
            new Field("day of month", 1, 31, List.of()),
            new Field("month", 1, 12, List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC")),
            new Field("day of week", 0, 7, List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT")));

    public static boolean isValid(String expression) {
        try {
            validate(expression);
            return true;
        } catch (ConfigurationException e) {
            return false;
        }
    }

    /** Throws {@link ConfigurationException} naming the offending field when {@code expression} is malformed. */
    public static void validate(String expression) {
        if (expression == null || expression.isBlank()) throw new ConfigurationException("cron expression is empty");
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != FIELDS.size()) {
            throw new ConfigurationException("cron expression '" + expression + "' must have 5 fields, got " + parts.length);
        }
        for (int i = 0; i < parts.length; i++) {
            Field f = FIELDS.get(i);
            for (String item : parts[i].split(",", -1)) {
                if (!validItem(item, f)) {
                    throw new ConfigurationException("invalid " + f.label() + " field '" + parts[i] + "' in cron expression '" + expression + "'");
                }
            }
        }
    }

    private static boolean validItem(String item, Field f) {
        if (item.isEmpty()) return false;
        String range = item;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            Integer step = number(item.substring(slash + 1));
            if (step == null || step < 1 || step > f.max()) return false;
        }
        if (range.equals("*")) return true;
        int dash = range.indexOf('-');
        if (dash < 0) return value(range, f) != null;
        Integer lo = value(range.substring(0, dash), f);
        Integer hi = value(range.substring(dash + 1), f);
        return lo != null && hi != null && lo <= hi;
    }

    private static Integer value(String s, Field f) {
        Integer n = number(s);
        if (n == null) {
            int idx = f.names().indexOf(s.toUpperCase(Locale.ROOT));
            if (idx < 0) return null;
            n = idx + f.min();
        }
        return (n < f.min() || n > f.max()) ? null : n;
    }

    private static Integer number(String s) {
        if (s.isEmpty() || s.length() > 2 || !s.chars().allMatch(Character::isDigit)) return null;
        return Integer.parseInt(s);
    }
}
