package io.snapshots.core;

import java.math.BigDecimal;
import java.math.BigInteger;

public final class Numbers {
    private Numbers() {}

    /** Exact decimal value of {@code n}, or null for NaN, infinities and numbers whose text is not a decimal. */
    public static BigDecimal toBigDecimal(Number n) {
        if (n == null) return null;
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) return BigDecimal.valueOf(n.longValue());
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return (Double.isNaN(d) || Double.isInfinite(d)) ? null : BigDecimal.valueOf(d);
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
