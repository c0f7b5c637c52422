package cn.edu.zju.daily.metricguard.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import smile.hash.MurmurHash3;

public class HashUtils {

    /**
     * 32-bit MurmurHash3 of the canonical string form of a value. Integral numbers hash the same
     * whatever their boxed type, so {@code 10}, {@code 10L} and {@code 10.0} collide on purpose.
     */
    public static int hash32(Object value, int seed) {
        return MurmurHash3.hash32(canonical(value), seed);
    }

    public static String canonical(Object value) {
        if (value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    /** Mixes two seeds so that the result does not depend on their order. */
    public static long symmetricSeed(long a, long b) {
        long lo = Math.min(a, b);
        long hi = Math.max(a, b);
        return MurmurHash3.hash32(lo + ":" + hi, 38324);
    }
}
