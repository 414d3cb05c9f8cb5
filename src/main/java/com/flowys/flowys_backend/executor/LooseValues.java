package com.flowys.flowys_backend.executor;

import java.util.Collection;
import java.util.Map;

/**
 * Loose value semantics shared by the logic operations: numeric coercion, truthiness and
 * equality over the plain JSON values (Map, List, String, Number, Boolean, null) that flow
 * between nodes.
 */
public final class LooseValues {

    private LooseValues() {}

    /** Numeric view of a value; NaN when it has none. Blank strings and null count as 0. */
    public static double toNumber(Object value) {
        if (value == null) return 0;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1 : 0;
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) return 0;
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }

    /** Empty means falsy, or a collection/map without elements. */
    public static boolean isEmpty(Object value) {
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return !isTruthy(value);
    }

    /** Equality that compares numbers, numeric strings and booleans by value. */
    public static boolean looseEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number || b instanceof Number || a instanceof Boolean || b instanceof Boolean) {
            if (a.getClass() == b.getClass() && !(a instanceof Number)) {
                return a.equals(b);
            }
            double left = toNumber(a);
            double right = toNumber(b);
            return !Double.isNaN(left) && left == right;
        }
        return a.equals(b);
    }

    /** Equality without coercion across kinds; numbers still compare by value (1 equals 1.0). */
    public static boolean strictEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        return a == null ? b == null : a.equals(b);
    }

    public static String asString(Object value) {
        if (value == null) return "";
        if (value instanceof Double d && d == Math.floor(d) && !Double.isInfinite(d)) {
            return String.valueOf(d.longValue());
        }
        return value.toString();
    }

    /** Whole doubles become longs so 3 + 4 reports as 7, not 7.0. */
    public static Object normalize(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return null;
        if (d == Math.floor(d) && Math.abs(d) <= Long.MAX_VALUE) {
            return (long) d;
        }
        return d;
    }
}
