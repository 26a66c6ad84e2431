package com.hive.graph.expression;

import java.math.BigDecimal;

/** Truthiness rules shared by predicate edges and conditional rules. */
public final class Truthiness {

    private Truthiness() {
    }

    /**
     * False for null, {@code false}, numeric zero, the empty string and the string {@code "false"}
     * (case-insensitive); true for everything else.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return !isFinite(n) || toBigDecimal(n).signum() != 0;
        if (value instanceof CharSequence cs) {
            String s = cs.toString();
            return !s.isEmpty() && !"false".equalsIgnoreCase(s);
        }
        return true;
    }

    /** False only for NaN and the infinities of {@link Double} and {@link Float}. */
    static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) return Double.isFinite(n.doubleValue());
        return true;
    }

    /** Callers must check {@link #isFinite(Number)} first. */
    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return new BigDecimal(n.toString());
    }
}
