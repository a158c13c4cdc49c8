package org.javai.formula.materialize;

/**
 * The marker for values that do not exist: missing input values and rows a shift
 * moves past the edge of the data.
 */
public final class Missing {

    /**
     * The missing marker, NaN. It is distinct from every valid value and propagates
     * through arithmetic.
     */
    public static final double VALUE = Double.NaN;

    private Missing() {
    }

    public static boolean isMissing(double value) {
        return Double.isNaN(value);
    }

    public static boolean isMissing(Object value) {
        return value == null || value instanceof Double d && d.isNaN() || value instanceof Float f && f.isNaN();
    }
}
