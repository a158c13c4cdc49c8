package org.javai.formula;

import java.util.List;

/**
 * A literal number in a formula. At the top level of a formula side, 1 requests an
 * intercept and 0 or -1 suppress it; inside a function call it is an ordinary
 * argument (e.g. the step of {@code lag(x, 2)}).
 *
 * @param value the literal value
 */
public record ConstantTerm(double value) implements Term {

    public static final ConstantTerm ONE = new ConstantTerm(1);
    public static final ConstantTerm ZERO = new ConstantTerm(0);
    public static final ConstantTerm MINUS_ONE = new ConstantTerm(-1);

    /**
     * Whether this constant is one of the intercept markers 0, 1 and -1.
     */
    public boolean isInterceptMarker() {
        return value == 1 || value == 0 || value == -1;
    }

    public boolean isIntegral() {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    @Override
    public int width() {
        return 1;
    }

    @Override
    public List<String> coefNames() {
        return List.of(toString());
    }

    @Override
    public String toString() {
        return isIntegral() ? Long.toString((long) value) : Double.toString(value);
    }
}
