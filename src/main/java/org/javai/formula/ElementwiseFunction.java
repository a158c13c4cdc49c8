package org.javai.formula;

/**
 * A numeric transform captured from a formula, applied independently to each row.
 *
 * <p>The arguments are the row's values of the function's referenced variables, in
 * the order of {@link FunctionTerm#argNames()}. Missing values are NaN and propagate.
 */
@FunctionalInterface
public interface ElementwiseFunction {

    double apply(double[] arguments);

    /**
     * Whether this function can be evaluated numerically. Functions unknown at
     * parse time are not, until a context-specific rule gives them meaning.
     */
    default boolean isEvaluable() {
        return true;
    }

    /**
     * A function that cannot be evaluated.
     */
    static ElementwiseFunction unsupported(String name) {
        return new ElementwiseFunction() {
            @Override
            public double apply(double[] arguments) {
                throw new UnsupportedOperationException("function '" + name + "' has no numeric implementation");
            }

            @Override
            public boolean isEvaluable() {
                return false;
            }
        };
    }
}
