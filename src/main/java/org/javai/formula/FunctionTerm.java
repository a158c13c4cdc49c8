package org.javai.formula;

import java.util.List;
import java.util.Objects;

/**
 * A call to a function that is not part of the formula syntax, e.g. {@code log(x)}.
 *
 * <p>The call is captured twice: {@link #args()} are the arguments parsed under formula
 * rules, so extensions can recognize structure (e.g. the degree in {@code poly(x, 3)}),
 * and {@link #function()} is the original expression compiled into a numeric
 * transform over the variables it references ({@link #argNames()}).
 *
 * <p>Equality ignores the compiled function, which is derived from the expression.
 *
 * @param name the called function's name
 * @param args the arguments parsed as terms
 * @param expression the original call as written
 * @param argNames the variables referenced by the call, in first-appearance order
 * @param function the compiled numeric transform
 */
public record FunctionTerm(String name, List<Term> args, String expression, List<String> argNames,
                           ElementwiseFunction function) implements Term {

    public FunctionTerm {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(function, "function must not be null");
        args = List.copyOf(args);
        argNames = List.copyOf(argNames);
    }

    @Override
    public int width() {
        return 1;
    }

    @Override
    public List<String> coefNames() {
        return List.of(expression);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FunctionTerm other
                && name.equals(other.name)
                && args.equals(other.args)
                && expression.equals(other.expression)
                && argNames.equals(other.argNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, expression, argNames);
    }

    @Override
    public String toString() {
        return expression;
    }
}
