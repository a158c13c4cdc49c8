package org.javai.formula;

import java.util.List;

/**
 * The resolved intercept: a constant column of ones when present, no column when
 * absent.
 *
 * @param present whether the model has an intercept
 */
public record InterceptTerm(boolean present) implements Term {

    public static final InterceptTerm PRESENT = new InterceptTerm(true);
    public static final InterceptTerm ABSENT = new InterceptTerm(false);

    public static final String NAME = "(Intercept)";

    @Override
    public int width() {
        return present ? 1 : 0;
    }

    @Override
    public List<String> coefNames() {
        return present ? List.of(NAME) : List.of();
    }

    @Override
    public String toString() {
        return present ? "1" : "0";
    }
}
