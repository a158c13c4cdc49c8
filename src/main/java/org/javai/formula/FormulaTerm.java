package org.javai.formula;

import java.util.List;
import java.util.Objects;

/**
 * A whole formula: a response side and a predictor side.
 *
 * <p>{@link #width()} and {@link #coefNames()} describe the predictor side; see
 * {@link #responseNames()} for the response.
 *
 * @param lhs the response term(s)
 * @param rhs the predictor term(s)
 */
public record FormulaTerm(Term lhs, Term rhs) implements Term {

    public FormulaTerm {
        Objects.requireNonNull(lhs, "lhs must not be null");
        Objects.requireNonNull(rhs, "rhs must not be null");
        if (lhs instanceof FormulaTerm || rhs instanceof FormulaTerm) {
            throw new IllegalArgumentException("formulas cannot be nested: " + lhs + " ~ " + rhs);
        }
    }

    @Override
    public int width() {
        return rhs.width();
    }

    @Override
    public List<String> coefNames() {
        return rhs.coefNames();
    }

    public List<String> responseNames() {
        return lhs.coefNames();
    }

    @Override
    public String toString() {
        return lhs + " ~ " + rhs;
    }
}
