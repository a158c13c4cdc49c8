package org.javai.formula.schema;

import org.javai.formula.CategoricalTerm;
import org.javai.formula.ContinuousTerm;
import org.javai.formula.Term;
import org.javai.formula.contrast.Contrasts;
import org.javai.formula.contrast.DummyCoding;

import java.util.Objects;

/**
 * An explicit choice of how a variable resolves, overriding the choice made from
 * the column's element type.
 */
public sealed interface Hint permits Hint.Continuous, Hint.Categorical, Hint.Fixed {

    /**
     * Treat the variable as continuous. Every non-missing value must be a number.
     */
    static Hint continuous() {
        return Continuous.INSTANCE;
    }

    /**
     * Treat the variable as categorical with dummy coding.
     */
    static Hint categorical() {
        return new Categorical(new DummyCoding());
    }

    /**
     * Treat the variable as categorical with the given coding.
     */
    static Hint contrasts(Contrasts contrasts) {
        return new Categorical(contrasts);
    }

    /**
     * Use a concrete term as is, for resolving new data with the schema of old data.
     */
    static Hint term(Term term) {
        return new Fixed(term);
    }

    record Continuous() implements Hint {
        static final Continuous INSTANCE = new Continuous();
    }

    record Categorical(Contrasts contrasts) implements Hint {
        public Categorical {
            Objects.requireNonNull(contrasts, "contrasts must not be null");
        }
    }

    record Fixed(Term term) implements Hint {
        public Fixed {
            Objects.requireNonNull(term, "term must not be null");
            if (!(term instanceof ContinuousTerm || term instanceof CategoricalTerm)) {
                throw new IllegalArgumentException("a fixed hint must be a continuous or categorical term, got " + term);
            }
        }
    }
}
