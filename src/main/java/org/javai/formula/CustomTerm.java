package org.javai.formula;

import java.util.List;
import java.util.Set;

/**
 * Extension point for model-specific terms.
 *
 * <p>Use this when the built-in terms don't cover a model's needs, typically as the
 * result of a context-specific rule for a function call:
 * <pre>{@code
 * // y ~ poly(x, 3) under a polynomial-model context
 * record PolyTerm(ContinuousTerm term, int degree) implements CustomTerm, ColumnGenerator {
 *     public int width() { return degree; }
 *     ...
 * }
 * }</pre>
 *
 * <p>To produce columns, a custom term also implements
 * {@code org.javai.formula.materialize.ColumnGenerator}.
 */
public non-sealed interface CustomTerm extends Term {

    /**
     * Names of the data columns this term reads, for schema computation.
     */
    default Set<String> variables() {
        return Set.of();
    }

    /**
     * Symbols identifying this term in redundancy bookkeeping. Two terms with the
     * same symbols are considered the same term.
     */
    default Set<String> symbols() {
        return Set.of(toString());
    }

    /**
     * Whether this term is fully resolved.
     */
    default boolean hasSchema() {
        return true;
    }

    @Override
    List<String> coefNames();
}
