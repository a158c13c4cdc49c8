package org.javai.formula;

import java.util.List;

/**
 * A node in a formula's term tree.
 *
 * <p>Terms are immutable values. Parsing produces unresolved terms
 * ({@link VariableTerm}, {@link ConstantTerm}, {@link FunctionTerm}) combined with
 * {@link InteractionTerm} and {@link TermTuple}; applying a schema replaces them with
 * resolved, data-aware terms ({@link ContinuousTerm}, {@link CategoricalTerm},
 * {@link InterceptTerm}, {@link ShiftTerm}) grouped into a {@link MatrixTerm}. Every
 * transformation builds a new tree.
 *
 * <p>The set of terms is closed except for {@link CustomTerm}, through which
 * model-specific extensions introduce their own resolved terms.
 *
 * @see Terms
 */
public sealed interface Term permits VariableTerm, ConstantTerm, InteractionTerm, FunctionTerm,
        ContinuousTerm, CategoricalTerm, InterceptTerm, MatrixTerm, FormulaTerm, TermTuple, ShiftTerm,
        CustomTerm {

    /**
     * Number of model-matrix columns this term generates, computed from its
     * structure alone.
     *
     * @throws IllegalStateException for terms whose width depends on a schema that
     *         has not been applied yet
     */
    int width();

    /**
     * Names of the generated columns, in materialization order. Always
     * {@link #width()} names long.
     */
    List<String> coefNames();

    /**
     * Whether this term contributes columns to the predictor matrix. Non-matrix terms
     * are passed through schema application separately.
     */
    default boolean isMatrixTerm() {
        return true;
    }
}
