package org.javai.formula.frame;

import org.javai.formula.InterceptTerm;
import org.javai.formula.MatrixTerm;
import org.javai.formula.RankDeficiencyException;
import org.javai.formula.Term;
import org.javai.formula.contrast.Matrices;
import org.javai.formula.data.Table;
import org.javai.formula.materialize.Materializer;
import org.javai.formula.materialize.NumericMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The predictor matrix of a model with the term each column comes from.
 *
 * @param matrix the predictor columns
 * @param assign for each column, the 1-based index of its term among the
 *        non-intercept terms, or 0 for the intercept
 * @param coefNames for each column, its name
 */
public record ModelMatrix(NumericMatrix matrix, int[] assign, List<String> coefNames) {

    public ModelMatrix {
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(assign, "assign must not be null");
        coefNames = List.copyOf(coefNames);
        if (assign.length != matrix.columns() || coefNames.size() != matrix.columns()) {
            throw new IllegalArgumentException("matrix has " + matrix.columns() + " columns but " + assign.length
                    + " assignments and " + coefNames.size() + " names");
        }
        assign = assign.clone();
    }

    /**
     * Materializes a resolved predictor matrix term.
     */
    public static ModelMatrix of(MatrixTerm predictors, Table table, Materializer materializer) {
        NumericMatrix matrix = materializer.materialize(predictors, table);
        int[] assign = new int[predictors.width()];
        int column = 0;
        int termIndex = 0;
        for (Term term : predictors.terms()) {
            int index = term instanceof InterceptTerm ? 0 : ++termIndex;
            for (int k = 0; k < term.width(); k++) {
                assign[column++] = index;
            }
        }
        return new ModelMatrix(matrix, assign, predictors.coefNames());
    }

    @Override
    public int[] assign() {
        return assign.clone();
    }

    public int rank() {
        return Matrices.rank(matrix.toArray());
    }

    /**
     * @return this matrix
     * @throws RankDeficiencyException if the columns are linearly dependent
     */
    public ModelMatrix requireFullRank() {
        int rank = rank();
        if (rank < matrix.columns()) {
            throw new RankDeficiencyException(rank, matrix.columns());
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModelMatrix other
                && matrix.equals(other.matrix)
                && Arrays.equals(assign, other.assign)
                && coefNames.equals(other.coefNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matrix, Arrays.hashCode(assign), coefNames);
    }

    @Override
    public String toString() {
        return "ModelMatrix" + coefNames + " " + matrix;
    }
}
