package org.javai.formula;

/**
 * Thrown when a model matrix is required to have full column rank but its columns
 * are linearly dependent.
 */
public class RankDeficiencyException extends FormulaException {

    private final int rank;
    private final int columns;

    public RankDeficiencyException(int rank, int columns) {
        super("Model matrix is rank deficient: rank " + rank + " < " + columns + " columns");
        this.rank = rank;
        this.columns = columns;
    }

    public int rank() {
        return rank;
    }

    public int columns() {
        return columns;
    }
}
