package org.javai.formula.contrast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A contrast coding system instantiated for a particular set of levels.
 *
 * <p>Row i of the matrix holds the model-matrix codes for level i; column j is one
 * generated column, named by {@link #termNames()}. Instances are immutable.
 *
 * <p>Two contrasts matrices are equal when they have the same matrix, term names,
 * levels and the same kind of coding, so they generate identical columns.
 */
public final class ContrastsMatrix {

    private final double[][] matrix;
    private final List<String> termNames;
    private final List<Object> levels;
    private final Contrasts contrasts;
    private final Map<Object, Integer> index;

    private ContrastsMatrix(double[][] matrix, List<String> termNames, List<Object> levels, Contrasts contrasts) {
        this.matrix = matrix;
        this.termNames = List.copyOf(termNames);
        this.levels = List.copyOf(levels);
        this.contrasts = contrasts;
        this.index = new HashMap<>();
        for (int i = 0; i < this.levels.size(); i++) {
            index.put(this.levels.get(i), i);
        }
    }

    /**
     * Instantiates a coding for the levels observed in data.
     *
     * <p>If the coding fixes its own levels they must be exactly the data levels
     * (in any order); levels missing from either side would produce empty columns
     * or undefined rows.
     *
     * @throws IllegalArgumentException on mismatching levels, an unknown base level,
     *         or fewer than two levels for a reduced-rank coding
     */
    public static ContrastsMatrix of(Contrasts contrasts, List<?> dataLevels) {
        Objects.requireNonNull(contrasts, "contrasts must not be null");
        Objects.requireNonNull(dataLevels, "dataLevels must not be null");
        List<Object> levels = new ArrayList<>(contrasts.levels() != null ? contrasts.levels() : dataLevels);

        Set<Object> mismatched = new LinkedHashSet<>(levels);
        mismatched.addAll(dataLevels);
        Set<Object> common = new LinkedHashSet<>(levels);
        common.retainAll(dataLevels);
        mismatched.removeAll(common);
        if (!mismatched.isEmpty()) {
            throw new IllegalArgumentException("contrasts levels not found in data or vice-versa: " + mismatched
                    + ". Data levels: " + dataLevels + ". Contrast levels: " + levels);
        }

        int n = levels.size();
        if (contrasts.isFullRank()) {
            if (n == 0) {
                throw new IllegalArgumentException("empty set of levels found");
            }
        } else if (n == 0) {
            throw new IllegalArgumentException("empty set of levels found (need at least two to compute contrasts)");
        } else if (n == 1) {
            throw new IllegalArgumentException("only one level found: " + levels.get(0)
                    + " (need at least two to compute contrasts)");
        }

        int baseIndex = 0;
        if (contrasts.base() != null) {
            baseIndex = levels.indexOf(contrasts.base());
            if (baseIndex < 0) {
                throw new IllegalArgumentException("base level " + contrasts.base() + " not found in levels " + levels);
            }
        }

        double[][] mat = contrasts.matrix(baseIndex, n);
        List<String> names = contrasts.termNames(levels, baseIndex);
        if (mat.length != n) {
            throw new IllegalArgumentException("contrasts matrix has " + mat.length + " rows for " + n + " levels");
        }
        if (names.size() != Matrices.columns(mat)) {
            throw new IllegalArgumentException("contrasts produce " + Matrices.columns(mat)
                    + " columns but " + names.size() + " names");
        }
        return new ContrastsMatrix(mat, names, levels, contrasts);
    }

    /**
     * The full-rank (one indicator column per level) version of this matrix.
     */
    public ContrastsMatrix fullRank() {
        if (contrasts instanceof FullDummyCoding) {
            return this;
        }
        return of(new FullDummyCoding(), levels);
    }

    /**
     * Checks that every given level is known to this matrix, for coding new data
     * that may contain only a subset of the original levels.
     *
     * @return this matrix
     * @throws IllegalArgumentException naming the unknown levels
     */
    public ContrastsMatrix requireLevels(Collection<?> dataLevels) {
        List<Object> unknown = new ArrayList<>();
        for (Object level : dataLevels) {
            if (!index.containsKey(level)) {
                unknown.add(level);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("there are levels in data that are not in the contrasts: " + unknown
                    + ". Contrast levels: " + levels);
        }
        return this;
    }

    /**
     * Zero-based row of a level.
     *
     * @throws IllegalArgumentException if the level is unknown
     */
    public int indexOf(Object level) {
        Integer i = index.get(level);
        if (i == null) {
            throw new IllegalArgumentException("level " + level + " not found in contrasts levels " + levels);
        }
        return i;
    }

    /**
     * The codes for one level (a copy).
     */
    public double[] row(Object level) {
        return matrix[indexOf(level)].clone();
    }

    public double get(int row, int column) {
        return matrix[row][column];
    }

    public double[][] matrix() {
        return Matrices.copy(matrix);
    }

    public int rows() {
        return matrix.length;
    }

    public int columns() {
        return termNames.size();
    }

    public List<String> termNames() {
        return termNames;
    }

    public List<Object> levels() {
        return levels;
    }

    public Contrasts contrasts() {
        return contrasts;
    }

    public boolean isFullRank() {
        return columns() == rows();
    }

    /**
     * The hypothesis matrix of these contrasts: the weights of the level means that
     * each coefficient estimates, assuming a balanced design.
     *
     * <p>An intercept column is prepended before inverting when the contrasts need
     * it, i.e. they are rank deficient and not all orthogonal to the intercept.
     */
    public double[][] hypothesisMatrix() {
        return hypothesisMatrix(matrix, needsIntercept(matrix));
    }

    public static double[][] hypothesisMatrix(double[][] contrasts, boolean intercept) {
        double[][] mat = contrasts;
        if (intercept) {
            mat = new double[contrasts.length][];
            for (int i = 0; i < contrasts.length; i++) {
                double[] row = new double[contrasts[i].length + 1];
                row[0] = 1.0;
                System.arraycopy(contrasts[i], 0, row, 1, contrasts[i].length);
                mat[i] = row;
            }
        }
        return Matrices.pseudoInverse(mat);
    }

    static boolean needsIntercept(double[][] mat) {
        if (Matrices.rank(mat) >= mat.length) {
            return false;
        }
        for (int j = 0; j < Matrices.columns(mat); j++) {
            double sum = 0.0;
            double scale = 0.0;
            for (double[] row : mat) {
                sum += row[j];
                scale += Math.abs(row[j]);
            }
            if (Math.abs(sum) > 1e-5 * Math.max(1.0, scale)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContrastsMatrix other)) {
            return false;
        }
        return contrasts.getClass() == other.contrasts.getClass()
                && Arrays.deepEquals(matrix, other.matrix)
                && termNames.equals(other.termNames)
                && levels.equals(other.levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contrasts.getClass(), Arrays.deepHashCode(matrix), termNames, levels);
    }

    @Override
    public String toString() {
        return contrasts.name() + levels + "->" + termNames;
    }
}
