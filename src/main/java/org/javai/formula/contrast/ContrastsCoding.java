package org.javai.formula.contrast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Coding by a manually specified k×(k-1) contrasts matrix, copied as is into the
 * model matrix. Prefer {@link HypothesisCoding} when the intent is a set of
 * hypotheses about level means.
 *
 * @param contrasts the k×(k-1) contrasts matrix
 * @param levels the level order (may be null: from data)
 */
public record ContrastsCoding(double[][] contrasts, List<Object> levels) implements Contrasts {

    public ContrastsCoding {
        Objects.requireNonNull(contrasts, "contrasts must not be null");
        contrasts = Matrices.copy(contrasts);
        levels = levels == null ? null : List.copyOf(levels);
        checkSize(contrasts, levels == null ? contrasts.length : levels.size());
    }

    public ContrastsCoding(double[][] contrasts) {
        this(contrasts, null);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        checkSize(contrasts, levelCount);
        return Matrices.copy(contrasts);
    }

    static void checkSize(double[][] mat, int levelCount) {
        int cols = Matrices.columns(mat);
        if (mat.length != levelCount || cols != levelCount - 1) {
            throw new IllegalArgumentException("contrasts matrix wrong size for " + levelCount
                    + " levels. Expected " + levelCount + "x" + (levelCount - 1)
                    + ", got " + mat.length + "x" + cols);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ContrastsCoding other
                && Arrays.deepEquals(contrasts, other.contrasts)
                && Objects.equals(levels, other.levels);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(contrasts) + Objects.hashCode(levels);
    }

    @Override
    public String toString() {
        return "ContrastsCoding[contrasts=" + Arrays.deepToString(contrasts) + ", levels=" + levels + "]";
    }
}
