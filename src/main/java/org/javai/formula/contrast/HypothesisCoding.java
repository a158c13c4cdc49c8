package org.javai.formula.contrast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Coding specified by a (k-1)×k hypothesis matrix.
 *
 * <p>Each row gives the weights of the k level means in one tested hypothesis; the
 * corresponding coefficient estimates that weighted sum. The contrasts matrix is
 * the pseudo-inverse of the hypothesis matrix. For sequential differences of four
 * levels:
 * <pre>{@code
 * new HypothesisCoding(new double[][] {
 *         {-1,  1,  0, 0},
 *         { 0, -1,  1, 0},
 *         { 0,  0, -1, 1}},
 *     null, List.of("b-a", "c-b", "d-c"));
 * }</pre>
 *
 * @param hypotheses the (k-1)×k hypothesis matrix
 * @param levels the level order matching the hypothesis columns (may be null: from data)
 * @param labels column names, one per hypothesis (may be null: non-base levels)
 */
public record HypothesisCoding(double[][] hypotheses, List<Object> levels, List<String> labels)
        implements Contrasts {

    public HypothesisCoding {
        Objects.requireNonNull(hypotheses, "hypotheses must not be null");
        hypotheses = Matrices.copy(hypotheses);
        levels = levels == null ? null : List.copyOf(levels);
        labels = labels == null ? null : List.copyOf(labels);
        if (labels != null && labels.size() != hypotheses.length) {
            throw new IllegalArgumentException("expected " + hypotheses.length + " labels, got " + labels.size());
        }
        ContrastsCoding.checkSize(Matrices.pseudoInverse(hypotheses),
                levels == null ? Matrices.columns(hypotheses) : levels.size());
    }

    public HypothesisCoding(double[][] hypotheses) {
        this(hypotheses, null, null);
    }

    /**
     * Builds a coding from labelled hypothesis vectors, in map iteration order.
     */
    public static HypothesisCoding of(Map<String, double[]> hypotheses, List<Object> levels) {
        Map<String, double[]> ordered = new LinkedHashMap<>(hypotheses);
        List<String> labels = new ArrayList<>(ordered.keySet());
        double[][] mat = new double[labels.size()][];
        for (int i = 0; i < labels.size(); i++) {
            mat[i] = ordered.get(labels.get(i)).clone();
        }
        return new HypothesisCoding(mat, levels, labels);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        double[][] contrasts = Matrices.pseudoInverse(hypotheses);
        ContrastsCoding.checkSize(contrasts, levelCount);
        return contrasts;
    }

    @Override
    public List<String> termNames(List<?> levels, int baseIndex) {
        return labels != null ? labels : Contrasts.super.termNames(levels, baseIndex);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HypothesisCoding other
                && Arrays.deepEquals(hypotheses, other.hypotheses)
                && Objects.equals(levels, other.levels)
                && Objects.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.deepHashCode(hypotheses), levels, labels);
    }

    @Override
    public String toString() {
        return "HypothesisCoding[hypotheses=" + Arrays.deepToString(hypotheses)
                + ", levels=" + levels + ", labels=" + labels + "]";
    }
}
