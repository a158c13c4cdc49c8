package org.javai.formula.contrast;

import java.util.ArrayList;
import java.util.List;

/**
 * A contrast coding system: a rule mapping the k levels of a categorical variable
 * onto numeric model-matrix columns.
 *
 * <p>A coding is combined with the levels observed in data to produce a
 * {@link ContrastsMatrix}. Implementations may fix the {@link #base() base level}
 * and the {@link #levels() level order}; when they don't, both are taken from the
 * data (the first level is the base).
 *
 * <p>Custom coding systems implement {@link #matrix(int, int)} and, optionally,
 * {@link #termNames(List, int)}:
 * <pre>{@code
 * record ReverseDummyCoding() implements Contrasts {
 *     public double[][] matrix(int baseIndex, int levelCount) { ... }
 * }
 * }</pre>
 *
 * @see DummyCoding
 * @see EffectsCoding
 * @see HelmertCoding
 * @see SeqDiffCoding
 * @see HypothesisCoding
 * @see ContrastsCoding
 * @see FullDummyCoding
 */
public interface Contrasts {

    /**
     * The base (reference) level, or null to use the first level.
     */
    default Object base() {
        return null;
    }

    /**
     * The levels to code, in order, or null to take them from the data.
     */
    default List<Object> levels() {
        return null;
    }

    /**
     * Builds the contrasts matrix: row i holds the codes for level i.
     *
     * @param baseIndex zero-based index of the base level
     * @param levelCount number of levels (k)
     * @return a k×(k-1) matrix for reduced-rank codings
     */
    double[][] matrix(int baseIndex, int levelCount);

    /**
     * Names for the generated columns. By default, the non-base levels in order.
     */
    default List<String> termNames(List<?> levels, int baseIndex) {
        List<String> names = new ArrayList<>(levels.size() - 1);
        for (int i = 0; i < levels.size(); i++) {
            if (i != baseIndex) {
                names.add(String.valueOf(levels.get(i)));
            }
        }
        return names;
    }

    /**
     * Whether this coding produces one column per level.
     */
    default boolean isFullRank() {
        return false;
    }

    /**
     * Short name used when printing terms.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
