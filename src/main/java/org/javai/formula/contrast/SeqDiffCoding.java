package org.javai.formula.contrast;

import java.util.List;

/**
 * Codes for differences between sequential levels: the coefficient for column j
 * estimates the difference between levels j+1 and j (in level order).
 * <pre>
 * levels a b c d:
 *  -0.75 -0.5 -0.25
 *   0.25 -0.5 -0.25
 *   0.25  0.5 -0.25
 *   0.25  0.5  0.75
 * </pre>
 *
 * @param base the base level (may be null: first level); only affects column names
 * @param levels the level order (may be null: from data)
 */
public record SeqDiffCoding(Object base, List<Object> levels) implements Contrasts {

    public SeqDiffCoding {
        levels = levels == null ? null : List.copyOf(levels);
    }

    public SeqDiffCoding() {
        this(null, null);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        double[][] mat = new double[levelCount][levelCount - 1];
        for (int column = 1; column < levelCount; column++) {
            for (int row = 0; row < levelCount; row++) {
                double value = row < column ? column - levelCount : column;
                mat[row][column - 1] = value / levelCount;
            }
        }
        return mat;
    }
}
