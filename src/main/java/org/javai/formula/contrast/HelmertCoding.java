package org.javai.formula.contrast;

import java.util.List;

/**
 * Codes each level as the difference from the average of the levels before it.
 *
 * <p>Column j has -1 for the first j levels, j for level j+1 and 0 above. With
 * balanced data the columns are mean-centred and orthogonal. The base level takes
 * the all -1 row; the remaining levels keep their order.
 * <pre>
 * levels a b c d, base a:
 *  -1 -1 -1
 *   1 -1 -1
 *   0  2 -1
 *   0  0  3
 * </pre>
 *
 * @param base the base level (may be null: first level)
 * @param levels the level order (may be null: from data)
 */
public record HelmertCoding(Object base, List<Object> levels) implements Contrasts {

    public HelmertCoding {
        levels = levels == null ? null : List.copyOf(levels);
    }

    public HelmertCoding() {
        this(null, null);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        double[][] helmert = new double[levelCount][levelCount - 1];
        for (int column = 0; column < levelCount - 1; column++) {
            for (int row = 0; row <= column; row++) {
                helmert[row][column] = -1.0;
            }
            helmert[column + 1][column] = column + 1;
        }
        // move the all -1 row to the base position
        double[][] mat = new double[levelCount][];
        mat[baseIndex] = helmert[0];
        int next = 1;
        for (int row = 0; row < levelCount; row++) {
            if (row != baseIndex) {
                mat[row] = helmert[next++];
            }
        }
        return mat;
    }
}
