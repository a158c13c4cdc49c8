package org.javai.formula.contrast;

import java.util.List;

/**
 * Codes each non-base level as a 0-1 indicator column ("treatment" coding).
 *
 * <p>The default coding for categorical variables. Columns are orthogonal to each
 * other but collinear with an intercept column; with an intercept, the intercept
 * estimates the mean response at the base level.
 * <pre>
 * levels a b c d, base a:
 *  0 0 0
 *  1 0 0
 *  0 1 0
 *  0 0 1
 * </pre>
 *
 * @param base the base level (may be null: first level)
 * @param levels the level order (may be null: from data)
 */
public record DummyCoding(Object base, List<Object> levels) implements Contrasts {

    public DummyCoding {
        levels = levels == null ? null : List.copyOf(levels);
    }

    public DummyCoding() {
        this(null, null);
    }

    public static DummyCoding withBase(Object base) {
        return new DummyCoding(base, null);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        double[][] mat = new double[levelCount][levelCount - 1];
        int column = 0;
        for (int level = 0; level < levelCount; level++) {
            if (level != baseIndex) {
                mat[level][column++] = 1.0;
            }
        }
        return mat;
    }
}
