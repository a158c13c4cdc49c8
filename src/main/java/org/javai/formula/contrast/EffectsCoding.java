package org.javai.formula.contrast;

import java.util.Arrays;
import java.util.List;

/**
 * Codes each non-base level as the deviation from the base level: 1 for that
 * level, -1 for the base level, 0 otherwise ("sum" coding).
 *
 * <p>With balanced data the columns are mean-centred and the intercept estimates the
 * grand mean. The first level is the base unless one is given.
 * <pre>
 * levels a b c d, base a:
 *  -1 -1 -1
 *   1  0  0
 *   0  1  0
 *   0  0  1
 * </pre>
 *
 * @param base the base level (may be null: first level)
 * @param levels the level order (may be null: from data)
 */
public record EffectsCoding(Object base, List<Object> levels) implements Contrasts {

    public EffectsCoding {
        levels = levels == null ? null : List.copyOf(levels);
    }

    public EffectsCoding() {
        this(null, null);
    }

    public static EffectsCoding withBase(Object base) {
        return new EffectsCoding(base, null);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        double[][] mat = new DummyCoding().matrix(baseIndex, levelCount);
        Arrays.fill(mat[baseIndex], -1.0);
        return mat;
    }
}
