package org.javai.formula.contrast;

import java.util.List;

/**
 * One 0-1 indicator column per level, base level included ("one-hot").
 *
 * <p>Used when a categorical variable must be promoted to full rank because the
 * lower-order term it would otherwise be contrasted against is absent from the
 * formula. There is no base level.
 */
public record FullDummyCoding(List<Object> levels) implements Contrasts {

    public FullDummyCoding {
        levels = levels == null ? null : List.copyOf(levels);
    }

    public FullDummyCoding() {
        this(null);
    }

    @Override
    public double[][] matrix(int baseIndex, int levelCount) {
        return Matrices.identity(levelCount);
    }

    @Override
    public List<String> termNames(List<?> levels, int baseIndex) {
        return levels.stream().map(String::valueOf).toList();
    }

    @Override
    public boolean isFullRank() {
        return true;
    }
}
