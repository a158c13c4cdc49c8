package org.javai.formula;

import java.util.List;
import java.util.Objects;

/**
 * A resolved numeric variable, with summary statistics of its non-missing values.
 *
 * @param name the column name
 * @param mean the mean
 * @param variance the sample variance (0 for fewer than two values)
 * @param min the smallest value
 * @param max the largest value
 */
public record ContinuousTerm(String name, double mean, double variance, double min, double max) implements Term {

    public ContinuousTerm {
        Objects.requireNonNull(name, "name must not be null");
        if (!(min <= max)) {
            throw new IllegalArgumentException("min must not exceed max for " + name + ": " + min + " > " + max);
        }
        if (!(min <= mean && mean <= max)) {
            throw new IllegalArgumentException("mean of " + name + " must lie in [" + min + ", " + max + "]: " + mean);
        }
        if (!(variance >= 0)) {
            throw new IllegalArgumentException("variance of " + name + " must be non-negative: " + variance);
        }
    }

    @Override
    public int width() {
        return 1;
    }

    @Override
    public List<String> coefNames() {
        return List.of(name);
    }

    @Override
    public String toString() {
        return name + "(continuous)";
    }
}
