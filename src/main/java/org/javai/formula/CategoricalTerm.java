package org.javai.formula;

import org.javai.formula.contrast.ContrastsMatrix;

import java.util.List;
import java.util.Objects;

/**
 * A resolved discrete variable coded by a contrasts matrix.
 *
 * @param name the column name
 * @param contrasts the contrasts matrix, one row per observed level
 */
public record CategoricalTerm(String name, ContrastsMatrix contrasts) implements Term {

    public CategoricalTerm {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(contrasts, "contrasts must not be null");
    }

    /**
     * This variable with full-rank (one column per level) coding.
     */
    public CategoricalTerm promoted() {
        ContrastsMatrix full = contrasts.fullRank();
        return full == contrasts ? this : new CategoricalTerm(name, full);
    }

    @Override
    public int width() {
        return contrasts.columns();
    }

    @Override
    public List<String> coefNames() {
        return contrasts.termNames().stream().map(level -> name + ": " + level).toList();
    }

    @Override
    public String toString() {
        return name + "(" + contrasts.contrasts().name() + ":" + contrasts.rows() + "→" + contrasts.columns() + ")";
    }
}
