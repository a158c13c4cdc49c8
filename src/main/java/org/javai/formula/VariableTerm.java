package org.javai.formula;

import java.util.List;
import java.util.Objects;

/**
 * A placeholder for a data column whose kind (continuous or categorical) is not
 * known yet. Replaced by a concrete term when a schema is applied.
 *
 * @param name the column name
 */
public record VariableTerm(String name) implements Term {

    public VariableTerm {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    @Override
    public int width() {
        throw new IllegalStateException("Un-typed term " + name
                + " has undefined width. Did you forget to apply a schema?");
    }

    @Override
    public List<String> coefNames() {
        throw new IllegalStateException("Un-typed term " + name
                + " has no coefficient names. Did you forget to apply a schema?");
    }

    @Override
    public String toString() {
        return name;
    }
}
