package org.javai.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A group of terms materialized together into one dense block, by concatenating
 * their columns in term order.
 *
 * @param terms the grouped terms
 */
public record MatrixTerm(List<Term> terms) implements Term {

    public MatrixTerm {
        Objects.requireNonNull(terms, "terms must not be null");
        terms = List.copyOf(terms);
    }

    public static MatrixTerm of(Term... terms) {
        return new MatrixTerm(List.of(terms));
    }

    @Override
    public int width() {
        return terms.stream().mapToInt(Term::width).sum();
    }

    @Override
    public List<String> coefNames() {
        List<String> names = new ArrayList<>();
        terms.forEach(term -> names.addAll(term.coefNames()));
        return names;
    }

    @Override
    public String toString() {
        return terms.stream().map(Term::toString).collect(Collectors.joining(" + "));
    }
}
