package org.javai.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered combination ({@code +}) of two or more terms.
 *
 * <p>Built by {@link Terms#combine}, which flattens nested combinations and returns a
 * lone term unwrapped, so every sum has exactly one representation.
 *
 * @param terms the combined terms, in order
 */
public record TermTuple(List<Term> terms) implements Term {

    public TermTuple {
        Objects.requireNonNull(terms, "terms must not be null");
        terms = List.copyOf(terms);
        if (terms.size() < 2) {
            throw new IllegalArgumentException("a term tuple needs at least two terms, got " + terms);
        }
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
