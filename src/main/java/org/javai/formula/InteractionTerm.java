package org.javai.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The row-wise product of two or more terms. Its columns are the row-wise
 * Kronecker product of the subterms' columns, the last subterm varying fastest.
 *
 * @param terms the subterms, in order
 */
public record InteractionTerm(List<Term> terms) implements Term {

    public InteractionTerm {
        Objects.requireNonNull(terms, "terms must not be null");
        terms = List.copyOf(terms);
        if (terms.size() < 2) {
            throw new IllegalArgumentException("an interaction needs at least two terms, got " + terms);
        }
    }

    @Override
    public int width() {
        int width = 1;
        for (Term term : terms) {
            width *= term.width();
        }
        return width;
    }

    @Override
    public List<String> coefNames() {
        List<List<String>> names = new ArrayList<>(terms.size());
        for (Term term : terms) {
            names.add(term.coefNames());
        }
        return Terms.kroneckerNames(names);
    }

    @Override
    public String toString() {
        return terms.stream().map(Term::toString).collect(Collectors.joining(" & "));
    }
}
