package org.javai.formula.schema;

import org.javai.formula.CategoricalTerm;
import org.javai.formula.ContinuousTerm;
import org.javai.formula.Term;
import org.javai.formula.VariableTerm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The resolved term of every variable a formula references: a
 * {@link ContinuousTerm} or a {@link CategoricalTerm} per name.
 *
 * <p>Schemas are immutable. Computing one scans each referenced column once; the
 * result can be reused to resolve the same formula against new data, so that new
 * data is coded exactly like the data the schema was computed from.
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(Map.of());

    private final Map<String, Term> terms;

    private Schema(Map<String, Term> terms) {
        this.terms = terms;
    }

    public static Schema empty() {
        return EMPTY;
    }

    public static Schema of(Map<String, ? extends Term> terms) {
        Objects.requireNonNull(terms, "terms must not be null");
        Map<String, Term> copy = new LinkedHashMap<>();
        terms.forEach((name, term) -> copy.put(name, checked(name, term)));
        return new Schema(Collections.unmodifiableMap(copy));
    }

    public static Schema of(Term... terms) {
        Map<String, Term> map = new LinkedHashMap<>();
        for (Term term : terms) {
            map.put(nameOf(term), term);
        }
        return of(map);
    }

    public Optional<Term> get(String name) {
        return Optional.ofNullable(terms.get(name));
    }

    public Optional<Term> get(VariableTerm variable) {
        return get(variable.name());
    }

    public boolean contains(String name) {
        return terms.containsKey(name);
    }

    public Set<String> names() {
        return terms.keySet();
    }

    public int size() {
        return terms.size();
    }

    public Map<String, Term> asMap() {
        return terms;
    }

    /**
     * This schema with the entries of another added, the other's winning on
     * conflicts.
     */
    public Schema merge(Schema other) {
        Map<String, Term> merged = new LinkedHashMap<>(terms);
        merged.putAll(other.terms);
        return new Schema(Collections.unmodifiableMap(merged));
    }

    private static Term checked(String name, Term term) {
        Objects.requireNonNull(term, "term for " + name + " must not be null");
        if (!nameOf(term).equals(name)) {
            throw new IllegalArgumentException("schema entry " + name + " holds a term for " + nameOf(term));
        }
        return term;
    }

    private static String nameOf(Term term) {
        if (term instanceof ContinuousTerm c) {
            return c.name();
        }
        if (term instanceof CategoricalTerm c) {
            return c.name();
        }
        throw new IllegalArgumentException("schema terms must be continuous or categorical, got " + term);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Schema other && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return "Schema" + terms.values();
    }
}
