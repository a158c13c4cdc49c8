package org.javai.formula.schema;

import org.javai.formula.CategoricalTerm;
import org.javai.formula.ContinuousTerm;
import org.javai.formula.EmptyColumnException;
import org.javai.formula.SchemaApplicationException;
import org.javai.formula.Term;
import org.javai.formula.Terms;
import org.javai.formula.UnknownVariableException;
import org.javai.formula.VariableTerm;
import org.javai.formula.contrast.ContrastsMatrix;
import org.javai.formula.contrast.DummyCoding;
import org.javai.formula.data.Column;
import org.javai.formula.data.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Computes the {@link Schema} of a term tree from a table.
 *
 * <p>Each referenced variable is resolved from its column in one pass:
 * <ul>
 *   <li>a {@link Hint} for the variable decides its kind and coding</li>
 *   <li>otherwise a column of numbers becomes a {@link ContinuousTerm} summarizing
 *       the non-missing values</li>
 *   <li>any other column becomes a {@link CategoricalTerm} with dummy coding over its
 *       {@linkplain Levels levels}</li>
 * </ul>
 *
 * <pre>{@code
 * Schema schema = SchemaResolver.create()
 *         .withHints(Hints.of("dose", Hint.categorical()))
 *         .resolve(formula, table);
 * }</pre>
 */
public final class SchemaResolver {

    private static final Logger logger = LoggerFactory.getLogger(SchemaResolver.class);

    private final Hints hints;
    private final boolean parallel;

    private SchemaResolver(Hints hints, boolean parallel) {
        this.hints = hints;
        this.parallel = parallel;
    }

    public static SchemaResolver create() {
        return new SchemaResolver(Hints.none(), false);
    }

    public SchemaResolver withHints(Hints hints) {
        return new SchemaResolver(Objects.requireNonNull(hints, "hints must not be null"), parallel);
    }

    /**
     * A resolver that scans the variables' columns concurrently. The resulting
     * schema is the same.
     */
    public SchemaResolver parallel() {
        return new SchemaResolver(hints, true);
    }

    /**
     * Resolves every variable referenced by a term tree.
     *
     * @throws UnknownVariableException if a variable is not a column of the table
     * @throws EmptyColumnException if a continuous variable has no non-missing values
     */
    public Schema resolve(Term term, Table table) {
        return resolve(Terms.termVars(term), table);
    }

    public Schema resolve(Collection<String> names, Table table) {
        requireColumns(names, table);
        List<String> ordered = List.copyOf(names);
        Stream<String> stream = parallel ? ordered.parallelStream() : ordered.stream();
        List<Term> terms = stream.map(name -> resolveColumn(table.column(name))).toList();

        Map<String, Term> resolved = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            resolved.put(ordered.get(i), terms.get(i));
        }
        Schema schema = Schema.of(resolved);
        logger.debug("Resolved schema {}", schema);
        return schema;
    }

    /**
     * Checks that a table has a column for every name.
     *
     * @throws UnknownVariableException naming the first missing variable and the
     *         nearest column names
     */
    public static void requireColumns(Collection<String> names, Table table) {
        Objects.requireNonNull(table, "table must not be null");
        for (String name : names) {
            if (!table.hasColumn(name)) {
                throw new UnknownVariableException(name, NameSuggestions.nearest(name, table.columnNames()));
            }
        }
    }

    private Term resolveColumn(Column column) {
        Hint hint = hints.get(column.name()).orElse(null);
        if (hint instanceof Hint.Fixed fixed) {
            return reuse(column, fixed.term());
        }
        if (hint instanceof Hint.Continuous) {
            return continuous(column);
        }
        if (hint instanceof Hint.Categorical categorical) {
            return categorical(column, categorical);
        }
        return isNumeric(column) ? continuous(column) : categorical(column, new Hint.Categorical(new DummyCoding()));
    }

    static boolean isNumeric(Column column) {
        if (Number.class.isAssignableFrom(column.elementType())) {
            return true;
        }
        if (column.elementType() != Object.class) {
            return false;
        }
        return column.values().stream().allMatch(value -> value == null || value instanceof Number);
    }

    private static ContinuousTerm continuous(Column column) {
        long count = 0;
        double mean = 0;
        double m2 = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int row = 0; row < column.size(); row++) {
            Object value = column.get(row);
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number number)) {
                throw new SchemaApplicationException("column " + column.name() + " is not numeric: found " + value,
                        new VariableTerm(column.name()));
            }
            double x = number.doubleValue();
            if (Double.isNaN(x)) {
                continue;
            }
            count++;
            double delta = x - mean;
            mean += delta / count;
            m2 += delta * (x - mean);
            min = Math.min(min, x);
            max = Math.max(max, x);
        }
        if (count == 0) {
            throw new EmptyColumnException(column.name());
        }
        double variance = count > 1 ? Math.max(0, m2 / (count - 1)) : 0;
        // rounding can push the running mean just outside [min, max]
        mean = Math.min(max, Math.max(min, mean));
        return new ContinuousTerm(column.name(), mean, variance, min, max);
    }

    private static CategoricalTerm categorical(Column column, Hint.Categorical hint) {
        List<Object> levels = Levels.of(column.values());
        try {
            return new CategoricalTerm(column.name(), ContrastsMatrix.of(hint.contrasts(), levels));
        } catch (IllegalArgumentException e) {
            throw new SchemaApplicationException("cannot code " + column.name() + ": " + e.getMessage(),
                    new VariableTerm(column.name()), null, e);
        }
    }

    private static Term reuse(Column column, Term term) {
        if (term instanceof CategoricalTerm categorical) {
            try {
                categorical.contrasts().requireLevels(Levels.of(column.values()));
            } catch (IllegalArgumentException e) {
                throw new SchemaApplicationException("cannot code " + column.name() + ": " + e.getMessage(),
                        new VariableTerm(column.name()), null, e);
            }
        }
        return term;
    }

    @Override
    public String toString() {
        return "SchemaResolver[hints=" + hints + ", parallel=" + parallel + "]";
    }
}
