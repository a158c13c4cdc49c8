package org.javai.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builders and queries for term trees.
 *
 * <p>The builders produce the same normal form as the formula parser, so a formula
 * constructed programmatically equals the parsed one:
 * <pre>{@code
 * Term a = Terms.term("a"), b = Terms.term("b");
 * FormulaTerm f = Terms.formula(Terms.term("y"), Terms.combine(Terms.constant(1), Terms.cross(a, b)));
 * // equals FormulaParser.parse("y ~ 1 + a*b")
 * }</pre>
 */
public final class Terms {

    /**
     * Symbol representing the intercept in redundancy bookkeeping.
     */
    public static final String INTERCEPT_SYMBOL = InterceptTerm.NAME;

    private Terms() {
    }

    public static VariableTerm term(String name) {
        return new VariableTerm(name);
    }

    public static ConstantTerm constant(double value) {
        return new ConstantTerm(value);
    }

    public static FormulaTerm formula(Term lhs, Term rhs) {
        return new FormulaTerm(lhs, rhs);
    }

    /**
     * Combines terms with {@code +}. Nested combinations are flattened in order and no
     * duplicates are removed; a single term is returned as is.
     *
     * @throws IllegalArgumentException if there are no terms
     */
    public static Term combine(Term... terms) {
        return combine(Arrays.asList(terms));
    }

    public static Term combine(List<? extends Term> terms) {
        List<Term> flat = new ArrayList<>();
        for (Term term : terms) {
            if (term instanceof TermTuple tuple) {
                flat.addAll(tuple.terms());
            } else {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("cannot combine zero terms");
        }
        return flat.size() == 1 ? flat.get(0) : new TermTuple(flat);
    }

    /**
     * Interacts terms with {@code &}. Nested interactions are flattened and the
     * interaction distributes over combinations, so
     * {@code interact(a + b, c)} is {@code a&c + b&c}.
     */
    public static Term interact(Term... terms) {
        return interact(Arrays.asList(terms));
    }

    public static Term interact(List<? extends Term> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("cannot interact zero terms");
        }
        List<List<Term>> products = List.of(List.of());
        for (Term term : terms) {
            List<Term> alternatives = term instanceof TermTuple tuple ? tuple.terms() : List.of(term);
            List<List<Term>> next = new ArrayList<>();
            for (List<Term> product : products) {
                for (Term alternative : alternatives) {
                    List<Term> extended = new ArrayList<>(product);
                    if (alternative instanceof InteractionTerm interaction) {
                        extended.addAll(interaction.terms());
                    } else {
                        extended.add(alternative);
                    }
                    next.add(extended);
                }
            }
            products = next;
        }
        List<Term> result = new ArrayList<>(products.size());
        for (List<Term> product : products) {
            result.add(product.size() == 1 ? product.get(0) : new InteractionTerm(product));
        }
        return combine(result);
    }

    /**
     * Full crossing ({@code *}): all main effects and interactions of the operands.
     * {@code cross(a, b, c)} is {@code a + b + a&b + c + a&c + b&c + a&b&c}.
     */
    public static Term cross(Term... terms) {
        if (terms.length == 0) {
            throw new IllegalArgumentException("cannot cross zero terms");
        }
        Term result = terms[0];
        for (int i = 1; i < terms.length; i++) {
            result = combine(result, terms[i], interact(result, terms[i]));
        }
        return result;
    }

    /**
     * Appends an explicit intercept removal ({@code -1}) to a predictor side.
     */
    public static Term dropIntercept(Term rhs) {
        return combine(rhs, ConstantTerm.MINUS_ONE);
    }

    /**
     * The top-level terms of a formula side: the members of a tuple or matrix
     * term, otherwise the term itself.
     */
    public static List<Term> flatten(Term term) {
        if (term instanceof TermTuple tuple) {
            List<Term> flat = new ArrayList<>();
            tuple.terms().forEach(t -> flat.addAll(flatten(t)));
            return flat;
        }
        if (term instanceof MatrixTerm matrix) {
            return matrix.terms();
        }
        return List.of(term);
    }

    /**
     * Names of all data columns referenced by a term tree, in first-appearance
     * order. Includes variables inside function calls.
     */
    public static Set<String> termVars(Term term) {
        Set<String> vars = new LinkedHashSet<>();
        collectVars(term, vars);
        return Collections.unmodifiableSet(vars);
    }

    private static void collectVars(Term term, Set<String> vars) {
        if (term instanceof VariableTerm v) {
            vars.add(v.name());
        } else if (term instanceof ContinuousTerm c) {
            vars.add(c.name());
        } else if (term instanceof CategoricalTerm c) {
            vars.add(c.name());
        } else if (term instanceof FunctionTerm f) {
            vars.addAll(f.argNames());
        } else if (term instanceof ShiftTerm s) {
            collectVars(s.term(), vars);
        } else if (term instanceof InteractionTerm i) {
            i.terms().forEach(t -> collectVars(t, vars));
        } else if (term instanceof TermTuple t) {
            t.terms().forEach(x -> collectVars(x, vars));
        } else if (term instanceof MatrixTerm m) {
            m.terms().forEach(x -> collectVars(x, vars));
        } else if (term instanceof FormulaTerm f) {
            collectVars(f.lhs(), vars);
            collectVars(f.rhs(), vars);
        } else if (term instanceof CustomTerm c) {
            vars.addAll(c.variables());
        }
    }

    /**
     * Whether a formula side explicitly requests an intercept.
     */
    public static boolean hasIntercept(Term term) {
        Term side = term instanceof FormulaTerm f ? f.rhs() : term;
        for (Term t : flatten(side)) {
            if (t instanceof ConstantTerm c && c.value() == 1 || t instanceof InterceptTerm i && i.present()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a formula side explicitly suppresses the intercept.
     */
    public static boolean omitsIntercept(Term term) {
        Term side = term instanceof FormulaTerm f ? f.rhs() : term;
        for (Term t : flatten(side)) {
            if (t instanceof ConstantTerm c && (c.value() == 0 || c.value() == -1)
                    || t instanceof InterceptTerm i && !i.present()) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasResponse(Term term) {
        return term instanceof FormulaTerm;
    }

    /**
     * Whether a schema has been applied: no placeholders or literal markers remain
     * and, for a formula, the predictors are grouped into a matrix term.
     */
    public static boolean hasSchema(Term term) {
        if (term instanceof FormulaTerm f) {
            boolean grouped = f.rhs() instanceof MatrixTerm
                    || f.rhs() instanceof TermTuple tuple && tuple.terms().get(0) instanceof MatrixTerm;
            return grouped && hasSchema(f.lhs()) && hasSchema(f.rhs());
        }
        if (term instanceof VariableTerm || term instanceof ConstantTerm) {
            return false;
        }
        if (term instanceof InteractionTerm i) {
            return i.terms().stream().allMatch(Terms::hasSchema);
        }
        if (term instanceof TermTuple t) {
            return t.terms().stream().allMatch(Terms::hasSchema);
        }
        if (term instanceof MatrixTerm m) {
            return m.terms().stream().allMatch(Terms::hasSchema);
        }
        if (term instanceof ShiftTerm s) {
            return hasSchema(s.term());
        }
        if (term instanceof CustomTerm c) {
            return c.hasSchema();
        }
        return true;
    }

    /**
     * The symbols identifying a term for redundancy bookkeeping: variable names,
     * the intercept symbol for a present intercept, a function's expression. Terms
     * with equal symbol sets are treated as the same term whether or not they are
     * resolved.
     */
    public static Set<String> symbols(Term term) {
        if (term instanceof VariableTerm v) {
            return Set.of(v.name());
        }
        if (term instanceof ContinuousTerm c) {
            return Set.of(c.name());
        }
        if (term instanceof CategoricalTerm c) {
            return Set.of(c.name());
        }
        if (term instanceof InterceptTerm i) {
            return i.present() ? Set.of(INTERCEPT_SYMBOL) : Set.of();
        }
        if (term instanceof ConstantTerm c) {
            return c.value() == 1 ? Set.of(INTERCEPT_SYMBOL) : Set.of();
        }
        if (term instanceof FunctionTerm f) {
            return Set.of(f.expression());
        }
        if (term instanceof ShiftTerm s) {
            return Set.of(s.direction().label() + "(" + String.join(", ", new TreeSet<>(symbols(s.term())))
                    + ", " + s.steps() + ")");
        }
        if (term instanceof InteractionTerm i) {
            Set<String> syms = new LinkedHashSet<>();
            i.terms().forEach(t -> syms.addAll(symbols(t)));
            return syms;
        }
        if (term instanceof CustomTerm c) {
            return c.symbols();
        }
        return Set.of();
    }

    /**
     * Names of the row-wise Kronecker product of several named column sets, the
     * last set varying fastest, joined with {@code " & "}.
     */
    public static List<String> kroneckerNames(List<List<String>> names) {
        List<String> result = List.of("");
        boolean first = true;
        for (List<String> factor : names) {
            List<String> next = new ArrayList<>(result.size() * factor.size());
            for (String prefix : result) {
                for (String name : factor) {
                    next.add(first ? name : prefix + " & " + name);
                }
            }
            result = next;
            first = false;
        }
        return result;
    }
}
