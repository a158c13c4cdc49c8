package org.javai.formula.apply;

import org.javai.formula.CategoricalTerm;
import org.javai.formula.ConstantTerm;
import org.javai.formula.ContinuousTerm;
import org.javai.formula.FormulaTerm;
import org.javai.formula.FunctionTerm;
import org.javai.formula.InteractionTerm;
import org.javai.formula.InterceptTerm;
import org.javai.formula.MatrixTerm;
import org.javai.formula.SchemaApplicationException;
import org.javai.formula.Term;
import org.javai.formula.TermTuple;
import org.javai.formula.Terms;
import org.javai.formula.VariableTerm;
import org.javai.formula.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a parsed formula into a resolved one: every placeholder replaced by its
 * schema term, intercept markers made concrete, function calls given meaning by
 * the {@link SchemaRules} for the model context, categorical variables coded with
 * reduced or full rank as redundancy requires, and the predictors grouped into a
 * {@link MatrixTerm}.
 *
 * <p>The resolved right-hand side is a {@code MatrixTerm}, or a {@link TermTuple}
 * of the {@code MatrixTerm} followed by any terms that do not contribute matrix
 * columns. Applying a schema to a resolved formula returns it unchanged.
 */
public final class SchemaApplier {

    private static final Logger logger = LoggerFactory.getLogger(SchemaApplier.class);

    private static final SchemaApplier STANDARD = new SchemaApplier(SchemaRules.standard());

    private final SchemaRules rules;

    public SchemaApplier(SchemaRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    public static SchemaApplier standard() {
        return STANDARD;
    }

    public SchemaRules rules() {
        return rules;
    }

    /**
     * Resolves a formula for a model context.
     *
     * @throws SchemaApplicationException if a term cannot be resolved under the context
     */
    public FormulaTerm apply(FormulaTerm formula, Schema schema, ModelContext context) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (Terms.hasSchema(formula)) {
            return formula;
        }
        Term lhs = applyResponse(formula.lhs(), schema, context);
        Term rhs = applyPredictors(formula.rhs(), schema, context);
        FormulaTerm resolved = new FormulaTerm(lhs, rhs);
        logger.debug("Applied schema under {}: {} => {}", context, formula, resolved);
        return resolved;
    }

    /**
     * Resolves a term without redundancy bookkeeping. Rules use this to resolve
     * their arguments.
     */
    public Term applyTerm(Term term, Schema schema, ModelContext context) {
        TermRule termRule = rules.term(term, context).orElse(null);
        if (termRule != null) {
            return termRule.apply(term, schema, context, this);
        }
        if (term instanceof VariableTerm variable) {
            return schema.get(variable).orElseThrow(() -> new SchemaApplicationException(
                    "no schema entry for variable " + variable.name(), variable, context.name()));
        }
        if (term instanceof ConstantTerm constant) {
            if (!constant.isInterceptMarker()) {
                throw new SchemaApplicationException("a number other than 0, 1 or -1 cannot be a model term",
                        constant, context.name());
            }
            return constant.value() == 1 ? InterceptTerm.PRESENT : InterceptTerm.ABSENT;
        }
        if (term instanceof FunctionTerm call) {
            FunctionRule functionRule = rules.function(call.name(), context).orElse(null);
            return functionRule != null
                    ? functionRule.apply(call, schema, context, this)
                    : applyDefault(call, schema, context);
        }
        if (term instanceof InteractionTerm interaction) {
            List<Term> resolved = new ArrayList<>(interaction.terms().size());
            for (Term t : interaction.terms()) {
                resolved.add(applyTerm(t, schema, context));
            }
            return Terms.interact(resolved);
        }
        if (term instanceof TermTuple tuple) {
            List<Term> resolved = new ArrayList<>(tuple.terms().size());
            for (Term t : tuple.terms()) {
                resolved.add(applyTerm(t, schema, context));
            }
            return Terms.combine(resolved);
        }
        if (term instanceof FormulaTerm formula) {
            return apply(formula, schema, context);
        }
        return term;
    }

    /**
     * The default meaning of a function call: a numeric transform of continuous
     * variables.
     *
     * @throws SchemaApplicationException if a referenced variable is not continuous
     *         or the function has no numeric implementation
     */
    public FunctionTerm applyDefault(FunctionTerm call, Schema schema, ModelContext context) {
        for (String name : call.argNames()) {
            Term resolved = schema.get(name).orElseThrow(() -> new SchemaApplicationException(
                    "no schema entry for variable " + name, call, context.name()));
            if (!(resolved instanceof ContinuousTerm)) {
                throw new SchemaApplicationException("function " + call.name() + " needs continuous arguments, but "
                        + resolved + " is not", call, context.name());
            }
        }
        if (!call.function().isEvaluable()) {
            throw new SchemaApplicationException("function " + call.name() + " has no numeric implementation"
                    + " and no rule under this context", call, context.name());
        }
        return call;
    }

    private Term applyResponse(Term lhs, Schema schema, ModelContext context) {
        List<Term> resolved = new ArrayList<>();
        for (Term term : Terms.flatten(lhs)) {
            resolved.addAll(Terms.flatten(applyTerm(term, schema, context)));
        }
        return resolved.size() == 1 ? resolved.get(0) : new MatrixTerm(resolved);
    }

    private Term applyPredictors(Term rhs, Schema schema, ModelContext context) {
        List<Term> terms = new ArrayList<>(Terms.flatten(rhs));
        RedundancyTracker tracker = new RedundancyTracker();

        if (context.dropIntercept()) {
            if (Terms.hasIntercept(rhs)) {
                logger.warn("Model context {} has no intercept; dropping the intercept requested in {}", context, rhs);
            }
            terms.removeIf(SchemaApplier::isInterceptMarker);
            terms.add(0, InterceptTerm.ABSENT);
            tracker.markSeen(InterceptTerm.PRESENT);
        } else if (context.implicitIntercept() && terms.stream().noneMatch(SchemaApplier::isInterceptMarker)) {
            terms.add(0, InterceptTerm.PRESENT);
        }

        List<Term> matrixTerms = new ArrayList<>();
        List<Term> otherTerms = new ArrayList<>();
        for (Term term : terms) {
            for (Term resolved : applyFullRank(term, schema, context, tracker)) {
                (resolved.isMatrixTerm() ? matrixTerms : otherTerms).add(resolved);
            }
        }
        MatrixTerm matrix = new MatrixTerm(matrixTerms);
        if (otherTerms.isEmpty()) {
            return matrix;
        }
        List<Term> all = new ArrayList<>();
        all.add(matrix);
        all.addAll(otherTerms);
        return new TermTuple(all);
    }

    private List<Term> applyFullRank(Term term, Schema schema, ModelContext context, RedundancyTracker tracker) {
        if (isInterceptMarker(term)) {
            Term intercept = applyTerm(term, schema, context);
            tracker.markSeen(intercept);
            return List.of(intercept);
        }
        tracker.markSeen(term);
        List<Term> repaired = new ArrayList<>();
        for (Term resolved : Terms.flatten(applyTerm(term, schema, context))) {
            if (!Terms.symbols(resolved).equals(Terms.symbols(term))) {
                tracker.markSeen(resolved);
            }
            repaired.add(repair(resolved, tracker));
        }
        return repaired;
    }

    private static Term repair(Term term, RedundancyTracker tracker) {
        if (term instanceof CategoricalTerm categorical) {
            return tracker.resolve(categorical, categorical);
        }
        if (term instanceof InteractionTerm interaction) {
            List<Term> repaired = new ArrayList<>(interaction.terms().size());
            for (Term t : interaction.terms()) {
                repaired.add(t instanceof CategoricalTerm categorical ? tracker.resolve(categorical, interaction) : t);
            }
            return new InteractionTerm(repaired);
        }
        return term;
    }

    private static boolean isInterceptMarker(Term term) {
        return term instanceof ConstantTerm constant && constant.isInterceptMarker() || term instanceof InterceptTerm;
    }
}
