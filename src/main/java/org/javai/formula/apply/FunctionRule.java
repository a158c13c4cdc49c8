package org.javai.formula.apply;

import org.javai.formula.FunctionTerm;
import org.javai.formula.Term;
import org.javai.formula.schema.Schema;

/**
 * Gives a function call its meaning under a model context.
 *
 * <p>A rule receives the call with its arguments parsed as formula terms and returns
 * the resolved term(s) to use in its place. Rules that need their arguments resolved
 * call back into the {@link SchemaApplier}:
 * <pre>{@code
 * FunctionRule poly = (call, schema, context, applier) -> {
 *     Term x = applier.applyTerm(call.args().get(0), schema, context);
 *     int degree = TemporalRules.integerArgument(call, 1, 1, context);
 *     return new PolyTerm((ContinuousTerm) x, degree);
 * };
 * }</pre>
 */
@FunctionalInterface
public interface FunctionRule {

    /**
     * @throws org.javai.formula.SchemaApplicationException if the call's arguments
     *         do not meet the rule's preconditions
     */
    Term apply(FunctionTerm call, Schema schema, ModelContext context, SchemaApplier applier);
}
