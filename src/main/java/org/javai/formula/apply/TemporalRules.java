package org.javai.formula.apply;

import org.javai.formula.ConstantTerm;
import org.javai.formula.FunctionTerm;
import org.javai.formula.SchemaApplicationException;
import org.javai.formula.ShiftTerm;
import org.javai.formula.Term;
import org.javai.formula.Terms;
import org.javai.formula.schema.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Rules for {@code lag(x, n)} and {@code lead(x, n)}: the argument shifted n rows
 * (default 1) towards the end or the start of the data.
 *
 * <p>The step must be an integer literal. The shifted argument may itself be any
 * term, including another shift.
 */
public final class TemporalRules {

    public static final FunctionRule LAG =
            (call, schema, context, applier) -> shift(call, ShiftTerm.Direction.LAG, schema, context, applier);
    public static final FunctionRule LEAD =
            (call, schema, context, applier) -> shift(call, ShiftTerm.Direction.LEAD, schema, context, applier);

    private TemporalRules() {
    }

    static SchemaRules register(SchemaRules rules) {
        return rules.withFunction("lag", ModelContext.ANY, LAG)
                .withFunction("lead", ModelContext.ANY, LEAD);
    }

    private static Term shift(FunctionTerm call, ShiftTerm.Direction direction, Schema schema,
                              ModelContext context, SchemaApplier applier) {
        if (call.args().isEmpty() || call.args().size() > 2) {
            throw new SchemaApplicationException(call.name() + " takes a term and an optional step, got "
                    + call.args().size() + " arguments", call, context.name());
        }
        int steps = integerArgument(call, 1, 1, context);
        Term resolved = applier.applyTerm(call.args().get(0), schema, context);
        List<Term> shifted = new ArrayList<>();
        for (Term term : Terms.flatten(resolved)) {
            shifted.add(new ShiftTerm(term, steps, direction));
        }
        return Terms.combine(shifted);
    }

    /**
     * An integer literal argument of a call, or a default when the call has fewer
     * arguments.
     *
     * @throws SchemaApplicationException if the argument is not an integer literal
     *         or does not fit in an {@code int}
     */
    public static int integerArgument(FunctionTerm call, int index, int defaultValue, ModelContext context) {
        if (call.args().size() <= index) {
            return defaultValue;
        }
        Term arg = call.args().get(index);
        if (!(arg instanceof ConstantTerm constant) || !constant.isIntegral()) {
            throw new SchemaApplicationException("argument " + (index + 1) + " of " + call.name()
                    + " must be an integer literal, got " + arg, call, context.name());
        }
        double value = constant.value();
        if (value > Integer.MAX_VALUE || value < -Integer.MAX_VALUE) {
            throw new SchemaApplicationException("argument " + (index + 1) + " of " + call.name()
                    + " is out of range: " + arg, call, context.name());
        }
        return (int) value;
    }
}
