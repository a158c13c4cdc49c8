package org.javai.formula.apply;

import org.javai.formula.FunctionTerm;
import org.javai.formula.InteractionTerm;
import org.javai.formula.SchemaApplicationException;
import org.javai.formula.Term;
import org.javai.formula.TermTuple;

/**
 * Rules for {@code protect(expr)} and {@code unprotect(expr)}.
 *
 * <p>Inside {@code protect}, formula operators keep their arithmetic meaning:
 * {@code protect(a + b)} is one column holding the row sums. {@code unprotect} as
 * the whole argument of {@code protect} restores formula meaning, so
 * {@code protect(unprotect(a + b))} is the two columns {@code a} and {@code b}.
 */
public final class ProtectionRules {

    public static final FunctionRule PROTECT = (call, schema, context, applier) -> {
        if (call.args().size() != 1) {
            throw new SchemaApplicationException("protect takes exactly one argument", call, context.name());
        }
        Term arg = call.args().get(0);
        if (arg instanceof FunctionTerm inner && inner.name().equals("unprotect")) {
            if (inner.args().size() != 1) {
                throw new SchemaApplicationException("unprotect takes exactly one argument", inner, context.name());
            }
            return applier.applyTerm(inner.args().get(0), schema, context);
        }
        if (containsUnprotect(arg)) {
            throw new SchemaApplicationException("unprotect may only be the whole argument of protect",
                    call, context.name());
        }
        return applier.applyDefault(call, schema, context);
    };

    public static final FunctionRule UNPROTECT = (call, schema, context, applier) -> {
        throw new SchemaApplicationException("unprotect is only meaningful as the whole argument of protect",
                call, context.name());
    };

    private ProtectionRules() {
    }

    static SchemaRules register(SchemaRules rules) {
        return rules.withFunction("protect", ModelContext.ANY, PROTECT)
                .withFunction("unprotect", ModelContext.ANY, UNPROTECT);
    }

    private static boolean containsUnprotect(Term term) {
        if (term instanceof FunctionTerm f) {
            return f.name().equals("unprotect") || f.args().stream().anyMatch(ProtectionRules::containsUnprotect);
        }
        if (term instanceof InteractionTerm i) {
            return i.terms().stream().anyMatch(ProtectionRules::containsUnprotect);
        }
        if (term instanceof TermTuple t) {
            return t.terms().stream().anyMatch(ProtectionRules::containsUnprotect);
        }
        return false;
    }
}
