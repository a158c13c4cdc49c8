package org.javai.formula.apply;

import org.javai.formula.Term;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of context-specific behaviour for schema application.
 *
 * <p>Function rules are keyed by function name and context; term rules by term class
 * and context. A lookup walks the context's {@linkplain ModelContext#lineage()
 * lineage} from the context itself towards {@link ModelContext#ANY} and returns the
 * first rule registered for it, so the most specific registration wins. With no
 * match, the applier's default behaviour applies.
 *
 * <p>Registries are immutable:
 * <pre>{@code
 * SchemaRules rules = SchemaRules.standard()
 *         .withFunction("poly", POLYNOMIAL_MODEL, polyRule);
 * }</pre>
 */
public final class SchemaRules {

    private static final SchemaRules EMPTY = new SchemaRules(Map.of(), Map.of());
    private static final SchemaRules STANDARD = ProtectionRules.register(TemporalRules.register(EMPTY));

    private final Map<String, FunctionRule> functionRules;
    private final Map<String, Map<Class<? extends Term>, TermRule>> termRules;

    private SchemaRules(Map<String, FunctionRule> functionRules,
                        Map<String, Map<Class<? extends Term>, TermRule>> termRules) {
        this.functionRules = functionRules;
        this.termRules = termRules;
    }

    public static SchemaRules empty() {
        return EMPTY;
    }

    /**
     * The built-in rules: {@code lag}, {@code lead}, {@code protect} and
     * {@code unprotect}, registered for {@link ModelContext#ANY}.
     */
    public static SchemaRules standard() {
        return STANDARD;
    }

    public SchemaRules withFunction(String name, ModelContext context, FunctionRule rule) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Map<String, FunctionRule> extended = new LinkedHashMap<>(functionRules);
        extended.put(functionKey(name, context), rule);
        return new SchemaRules(Collections.unmodifiableMap(extended), termRules);
    }

    public SchemaRules withTerm(Class<? extends Term> type, ModelContext context, TermRule rule) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Map<String, Map<Class<? extends Term>, TermRule>> extended = new LinkedHashMap<>(termRules);
        Map<Class<? extends Term>, TermRule> forContext =
                new LinkedHashMap<>(extended.getOrDefault(context.path(), Map.of()));
        forContext.put(type, rule);
        extended.put(context.path(), Collections.unmodifiableMap(forContext));
        return new SchemaRules(functionRules, Collections.unmodifiableMap(extended));
    }

    /**
     * The most specific rule for a function under a context.
     */
    public Optional<FunctionRule> function(String name, ModelContext context) {
        for (ModelContext candidate : context.lineage()) {
            FunctionRule rule = functionRules.get(functionKey(name, candidate));
            if (rule != null) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * The most specific rule for a term under a context. Within one context, a rule
     * registered for the term's exact class is preferred over one registered for a
     * supertype.
     */
    public Optional<TermRule> term(Term term, ModelContext context) {
        for (ModelContext candidate : context.lineage()) {
            Map<Class<? extends Term>, TermRule> forContext = termRules.get(candidate.path());
            if (forContext == null) {
                continue;
            }
            TermRule exact = forContext.get(term.getClass());
            if (exact != null) {
                return Optional.of(exact);
            }
            for (Map.Entry<Class<? extends Term>, TermRule> entry : forContext.entrySet()) {
                if (entry.getKey().isInstance(term)) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    private static String functionKey(String name, ModelContext context) {
        return context.path() + "#" + name;
    }

    @Override
    public String toString() {
        return "SchemaRules" + functionRules.keySet();
    }
}
