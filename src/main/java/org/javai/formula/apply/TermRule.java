package org.javai.formula.apply;

import org.javai.formula.Term;
import org.javai.formula.schema.Schema;

/**
 * Replaces the default schema application of a kind of term under a model context.
 */
@FunctionalInterface
public interface TermRule {

    Term apply(Term term, Schema schema, ModelContext context, SchemaApplier applier);
}
