package org.javai.formula.apply;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies the kind of model a formula is resolved for, so rules can give syntax
 * a context-specific meaning.
 *
 * <p>Contexts form a hierarchy rooted at {@link #ANY}; a rule registered for a
 * context also applies to its descendants unless one of them has its own.
 * <pre>{@code
 * ModelContext mixed = ModelContext.REGRESSION_MODEL.extending("MixedModel");
 * ModelContext plain = ModelContext.named("Plain").withImplicitIntercept(true);
 * }</pre>
 *
 * @param name a name, unique within its parent
 * @param parent the more general context, null only for {@link #ANY}
 * @param implicitIntercept whether an intercept is added when a formula neither
 *        requests nor suppresses one
 * @param dropIntercept whether an intercept is never generated, explicit requests
 *        included
 */
public record ModelContext(String name, ModelContext parent, boolean implicitIntercept, boolean dropIntercept) {

    public static final ModelContext ANY = new ModelContext("Any", null, false, false);
    public static final ModelContext STATISTICAL_MODEL = new ModelContext("StatisticalModel", ANY, true, false);
    public static final ModelContext REGRESSION_MODEL = STATISTICAL_MODEL.extending("RegressionModel");

    public ModelContext {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (parent == null && !name.equals("Any")) {
            throw new IllegalArgumentException("context " + name + " needs a parent; use ModelContext.named");
        }
        if (implicitIntercept && dropIntercept) {
            throw new IllegalArgumentException("context " + name + " cannot both add and drop the intercept");
        }
    }

    /**
     * A new context directly under {@link #ANY}, without intercept traits.
     */
    public static ModelContext named(String name) {
        return ANY.extending(name);
    }

    /**
     * A child of this context inheriting its intercept traits.
     */
    public ModelContext extending(String childName) {
        return new ModelContext(childName, this, implicitIntercept, dropIntercept);
    }

    public ModelContext withImplicitIntercept(boolean implicit) {
        return new ModelContext(name, parent, implicit, implicit ? false : dropIntercept);
    }

    public ModelContext withDropIntercept(boolean drop) {
        return new ModelContext(name, parent, drop ? false : implicitIntercept, drop);
    }

    /**
     * This context followed by its ancestors, ending with {@link #ANY}.
     */
    public List<ModelContext> lineage() {
        List<ModelContext> lineage = new ArrayList<>();
        for (ModelContext context = this; context != null; context = context.parent) {
            lineage.add(context);
        }
        return Collections.unmodifiableList(lineage);
    }

    /**
     * Whether this context is {@code other} or one of its descendants.
     */
    public boolean isA(ModelContext other) {
        return lineage().stream().anyMatch(c -> c.path().equals(other.path()));
    }

    /**
     * The names from {@link #ANY} down to this context, joined with {@code /}.
     */
    public String path() {
        return parent == null ? name : parent.path() + "/" + name;
    }

    @Override
    public String toString() {
        return name;
    }
}
