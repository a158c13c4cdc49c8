package org.javai.formula;

/**
 * Thrown when a term cannot be given concrete semantics under a model context:
 * a rule's precondition is violated (e.g. a categorical argument to a numeric
 * transform, a non-literal lag step) or a function has no implementation.
 */
public class SchemaApplicationException extends FormulaException {

    private final Term term;
    private final String context;

    public SchemaApplicationException(String message, Term term, String context) {
        super(message + " [term: " + term + (context != null ? ", context: " + context : "") + "]");
        this.term = term;
        this.context = context;
    }

    public SchemaApplicationException(String message, Term term, String context, Throwable cause) {
        super(message + " [term: " + term + (context != null ? ", context: " + context : "") + "]", cause);
        this.term = term;
        this.context = context;
    }

    public SchemaApplicationException(String message, Term term) {
        this(message, term, null);
    }

    /**
     * The offending term, as it appeared before schema application.
     */
    public Term term() {
        return term;
    }

    /**
     * Name of the model context in effect, or null when not known.
     */
    public String context() {
        return context;
    }
}
