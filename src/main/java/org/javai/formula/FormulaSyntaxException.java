package org.javai.formula;

/**
 * Thrown when formula text (or a programmatically built formula) is malformed:
 * a missing or repeated {@code ~}, an unbalanced parenthesis, an unexpected token,
 * or a number other than 0, 1 or -1 where an intercept marker is required.
 */
public class FormulaSyntaxException extends FormulaException {

    private final String source;
    private final int position;

    public FormulaSyntaxException(String message, String source, int position) {
        super(describe(message, source, position));
        this.source = source;
        this.position = position;
    }

    public FormulaSyntaxException(String message) {
        this(message, null, -1);
    }

    /**
     * The formula text being parsed, or null for programmatically built formulas.
     */
    public String source() {
        return source;
    }

    /**
     * Zero-based character offset of the problem, or -1 when unknown.
     */
    public int position() {
        return position;
    }

    private static String describe(String message, String source, int position) {
        if (source == null || position < 0) {
            return message;
        }
        return message + " at position " + position + " in \"" + source + "\"";
    }
}
