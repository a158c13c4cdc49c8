package org.javai.formula;

/**
 * Thrown when a numeric column referenced by a formula has no non-missing values,
 * so no summary (mean, variance, range) can be computed for it.
 */
public class EmptyColumnException extends FormulaException {

    private final String variable;

    public EmptyColumnException(String variable) {
        super("Column " + variable + " is empty");
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
