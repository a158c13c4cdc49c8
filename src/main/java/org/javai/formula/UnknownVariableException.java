package org.javai.formula;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a formula references a variable that is not a column of the table.
 */
public class UnknownVariableException extends FormulaException {

    private final String variable;
    private final List<String> suggestions;

    public UnknownVariableException(String variable, List<String> suggestions) {
        super(describe(variable, suggestions));
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.suggestions = List.copyOf(suggestions);
    }

    public String variable() {
        return variable;
    }

    /**
     * Column names closest to the unknown variable, nearest first. May be empty.
     */
    public List<String> suggestions() {
        return suggestions;
    }

    private static String describe(String variable, List<String> suggestions) {
        String message = "There isn't a variable called '" + variable + "' in the data";
        if (suggestions.isEmpty()) {
            return message;
        }
        return message + "; the nearest names appear to be: " + String.join(", ", suggestions);
    }
}
