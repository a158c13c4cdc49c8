package org.javai.formula;

/**
 * Base class for failures raised while compiling a formula into model columns.
 *
 * <p>Every stage of the pipeline (parsing, schema computation, schema application,
 * materialization) fails with a subclass carrying the structural context needed to
 * diagnose the problem without re-running. Failures are never recovered from inside
 * the pipeline.
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
