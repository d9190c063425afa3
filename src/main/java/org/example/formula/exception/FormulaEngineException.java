package org.example.formula.exception;

/**
 * Base exception for all formula engine errors.
 */
public class FormulaEngineException extends Exception {

    public FormulaEngineException(String message) {
        super(message);
    }

    public FormulaEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
