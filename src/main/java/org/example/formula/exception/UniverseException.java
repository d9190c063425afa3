package org.example.formula.exception;

/**
 * Exception thrown when package metadata cannot be loaded into a universe.
 */
public class UniverseException extends FormulaEngineException {

    public UniverseException(String message) {
        super(message);
    }

    public UniverseException(String message, Throwable cause) {
        super(message, cause);
    }
}
