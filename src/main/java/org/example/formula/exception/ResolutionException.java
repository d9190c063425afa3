package org.example.formula.exception;

/**
 * Exception thrown when a caller demands a selection from a resolution that did not produce one.
 */
public class ResolutionException extends FormulaEngineException {

    public ResolutionException(String message) {
        super(message);
    }
}
