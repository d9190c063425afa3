package org.example.formula.exception;

/**
 * Exception thrown when a version string cannot be parsed.
 */
public class MalformedVersionException extends FormulaEngineException {

    private final String text;

    public MalformedVersionException(String text, String message) {
        super(message);
        this.text = text;
    }

    /**
     * Returns the rejected version text (may be null).
     */
    public String getText() {
        return text;
    }
}
