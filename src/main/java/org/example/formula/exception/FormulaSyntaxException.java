package org.example.formula.exception;

/**
 * Exception thrown when formula text violates the formula grammar.
 * Carries the zero-based character position and what the parser expected there.
 */
public class FormulaSyntaxException extends FormulaEngineException {

    private final int position;
    private final String expected;

    public FormulaSyntaxException(int position, String expected, String message) {
        super(message);
        this.position = position;
        this.expected = expected;
    }

    public FormulaSyntaxException(int position, String expected, String message, Throwable cause) {
        super(message, cause);
        this.position = position;
        this.expected = expected;
    }

    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }
}
