package org.example.formula.parser;

/**
 * A lexical token with its text and zero-based start offset in the input.
 * For {@link TokenType#STRING} tokens the text is the unquoted content.
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Describes the token for error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
