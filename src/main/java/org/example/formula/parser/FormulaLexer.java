package org.example.formula.parser;

import org.example.formula.exception.FormulaSyntaxException;
import org.example.formula.version.Comparator;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens.
 *
 * <p>Runs of the operator characters {@code = ! < >} are read greedily: a run must be
 * a known comparator or start with a negating {@code !}, anything else (for example
 * {@code =>} or {@code ==}) is rejected as an unknown comparator.</p>
 */
public class FormulaLexer {

    private static final String OPERATOR_CHARS = "=!<>";

    private final String input;
    private int pos;

    public FormulaLexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the whole input. The returned list always ends with an EOF token.
     *
     * @throws FormulaSyntaxException on an unterminated string, unknown comparator or stray character
     */
    public List<Token> tokenize() throws FormulaSyntaxException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() throws FormulaSyntaxException {
        int start = pos;
        char c = input.charAt(pos);
        switch (c) {
            case '"':
                return readString();
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case '{':
                pos++;
                return new Token(TokenType.LBRACE, "{", start);
            case '}':
                pos++;
                return new Token(TokenType.RBRACE, "}", start);
            case '[':
                pos++;
                return new Token(TokenType.LBRACKET, "[", start);
            case ']':
                pos++;
                return new Token(TokenType.RBRACKET, "]", start);
            case '&':
                pos++;
                return new Token(TokenType.AND, "&", start);
            case '|':
                pos++;
                return new Token(TokenType.OR, "|", start);
            default:
                if (OPERATOR_CHARS.indexOf(c) >= 0) {
                    return readOperator();
                }
                throw new FormulaSyntaxException(start, "formula token",
                        "Unexpected character '" + c + "' at position " + start);
        }
    }

    private Token readString() throws FormulaSyntaxException {
        int start = pos;
        int close = input.indexOf('"', pos + 1);
        if (close < 0) {
            throw new FormulaSyntaxException(start, "closing '\"'",
                    "Unterminated string starting at position " + start);
        }
        pos = close + 1;
        return new Token(TokenType.STRING, input.substring(start + 1, close), start);
    }

    private Token readOperator() throws FormulaSyntaxException {
        int start = pos;
        while (pos < input.length() && OPERATOR_CHARS.indexOf(input.charAt(pos)) >= 0) {
            pos++;
        }
        String run = input.substring(start, pos);
        if (run.equals("!")) {
            return new Token(TokenType.NOT, run, start);
        }
        if (Comparator.fromSymbol(run).isPresent()) {
            return new Token(TokenType.COMPARATOR, run, start);
        }
        if (run.charAt(0) == '!') {
            // prefix negation glued to what follows, e.g. "!<" or "!!"
            pos = start + 1;
            return new Token(TokenType.NOT, "!", start);
        }
        throw new FormulaSyntaxException(start, "one of = != < <= > >=",
                "Unknown comparator '" + run + "' at position " + start);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
