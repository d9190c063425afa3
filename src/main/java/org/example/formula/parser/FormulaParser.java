package org.example.formula.parser;

import org.example.formula.exception.FormulaSyntaxException;
import org.example.formula.exception.MalformedVersionException;
import org.example.formula.model.Formula;
import org.example.formula.version.Comparator;
import org.example.formula.version.Constraint;
import org.example.formula.version.Version;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for package formulas.
 *
 * <p>Grammar (whitespace is insignificant):</p>
 * <pre>
 * formula     := andExpr ("|" andExpr)*
 * andExpr     := unary ("&amp;" unary)*
 * unary       := "!" unary | "(" formula ")" | atom
 * atom        := STRING constraints?
 * constraints := "{" constraint ("&amp;"? constraint)* "}"
 * constraint  := "!" constraint | "(" constraint ")" | COMPARATOR STRING
 * </pre>
 *
 * <p>{@code !} binds tighter than {@code &amp;}, which binds tighter than {@code |}.
 * Chains of the same connective nest to the left. The parser holds no state between
 * calls and never consults a package universe.</p>
 */
public class FormulaParser {

    private static final String TERM_START = "package name, '(' or '!'";

    /**
     * Parses a single formula.
     *
     * @param text the formula text, e.g. {@code "B" {>= "2.0.0"} & ("C" | "D")}
     * @return the parsed formula
     * @throws FormulaSyntaxException if the text is empty or not well-formed
     */
    public Formula parse(String text) throws FormulaSyntaxException {
        if (text == null) {
            throw new FormulaSyntaxException(0, TERM_START, "Formula text cannot be null");
        }
        Cursor cursor = new Cursor(new FormulaLexer(text).tokenize());
        if (cursor.peek().is(TokenType.EOF)) {
            throw new FormulaSyntaxException(0, TERM_START, "Formula is empty");
        }
        Formula formula = cursor.parseOr();
        cursor.expectEnd();
        return formula;
    }

    /**
     * Parses the body of an opam-style {@code depends} field.
     *
     * <p>Accepts either a bare formula or a bracketed list of formulas, e.g.
     * {@code [ "B" {> "1.0.0"} "C" ]}. List items are combined with AND.</p>
     *
     * @param text the field text
     * @return the combined formula, or empty when there are no dependencies (blank text or {@code []})
     * @throws FormulaSyntaxException if the text is not well-formed
     */
    public Optional<Formula> parseDependencyList(String text) throws FormulaSyntaxException {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Cursor cursor = new Cursor(new FormulaLexer(text).tokenize());
        if (!cursor.peek().is(TokenType.LBRACKET)) {
            Formula formula = cursor.parseOr();
            cursor.expectEnd();
            return Optional.of(formula);
        }

        Token open = cursor.advance();
        List<Formula> items = new ArrayList<>();
        while (!cursor.peek().is(TokenType.RBRACKET)) {
            if (cursor.peek().is(TokenType.EOF)) {
                throw new FormulaSyntaxException(cursor.peek().position(), "']'",
                        "Unbalanced brackets: missing ']' for '[' at position " + open.position());
            }
            items.add(cursor.parseOr());
        }
        cursor.advance();
        cursor.expectEnd();
        return Formula.allOf(items);
    }

    /**
     * Token cursor for one parse call.
     */
    private static final class Cursor {

        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        Formula parseOr() throws FormulaSyntaxException {
            Formula left = parseAnd();
            while (peek().is(TokenType.OR)) {
                advance();
                left = Formula.or(left, parseAnd());
            }
            return left;
        }

        Formula parseAnd() throws FormulaSyntaxException {
            Formula left = parseUnary();
            while (peek().is(TokenType.AND)) {
                advance();
                left = Formula.and(left, parseUnary());
            }
            return left;
        }

        Formula parseUnary() throws FormulaSyntaxException {
            Token token = peek();
            switch (token.type()) {
                case NOT:
                    advance();
                    return Formula.not(parseUnary());
                case LPAREN:
                    advance();
                    Formula inner = parseOr();
                    if (!peek().is(TokenType.RPAREN)) {
                        throw new FormulaSyntaxException(peek().position(), "')'",
                                "Unbalanced parentheses: expected ')' to close '(' at position "
                                        + token.position() + " but found " + peek().describe());
                    }
                    advance();
                    return inner;
                case STRING:
                    return parseAtom();
                default:
                    throw unexpectedTerm(token);
            }
        }

        private FormulaSyntaxException unexpectedTerm(Token token) {
            Token previous = index > 0 ? tokens.get(index - 1) : null;
            if (previous != null && (previous.is(TokenType.AND) || previous.is(TokenType.OR)
                    || previous.is(TokenType.NOT))) {
                return new FormulaSyntaxException(token.position(), TERM_START,
                        "Dangling connective '" + previous.text() + "' at position " + previous.position()
                                + ": expected " + TERM_START + " but found " + token.describe());
            }
            return new FormulaSyntaxException(token.position(), TERM_START,
                    "Expected " + TERM_START + " at position " + token.position()
                            + " but found " + token.describe());
        }

        private Formula parseAtom() throws FormulaSyntaxException {
            Token name = advance();
            if (name.text().isEmpty()) {
                throw new FormulaSyntaxException(name.position(), "non-empty package name",
                        "Package name cannot be empty at position " + name.position());
            }
            if (!peek().is(TokenType.LBRACE)) {
                return Formula.pkg(name.text());
            }

            Token open = advance();
            List<Constraint> constraints = new ArrayList<>();
            constraints.add(parseConstraint());
            while (true) {
                Token next = peek();
                if (next.is(TokenType.RBRACE)) {
                    advance();
                    return Formula.pkg(name.text(), constraints);
                }
                if (next.is(TokenType.AND)) {
                    advance();
                } else if (next.is(TokenType.EOF)) {
                    throw new FormulaSyntaxException(next.position(), "'}'",
                            "Unbalanced braces: missing '}' for '{' at position " + open.position());
                } else if (!startsConstraint(next)) {
                    throw new FormulaSyntaxException(next.position(), "'&' or '}'",
                            "Expected '&' or '}' in constraint block at position " + next.position()
                                    + " but found " + next.describe());
                }
                constraints.add(parseConstraint());
            }
        }

        private boolean startsConstraint(Token token) {
            return token.is(TokenType.NOT) || token.is(TokenType.LPAREN) || token.is(TokenType.COMPARATOR);
        }

        private Constraint parseConstraint() throws FormulaSyntaxException {
            Token token = advance();
            switch (token.type()) {
                case NOT:
                    return parseConstraint().negate();
                case LPAREN: {
                    Constraint inner = parseConstraint();
                    if (!peek().is(TokenType.RPAREN)) {
                        throw new FormulaSyntaxException(peek().position(), "')'",
                                "Unbalanced parentheses: expected ')' to close '(' at position "
                                        + token.position() + " but found " + peek().describe());
                    }
                    advance();
                    return inner;
                }
                case COMPARATOR: {
                    Comparator comparator = Comparator.fromSymbol(token.text())
                            .orElseThrow(() -> new IllegalStateException("Lexer produced unknown comparator " + token.text()));
                    Token bound = advance();
                    if (!bound.is(TokenType.STRING)) {
                        throw new FormulaSyntaxException(bound.position(), "version string",
                                "Expected version string after '" + token.text() + "' at position "
                                        + bound.position() + " but found " + bound.describe());
                    }
                    return Constraint.of(comparator, parseVersion(bound));
                }
                case STRING:
                    throw new FormulaSyntaxException(token.position(), "comparator",
                            "Expected comparator before " + token.describe() + " at position " + token.position());
                default:
                    throw new FormulaSyntaxException(token.position(), "comparator, '(' or '!'",
                            "Expected constraint at position " + token.position() + " but found " + token.describe());
            }
        }

        private Version parseVersion(Token bound) throws FormulaSyntaxException {
            try {
                return Version.parse(bound.text());
            } catch (MalformedVersionException e) {
                throw new FormulaSyntaxException(bound.position(), "version",
                        "Malformed version at position " + bound.position() + ": " + e.getMessage(), e);
            }
        }

        void expectEnd() throws FormulaSyntaxException {
            Token token = peek();
            if (token.is(TokenType.EOF)) {
                return;
            }
            if (token.is(TokenType.RPAREN)) {
                throw new FormulaSyntaxException(token.position(), "end of input",
                        "Unbalanced parentheses: unexpected ')' at position " + token.position());
            }
            throw new FormulaSyntaxException(token.position(), "'&', '|' or end of input",
                    "Expected '&', '|' or end of input at position " + token.position()
                            + " but found " + token.describe());
        }
    }
}
