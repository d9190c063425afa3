package org.example.formula.parser;

/**
 * Lexical categories of formula text.
 */
public enum TokenType {
    STRING,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    AND,
    OR,
    NOT,
    COMPARATOR,
    EOF
}
