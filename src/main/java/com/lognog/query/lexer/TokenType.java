package com.lognog.query.lexer;

/**
 * Token kinds produced by {@link DslLexer}.
 * Command names (stats, eval, ...) are plain identifiers; only the boolean
 * keywords are reserved.
 */
public enum TokenType {

    // Literals
    IDENTIFIER,
    STRING,
    NUMBER,

    // Comparison operators
    EQUALS,
    NOT_EQUALS,
    LESS_THAN,
    LESS_THAN_EQ,
    GREATER_THAN,
    GREATER_THAN_EQ,
    CONTAINS,

    // Boolean keywords
    AND,
    OR,
    NOT,

    // Arithmetic and wildcard
    STAR,
    PLUS,
    MINUS,
    SLASH,
    PERCENT,

    // Punctuation
    PIPE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,

    EOF;

    public boolean isComparison() {
        switch (this) {
            case EQUALS:
            case NOT_EQUALS:
            case LESS_THAN:
            case LESS_THAN_EQ:
            case GREATER_THAN:
            case GREATER_THAN_EQ:
                return true;
            default:
                return false;
        }
    }
}
