package com.lognog.query.lexer;

/**
 * A lexical token. {@code text} is the token's value (string literals
 * without quotes and with escapes applied); {@code position} and {@code end}
 * are character offsets into the query text.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;
    private final int end;

    public Token(TokenType type, String text, int position, int end) {
        this.type = type;
        this.text = text;
        this.position = position;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public int getEnd() {
        return end;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * True for an identifier whose text equals {@code word}, ignoring case.
     */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(word);
    }

    /**
     * True when {@code next} starts exactly where this token ends, i.e. no
     * whitespace separates them.
     */
    public boolean touches(Token next) {
        return next != null && next.position == end;
    }

    /**
     * Human readable form used in error messages.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of query";
        }
        if (type == TokenType.STRING) {
            return "\"" + text + "\"";
        }
        return "'" + text + "'";
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
