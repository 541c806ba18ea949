package com.lognog.query.parser;

import com.lognog.query.lexer.Token;
import com.lognog.query.lexer.TokenType;

import java.util.List;

/**
 * Read position over a token list. One cursor per parse call; not thread safe.
 */
public class TokenCursor {

    private final List<Token> tokens;
    private int index;

    public TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public Token peek() {
        return tokens.get(index);
    }

    /**
     * Look ahead {@code offset} tokens; past the end this yields the EOF token.
     */
    public Token peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    public Token previous() {
        return index == 0 ? null : tokens.get(index - 1);
    }

    public Token advance() {
        Token current = tokens.get(index);
        if (!current.is(TokenType.EOF)) {
            index++;
        }
        return current;
    }

    public boolean check(TokenType type) {
        return peek().is(type);
    }

    public boolean checkWord(String word) {
        return peek().isWord(word);
    }

    public boolean isAtEnd() {
        return check(TokenType.EOF);
    }

    public boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    public boolean matchWord(String word) {
        if (checkWord(word)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consume a token of the given type or fail with an expected-token hint.
     */
    public Token expect(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + expected);
    }

    public Token expectWord(String word) {
        if (checkWord(word)) {
            return advance();
        }
        throw error("Expected '" + word + "'");
    }

    /**
     * Build a parse error at the current token, naming what was found there.
     */
    public ParseException error(String expectation) {
        Token found = peek();
        return new ParseException(expectation + " but found " + found.describe(), found.getPosition());
    }
}
