package com.lognog.query.lexer;

import com.google.common.collect.ImmutableMap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tokenizes raw query text.
 *
 * Whitespace only separates tokens, but token adjacency is kept (via
 * positions) so the parser can glue values such as {@code web-01*} back
 * together. A {@code #} starts a comment that runs to the end of the line.
 * The last token is always {@link TokenType#EOF}.
 */
@Component
public class DslLexer {

    private static final Map<String, TokenType> KEYWORDS = ImmutableMap.of(
        "and", TokenType.AND,
        "or", TokenType.OR,
        "not", TokenType.NOT
    );

    /**
     * Tokenize a query.
     *
     * @param text the query text; null is treated as empty
     * @return the tokens, terminated by an EOF token
     * @throws LexException on an unterminated string or an illegal character
     */
    public List<Token> tokenize(String text) {
        return new Scanner(text == null ? "" : text).scan();
    }

    private static final class Scanner {
        private final String input;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;

        Scanner(String input) {
            this.input = input;
        }

        List<Token> scan() {
            while (true) {
                skipWhitespaceAndComments();
                if (isAtEnd()) {
                    break;
                }
                tokens.add(nextToken());
            }
            tokens.add(new Token(TokenType.EOF, "", input.length(), input.length()));
            return tokens;
        }

        private Token nextToken() {
            int start = pos;
            char c = input.charAt(pos);

            switch (c) {
                case '|':
                    return single(TokenType.PIPE);
                case ',':
                    return single(TokenType.COMMA);
                case '(':
                    return single(TokenType.LPAREN);
                case ')':
                    return single(TokenType.RPAREN);
                case '~':
                    return single(TokenType.CONTAINS);
                case '*':
                    return single(TokenType.STAR);
                case '+':
                    return single(TokenType.PLUS);
                case '-':
                    return single(TokenType.MINUS);
                case '/':
                    return single(TokenType.SLASH);
                case '%':
                    return single(TokenType.PERCENT);
                case ':':
                    return single(TokenType.COLON);
                case '=':
                    pos++;
                    if (peek() == '=') {
                        pos++;
                    }
                    return new Token(TokenType.EQUALS, input.substring(start, pos), start, pos);
                case '!':
                    pos++;
                    if (peek() == '=') {
                        pos++;
                        return new Token(TokenType.NOT_EQUALS, "!=", start, pos);
                    }
                    throw new LexException("Unexpected character '!'; did you mean '!='?", start);
                case '<':
                    pos++;
                    if (peek() == '=') {
                        pos++;
                        return new Token(TokenType.LESS_THAN_EQ, "<=", start, pos);
                    }
                    return new Token(TokenType.LESS_THAN, "<", start, pos);
                case '>':
                    pos++;
                    if (peek() == '=') {
                        pos++;
                        return new Token(TokenType.GREATER_THAN_EQ, ">=", start, pos);
                    }
                    return new Token(TokenType.GREATER_THAN, ">", start, pos);
                case '"':
                case '\'':
                    return readString(c);
                default:
                    break;
            }

            if (isDigit(c)) {
                return readNumber();
            }
            if (isIdentifierStart(c) || (c == '.' && isAlphanumeric(peekNext()))) {
                return readWord(start);
            }
            throw new LexException("Unexpected character '" + c + "'", start);
        }

        private Token single(TokenType type) {
            int start = pos++;
            return new Token(type, input.substring(start, pos), start, pos);
        }

        private Token readString(char quote) {
            int start = pos++;
            StringBuilder value = new StringBuilder();
            while (!isAtEnd() && peek() != quote) {
                char c = input.charAt(pos);
                if (c == '\\' && (peekNext() == quote || peekNext() == '\\')) {
                    value.append(peekNext());
                    pos += 2;
                } else {
                    // other escapes stay verbatim, rex patterns rely on \w, \d, ...
                    value.append(c);
                    pos++;
                }
            }
            if (isAtEnd()) {
                throw new LexException("Unterminated string", start);
            }
            pos++;
            return new Token(TokenType.STRING, value.toString(), start, pos);
        }

        private Token readNumber() {
            int start = pos;
            while (!isAtEnd() && isDigit(peek())) {
                pos++;
            }
            if (peek() == '.' && isDigit(peekNext())) {
                pos++;
                while (!isAtEnd() && isDigit(peek())) {
                    pos++;
                }
            }
            // 10.0.0.1, 404s, 1h: a word that merely starts with digits
            if (!isAtEnd() && isIdentifierPart(peek()) && !(peek() == '.' && !isAlphanumeric(peekNext()))) {
                return readWord(start);
            }
            return new Token(TokenType.NUMBER, input.substring(start, pos), start, pos);
        }

        private Token readWord(int start) {
            while (!isAtEnd() && isIdentifierPart(peek())) {
                pos++;
            }
            String text = input.substring(start, pos);
            TokenType keyword = KEYWORDS.get(text.toLowerCase(Locale.ROOT));
            return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start, pos);
        }

        private void skipWhitespaceAndComments() {
            while (!isAtEnd()) {
                char c = peek();
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '#') {
                    while (!isAtEnd() && peek() != '\n') {
                        pos++;
                    }
                } else {
                    break;
                }
            }
        }

        private char peek() {
            return pos < input.length() ? input.charAt(pos) : '\0';
        }

        private char peekNext() {
            return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
        }

        private boolean isAtEnd() {
            return pos >= input.length();
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isAlphanumeric(char c) {
            return isDigit(c) || Character.isLetter(c);
        }

        private static boolean isIdentifierStart(char c) {
            return Character.isLetter(c) || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return isAlphanumeric(c) || c == '_' || c == '.' || c == '@';
        }
    }
}
