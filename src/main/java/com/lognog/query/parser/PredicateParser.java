package com.lognog.query.parser;

import com.lognog.query.ast.AndPredicate;
import com.lognog.query.ast.ComparisonOperator;
import com.lognog.query.ast.ComparisonPredicate;
import com.lognog.query.ast.ContainsPredicate;
import com.lognog.query.ast.FieldName;
import com.lognog.query.ast.NotPredicate;
import com.lognog.query.ast.OrPredicate;
import com.lognog.query.ast.Predicate;
import com.lognog.query.ast.PredicateValue;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.expr.Expression;
import com.lognog.query.expr.ExpressionParser;
import com.lognog.query.lexer.Token;
import com.lognog.query.lexer.TokenType;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Precedence climbing over search predicates: OR binds loosest, then AND
 * (explicit or by juxtaposition), then prefix NOT, then a single term.
 *
 * A null predicate means "match everything"; it is what {@code *} parses to,
 * and it absorbs OR and disappears under AND.
 */
class PredicateParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    // token kinds that can be glued, without whitespace, into one value
    private static final Set<TokenType> WORD_PARTS = EnumSet.of(
        TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STAR, TokenType.MINUS,
        TokenType.SLASH, TokenType.COLON);

    private static final Set<TokenType> ARITHMETIC = EnumSet.of(
        TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT);

    private final TokenCursor cursor;
    private final ExpressionParser expressions;

    PredicateParser(TokenCursor cursor, ExpressionParser expressions) {
        this.cursor = cursor;
        this.expressions = expressions;
    }

    /**
     * True when the current token can start a predicate term.
     */
    boolean atTermStart() {
        switch (cursor.peek().getType()) {
            case IDENTIFIER:
            case STRING:
            case NUMBER:
            case STAR:
            case MINUS:
            case SLASH:
            case LPAREN:
            case NOT:
                return true;
            default:
                return false;
        }
    }

    Predicate parse() {
        return parseOr();
    }

    private Predicate parseOr() {
        Predicate left = parseAnd();
        while (cursor.check(TokenType.OR)) {
            cursor.advance();
            Predicate right = parseAnd();
            left = (left == null || right == null) ? null : new OrPredicate(left, right);
        }
        return left;
    }

    private Predicate parseAnd() {
        Predicate left = parseNot();
        while (true) {
            if (cursor.match(TokenType.AND)) {
                left = and(left, parseNot());
            } else if (atTermStart()) {
                // juxtaposition: a=1 b=2 means a=1 AND b=2
                left = and(left, parseNot());
            } else {
                return left;
            }
        }
    }

    private static Predicate and(Predicate left, Predicate right) {
        if (left == null) {
            return right;
        }
        return right == null ? left : new AndPredicate(left, right);
    }

    private Predicate parseNot() {
        if (cursor.check(TokenType.NOT)) {
            Token not = cursor.advance();
            Predicate operand = parseNot();
            if (operand == null) {
                throw new ParseException("NOT * would match nothing", not.getPosition());
            }
            return new NotPredicate(operand, not.getPosition());
        }
        return parsePrimary();
    }

    private Predicate parsePrimary() {
        Token token = cursor.peek();
        if (token.is(TokenType.LPAREN)) {
            cursor.advance();
            if (cursor.check(TokenType.RPAREN)) {
                throw cursor.error("Expected a search term");
            }
            Predicate inner = parseOr();
            cursor.expect(TokenType.RPAREN, "')'");
            return inner;
        }
        if (token.is(TokenType.IDENTIFIER)) {
            TokenType next = cursor.peek(1).getType();
            if (next.isComparison() || next == TokenType.CONTAINS) {
                return parseFieldTerm();
            }
        }
        if (token.is(TokenType.STRING)) {
            cursor.advance();
            return new ContainsPredicate(new FieldName(ContainsPredicate.RAW_FIELD, token.getPosition()), token.getText());
        }
        if (!atTermStart()) {
            throw cursor.error("Expected a search term");
        }
        String word = readWord();
        if (word.equals("*")) {
            return null;
        }
        return new ContainsPredicate(new FieldName(ContainsPredicate.RAW_FIELD, token.getPosition()), word);
    }

    private Predicate parseFieldTerm() {
        Token fieldToken = cursor.advance();
        FieldName field = new FieldName(fieldToken.getText(), fieldToken.getPosition());
        Token operator = cursor.advance();
        if (operator.is(TokenType.CONTAINS)) {
            return new ContainsPredicate(field, readContainsValue(operator));
        }
        return new ComparisonPredicate(field, ComparisonOperator.fromToken(operator.getType()), parseValue(operator));
    }

    private String readContainsValue(Token operator) {
        if (cursor.check(TokenType.STRING)) {
            return cursor.advance().getText();
        }
        if (!WORD_PARTS.contains(cursor.peek().getType())) {
            throw cursor.error("Expected a value after '" + operator.getText() + "'");
        }
        return readWord();
    }

    private PredicateValue parseValue(Token operator) {
        Token first = cursor.peek();
        if (first.is(TokenType.STRING)) {
            cursor.advance();
            if (WildcardPattern.isWildcard(first.getText())) {
                return PredicateValue.wildcard(new WildcardPattern(first.getText()), first.getPosition());
            }
            return PredicateValue.string(first.getText(), first.getPosition());
        }
        if (startsExpression()) {
            Expression expression = expressions.parseOperand(cursor);
            return PredicateValue.expression(expression, first.getPosition());
        }
        if (!WORD_PARTS.contains(first.getType())) {
            throw cursor.error("Expected a value after '" + operator.getText() + "'");
        }
        String word = readWord();
        if (WildcardPattern.isWildcard(word)) {
            return PredicateValue.wildcard(new WildcardPattern(word), first.getPosition());
        }
        if (NUMBER.matcher(word).matches()) {
            return PredicateValue.number(word, first.getPosition());
        }
        return PredicateValue.string(word, first.getPosition());
    }

    /**
     * A comparison value is an expression when it is parenthesised, a
     * function call, or a single number or name followed by a spaced
     * arithmetic operator ({@code bytes > 1024 * 4}).
     */
    private boolean startsExpression() {
        Token first = cursor.peek();
        Token second = cursor.peek(1);
        if (first.is(TokenType.LPAREN)) {
            return true;
        }
        if (!first.is(TokenType.IDENTIFIER) && !first.is(TokenType.NUMBER)) {
            return false;
        }
        if (first.is(TokenType.IDENTIFIER) && second.is(TokenType.LPAREN) && first.touches(second)) {
            return true;
        }
        if (!ARITHMETIC.contains(second.getType()) || first.touches(second)) {
            return false;
        }
        Token third = cursor.peek(2);
        return third.is(TokenType.NUMBER) || third.is(TokenType.IDENTIFIER) || third.is(TokenType.LPAREN);
    }

    /**
     * Consume a run of touching word tokens and return their text, e.g.
     * {@code web-01*} from IDENTIFIER, MINUS, NUMBER, STAR.
     */
    private String readWord() {
        Token token = cursor.advance();
        StringBuilder word = new StringBuilder(token.getText());
        while (WORD_PARTS.contains(cursor.peek().getType()) && token.touches(cursor.peek())) {
            token = cursor.advance();
            word.append(token.getText());
        }
        return word.toString();
    }
}
