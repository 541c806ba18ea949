package com.lognog.query.expr;

import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.function.FunctionSpec;
import com.lognog.query.lexer.Token;
import com.lognog.query.lexer.TokenType;
import com.lognog.query.parser.ParseException;
import com.lognog.query.parser.TokenCursor;
import com.lognog.query.schema.FieldType;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds expression trees for eval assignments, where clauses, aggregation
 * arguments and computed comparison values.
 *
 * Precedence, lowest first: OR, AND, NOT, comparison, {@code + -},
 * {@code * / %}, unary minus, primary. Comparisons do not chain.
 * Grammar errors are {@link ParseException}s; unknown functions, wrong
 * argument counts and malformed {@code case} calls are
 * {@link ExpressionException}s.
 */
public class ExpressionParser {

    private final FunctionRegistry registry;

    public ExpressionParser(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Build one expression from a complete token list (ending in EOF).
     */
    public Expression build(List<Token> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);
        Expression expression = parse(cursor);
        if (!cursor.isAtEnd()) {
            throw cursor.error("Expected end of expression");
        }
        return expression;
    }

    /**
     * Parse a full expression at the cursor, stopping before the first token
     * that cannot continue it (comma, pipe, closing parenthesis, EOF).
     */
    public Expression parse(TokenCursor cursor) {
        return parseOr(cursor);
    }

    /**
     * Parse an arithmetic operand: no comparison or boolean operators. Used
     * for the right-hand side of a search comparison.
     */
    public Expression parseOperand(TokenCursor cursor) {
        return parseAdditive(cursor);
    }

    private Expression parseOr(TokenCursor cursor) {
        Expression left = parseAnd(cursor);
        while (cursor.match(TokenType.OR)) {
            left = new BinaryExpression(left, BinaryOperator.OR, parseAnd(cursor));
        }
        return left;
    }

    private Expression parseAnd(TokenCursor cursor) {
        Expression left = parseNot(cursor);
        while (cursor.match(TokenType.AND)) {
            left = new BinaryExpression(left, BinaryOperator.AND, parseNot(cursor));
        }
        return left;
    }

    private Expression parseNot(TokenCursor cursor) {
        if (cursor.check(TokenType.NOT)) {
            Token not = cursor.advance();
            return new UnaryExpression(UnaryExpression.Operator.NOT, parseNot(cursor), not.getPosition());
        }
        return parseComparison(cursor);
    }

    private Expression parseComparison(TokenCursor cursor) {
        Expression left = parseAdditive(cursor);
        BinaryOperator operator = comparisonOperator(cursor.peek().getType());
        if (operator == null) {
            return left;
        }
        cursor.advance();
        Expression right = parseAdditive(cursor);
        if (comparisonOperator(cursor.peek().getType()) != null) {
            throw cursor.error("Comparisons cannot be chained; expected AND or OR");
        }
        return new BinaryExpression(left, operator, right);
    }

    private Expression parseAdditive(TokenCursor cursor) {
        Expression left = parseMultiplicative(cursor);
        while (true) {
            if (cursor.match(TokenType.PLUS)) {
                left = new BinaryExpression(left, BinaryOperator.ADD, parseMultiplicative(cursor));
            } else if (cursor.match(TokenType.MINUS)) {
                left = new BinaryExpression(left, BinaryOperator.SUBTRACT, parseMultiplicative(cursor));
            } else {
                return left;
            }
        }
    }

    private Expression parseMultiplicative(TokenCursor cursor) {
        Expression left = parseUnary(cursor);
        while (true) {
            if (cursor.match(TokenType.STAR)) {
                left = new BinaryExpression(left, BinaryOperator.MULTIPLY, parseUnary(cursor));
            } else if (cursor.match(TokenType.SLASH)) {
                left = new BinaryExpression(left, BinaryOperator.DIVIDE, parseUnary(cursor));
            } else if (cursor.match(TokenType.PERCENT)) {
                left = new BinaryExpression(left, BinaryOperator.MODULO, parseUnary(cursor));
            } else {
                return left;
            }
        }
    }

    private Expression parseUnary(TokenCursor cursor) {
        if (cursor.check(TokenType.MINUS)) {
            Token minus = cursor.advance();
            Expression operand = parseUnary(cursor);
            if (operand instanceof LiteralExpression
                && ((LiteralExpression) operand).getKind() == LiteralExpression.Kind.NUMBER
                && !((LiteralExpression) operand).getText().startsWith("-")) {
                return LiteralExpression.number("-" + ((LiteralExpression) operand).getText(), minus.getPosition());
            }
            return new UnaryExpression(UnaryExpression.Operator.NEGATE, operand, minus.getPosition());
        }
        return parsePrimary(cursor);
    }

    private Expression parsePrimary(TokenCursor cursor) {
        Token token = cursor.peek();
        switch (token.getType()) {
            case NUMBER:
                cursor.advance();
                return LiteralExpression.number(token.getText(), token.getPosition());
            case STRING:
                cursor.advance();
                return LiteralExpression.string(token.getText(), token.getPosition());
            case LPAREN: {
                cursor.advance();
                Expression inner = parseOr(cursor);
                cursor.expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case IDENTIFIER:
                cursor.advance();
                if (cursor.check(TokenType.LPAREN)) {
                    return parseCall(cursor, token);
                }
                return identifier(token);
            default:
                throw cursor.error("Expected a value, field or function call");
        }
    }

    private Expression identifier(Token token) {
        String text = token.getText();
        if ("true".equalsIgnoreCase(text)) {
            return LiteralExpression.bool(true, token.getPosition());
        }
        if ("false".equalsIgnoreCase(text)) {
            return LiteralExpression.bool(false, token.getPosition());
        }
        if ("null".equalsIgnoreCase(text)) {
            return LiteralExpression.nullValue(token.getPosition());
        }
        return new FieldRefExpression(text, token.getPosition());
    }

    private Expression parseCall(TokenCursor cursor, Token nameToken) {
        cursor.expect(TokenType.LPAREN, "'('");
        List<Expression> arguments = new ArrayList<>();
        if (!cursor.check(TokenType.RPAREN)) {
            do {
                arguments.add(parseOr(cursor));
            } while (cursor.match(TokenType.COMMA));
        }
        cursor.expect(TokenType.RPAREN, "',' or ')'");
        return call(nameToken.getText(), arguments, nameToken.getPosition());
    }

    /**
     * Check a call against the registry and build its node.
     */
    Expression call(String name, List<Expression> arguments, int position) {
        FunctionSpec spec = registry.lookup(name);
        if (spec == null) {
            throw new ExpressionException("Unknown function '" + name + "'", position);
        }
        if (!spec.getArity().accepts(arguments.size())) {
            throw new ExpressionException("Function '" + spec.getName() + "' takes " + spec.getArity()
                + " argument(s) but got " + arguments.size(), position);
        }
        if ("if".equals(spec.getName())) {
            return new ConditionalExpression("if",
                List.of(new ConditionalExpression.Branch(arguments.get(0), arguments.get(1))),
                arguments.get(2), position);
        }
        if ("case".equals(spec.getName())) {
            return buildCase(arguments, position);
        }
        return new FunctionCallExpression(spec.getName(), arguments, position);
    }

    private Expression buildCase(List<Expression> arguments, int position) {
        Expression otherwise = null;
        int pairs = arguments.size() / 2;
        if (arguments.size() % 2 == 1) {
            Expression last = arguments.get(arguments.size() - 1);
            if (isBooleanShaped(last)) {
                throw new ExpressionException("case() argument " + arguments.size()
                    + " is a condition without a value; add its value or a non-boolean default", last.getPosition());
            }
            otherwise = last;
        }
        List<ConditionalExpression.Branch> branches = new ArrayList<>(pairs);
        for (int i = 0; i < pairs; i++) {
            branches.add(new ConditionalExpression.Branch(arguments.get(2 * i), arguments.get(2 * i + 1)));
        }
        return new ConditionalExpression("case", branches, otherwise, position);
    }

    /**
     * True when an expression is recognisably a condition rather than a value.
     */
    private boolean isBooleanShaped(Expression expression) {
        if (expression instanceof BinaryExpression) {
            return !((BinaryExpression) expression).getOperator().is(BinaryOperator.Kind.ARITHMETIC);
        }
        if (expression instanceof UnaryExpression) {
            return ((UnaryExpression) expression).getOperator() == UnaryExpression.Operator.NOT;
        }
        if (expression instanceof LiteralExpression) {
            return ((LiteralExpression) expression).getKind() == LiteralExpression.Kind.BOOLEAN;
        }
        if (expression instanceof FunctionCallExpression) {
            FunctionCallExpression call = (FunctionCallExpression) expression;
            FunctionSpec spec = registry.lookup(call.getName());
            return spec != null && spec.returnTypeFor(call.getArguments().size()) == FieldType.BOOLEAN;
        }
        return false;
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        switch (type) {
            case EQUALS:
                return BinaryOperator.EQ;
            case NOT_EQUALS:
                return BinaryOperator.NE;
            case LESS_THAN:
                return BinaryOperator.LT;
            case LESS_THAN_EQ:
                return BinaryOperator.LE;
            case GREATER_THAN:
                return BinaryOperator.GT;
            case GREATER_THAN_EQ:
                return BinaryOperator.GE;
            default:
                return null;
        }
    }
}
