package com.lognog.query.expr;

import java.util.Objects;

public final class UnaryExpression implements Expression {

    public enum Operator {
        NEGATE("-"),
        NOT("NOT");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final Expression operand;
    private final int position;

    public UnaryExpression(Operator operator, Expression operand, int position) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
        this.position = position;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator == Operator.NOT ? "NOT " + operand : "-" + operand;
    }
}
