package com.lognog.query.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds an expression tree bottom-up. Subclasses override the nodes they
 * rewrite; untouched subtrees are returned as the same instances.
 */
public abstract class ExpressionTransformer implements ExpressionVisitor<Expression> {

    public Expression transform(Expression expression) {
        return expression == null ? null : expression.accept(this);
    }

    @Override
    public Expression visitLiteral(LiteralExpression expression) {
        return expression;
    }

    @Override
    public Expression visitFieldRef(FieldRefExpression expression) {
        return expression;
    }

    @Override
    public Expression visitUnary(UnaryExpression expression) {
        Expression operand = transform(expression.getOperand());
        if (operand == expression.getOperand()) {
            return expression;
        }
        return new UnaryExpression(expression.getOperator(), operand, expression.getPosition());
    }

    @Override
    public Expression visitBinary(BinaryExpression expression) {
        Expression left = transform(expression.getLeft());
        Expression right = transform(expression.getRight());
        if (left == expression.getLeft() && right == expression.getRight()) {
            return expression;
        }
        return new BinaryExpression(left, expression.getOperator(), right);
    }

    @Override
    public Expression visitFunctionCall(FunctionCallExpression expression) {
        List<Expression> arguments = new ArrayList<>(expression.getArguments().size());
        for (Expression argument : expression.getArguments()) {
            arguments.add(transform(argument));
        }
        return expression.withArguments(arguments);
    }

    @Override
    public Expression visitConditional(ConditionalExpression expression) {
        List<ConditionalExpression.Branch> branches = new ArrayList<>(expression.getBranches().size());
        for (ConditionalExpression.Branch branch : expression.getBranches()) {
            Expression condition = transform(branch.getCondition());
            Expression value = transform(branch.getValue());
            if (condition == branch.getCondition() && value == branch.getValue()) {
                branches.add(branch);
            } else {
                branches.add(new ConditionalExpression.Branch(condition, value));
            }
        }
        return expression.with(branches, transform(expression.getOtherwise()));
    }
}
