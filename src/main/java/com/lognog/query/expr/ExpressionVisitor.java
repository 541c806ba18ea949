package com.lognog.query.expr;

public interface ExpressionVisitor<R> {

    R visitLiteral(LiteralExpression expression);

    R visitFieldRef(FieldRefExpression expression);

    R visitUnary(UnaryExpression expression);

    R visitBinary(BinaryExpression expression);

    R visitFunctionCall(FunctionCallExpression expression);

    R visitConditional(ConditionalExpression expression);
}
