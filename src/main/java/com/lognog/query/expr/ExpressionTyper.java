package com.lognog.query.expr;

import com.lognog.query.function.ArgType;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.function.FunctionSpec;
import com.lognog.query.schema.FieldType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Infers the type of an expression and rejects ill-typed ones.
 *
 * Field references are looked up through the supplied function, which must
 * know every field the expression uses; the resolver guarantees that before
 * typing. {@link FieldType#UNKNOWN} is compatible with everything.
 */
public class ExpressionTyper implements ExpressionVisitor<FieldType> {

    private final FunctionRegistry registry;
    private final Function<String, FieldType> fieldTypes;

    public ExpressionTyper(FunctionRegistry registry, Function<String, FieldType> fieldTypes) {
        this.registry = registry;
        this.fieldTypes = fieldTypes;
    }

    /**
     * @throws ExpressionException when the expression is ill-typed
     */
    public FieldType typeOf(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public FieldType visitLiteral(LiteralExpression expression) {
        switch (expression.getKind()) {
            case NUMBER:
                return expression.isIntegral() ? FieldType.INTEGER : FieldType.FLOAT;
            case STRING:
                return FieldType.STRING;
            case BOOLEAN:
                return FieldType.BOOLEAN;
            default:
                return FieldType.UNKNOWN;
        }
    }

    @Override
    public FieldType visitFieldRef(FieldRefExpression expression) {
        FieldType type = fieldTypes.apply(expression.getName());
        return type == null ? FieldType.UNKNOWN : type;
    }

    @Override
    public FieldType visitUnary(UnaryExpression expression) {
        FieldType operand = typeOf(expression.getOperand());
        if (expression.getOperator() == UnaryExpression.Operator.NOT) {
            requireBoolean(operand, "NOT", expression.getOperand());
            return FieldType.BOOLEAN;
        }
        if (operand != FieldType.UNKNOWN && !operand.isNumeric()) {
            throw new ExpressionException("Cannot negate a " + operand.getValue() + " value",
                expression.getPosition());
        }
        return operand;
    }

    @Override
    public FieldType visitBinary(BinaryExpression expression) {
        FieldType left = typeOf(expression.getLeft());
        FieldType right = typeOf(expression.getRight());
        BinaryOperator operator = expression.getOperator();
        switch (operator.getKind()) {
            case LOGICAL:
                requireBoolean(left, operator.getSymbol(), expression.getLeft());
                requireBoolean(right, operator.getSymbol(), expression.getRight());
                return FieldType.BOOLEAN;
            case COMPARISON:
                if (!comparable(left, right)) {
                    throw new ExpressionException("Cannot compare " + left.getValue() + " with "
                        + right.getValue() + " using '" + operator.getSymbol() + "'", expression.getPosition());
                }
                return FieldType.BOOLEAN;
            default:
                return arithmetic(operator, left, right, expression);
        }
    }

    private FieldType arithmetic(BinaryOperator operator, FieldType left, FieldType right, BinaryExpression expression) {
        boolean additive = operator == BinaryOperator.ADD || operator == BinaryOperator.SUBTRACT;
        if (additive && left == FieldType.DATETIME && (right.isNumeric() || right == FieldType.UNKNOWN)) {
            return FieldType.DATETIME;
        }
        if (!numericOrUnknown(left) || !numericOrUnknown(right)) {
            FieldType offending = numericOrUnknown(left) ? right : left;
            throw new ExpressionException("Operator '" + operator.getSymbol() + "' needs numbers but got a "
                + offending.getValue() + " value", expression.getPosition());
        }
        if (operator == BinaryOperator.DIVIDE) {
            return FieldType.FLOAT;
        }
        if (left == FieldType.UNKNOWN || right == FieldType.UNKNOWN) {
            return FieldType.UNKNOWN;
        }
        return left == FieldType.INTEGER && right == FieldType.INTEGER ? FieldType.INTEGER : FieldType.FLOAT;
    }

    @Override
    public FieldType visitFunctionCall(FunctionCallExpression expression) {
        FunctionSpec spec = registry.lookup(expression.getName());
        if (spec == null) {
            throw new ExpressionException("Unknown function '" + expression.getName() + "'", expression.getPosition());
        }
        List<Expression> arguments = expression.getArguments();
        if (!spec.getArity().accepts(arguments.size())) {
            throw new ExpressionException("Function '" + spec.getName() + "' takes " + spec.getArity()
                + " argument(s) but got " + arguments.size(), expression.getPosition());
        }
        List<FieldType> types = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            FieldType type = typeOf(arguments.get(i));
            ArgType expected = spec.argType(i);
            if (!expected.accepts(type)) {
                throw new ExpressionException("Function '" + spec.getName() + "' expects a "
                    + expected.getDescription() + " for argument " + (i + 1) + " but got " + type.getValue(),
                    arguments.get(i).getPosition());
            }
            types.add(type);
        }
        FieldType declared = spec.returnTypeFor(arguments.size());
        return declared != null ? declared : commonType(types, spec.getName(), expression.getPosition());
    }

    @Override
    public FieldType visitConditional(ConditionalExpression expression) {
        List<FieldType> values = new ArrayList<>();
        int index = 1;
        for (ConditionalExpression.Branch branch : expression.getBranches()) {
            FieldType condition = typeOf(branch.getCondition());
            if (condition != FieldType.BOOLEAN && condition != FieldType.UNKNOWN) {
                throw new ExpressionException("Condition " + index + " of " + expression.getFunction()
                    + "() must be boolean but is " + condition.getValue(), branch.getCondition().getPosition());
            }
            values.add(typeOf(branch.getValue()));
            index++;
        }
        if (expression.hasOtherwise()) {
            values.add(typeOf(expression.getOtherwise()));
        }
        return commonType(values, expression.getFunction(), expression.getPosition());
    }

    /**
     * Type shared by values that flow into one result, e.g. the branches of
     * a case. Integers widen to float; unknowns are ignored.
     */
    static FieldType commonType(List<FieldType> types, String function, int position) {
        FieldType common = FieldType.UNKNOWN;
        for (FieldType type : types) {
            if (type == FieldType.UNKNOWN || type == common) {
                continue;
            }
            if (common == FieldType.UNKNOWN) {
                common = type;
            } else if (common.isNumeric() && type.isNumeric()) {
                common = FieldType.FLOAT;
            } else {
                throw new ExpressionException(function + "() mixes incompatible types "
                    + common.getValue() + " and " + type.getValue(), position);
            }
        }
        return common;
    }

    private static boolean comparable(FieldType left, FieldType right) {
        if (left == FieldType.UNKNOWN || right == FieldType.UNKNOWN || left == right) {
            return true;
        }
        if (left.isNumeric() && right.isNumeric()) {
            return true;
        }
        // datetime columns compare against 'yyyy-MM-dd HH:mm:ss' strings
        return (left == FieldType.DATETIME && right == FieldType.STRING)
            || (left == FieldType.STRING && right == FieldType.DATETIME);
    }

    private static boolean numericOrUnknown(FieldType type) {
        return type == FieldType.UNKNOWN || type.isNumeric();
    }

    private static void requireBoolean(FieldType type, String operator, Expression operand) {
        if (type != FieldType.BOOLEAN && type != FieldType.UNKNOWN) {
            throw new ExpressionException("Operator '" + operator + "' needs a boolean operand but got "
                + type.getValue(), operand.getPosition());
        }
    }
}
