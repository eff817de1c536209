package com.sift.expression;

import java.util.Objects;

/**
 * Represents a unary expression: logical negation, arithmetic negation,
 * or a transparent conversion/quote wrapper around its operand
 */
public final class UnaryExpression implements Expression {
    private final ExpressionType operator;
    private final Expression operand;

    public UnaryExpression(ExpressionType operator, Expression operand) {
        if (Objects.requireNonNull(operator, "operator").isBinary()) {
            throw new IllegalArgumentException("Not a unary operator: " + operator);
        }
        this.operator = operator;
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public ExpressionType getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    /**
     * True for wrappers that carry no semantics of their own (CONVERT, QUOTE)
     */
    public boolean isTransparent() {
        return operator == ExpressionType.CONVERT || operator == ExpressionType.QUOTE;
    }

    @Override
    public String toString() {
        return isTransparent() ? operand.toString() : operator.getSymbol() + operand;
    }
}
