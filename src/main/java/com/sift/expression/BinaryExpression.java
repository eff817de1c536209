package com.sift.expression;

import java.util.Objects;

/**
 * Represents a binary expression (comparison, AND/OR, arithmetic)
 */
public final class BinaryExpression implements Expression {
    private final ExpressionType operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(ExpressionType operator, Expression left, Expression right) {
        if (!Objects.requireNonNull(operator, "operator").isBinary()) {
            throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
        this.operator = operator;
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public ExpressionType getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
