package com.sift.expression;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building expression trees by hand.
 * Query builders use these to hand a call chain to the compilers.
 */
public final class Expressions {

    private Expressions() {
    }

    public static MemberExpression member(String name) {
        return new MemberExpression(name);
    }

    public static ConstantExpression constant(Object value) {
        return new ConstantExpression(value);
    }

    public static BinaryExpression binary(ExpressionType operator, Expression left, Expression right) {
        return new BinaryExpression(operator, left, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return binary(ExpressionType.GREATER_THAN, left, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return binary(ExpressionType.LESS_THAN, left, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return binary(ExpressionType.GREATER_THAN_OR_EQUAL, left, right);
    }

    public static BinaryExpression lessThanOrEqual(Expression left, Expression right) {
        return binary(ExpressionType.LESS_THAN_OR_EQUAL, left, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return binary(ExpressionType.EQUAL, left, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return binary(ExpressionType.NOT_EQUAL, left, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return binary(ExpressionType.AND_ALSO, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return binary(ExpressionType.OR_ELSE, left, right);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(ExpressionType.NOT, operand);
    }

    public static UnaryExpression convert(Expression operand) {
        return new UnaryExpression(ExpressionType.CONVERT, operand);
    }

    public static UnaryExpression quote(Expression operand) {
        return new UnaryExpression(ExpressionType.QUOTE, operand);
    }

    public static LambdaExpression lambda(Expression body) {
        return new LambdaExpression(body);
    }

    public static LambdaExpression lambda(Expression body, List<String> resultShape) {
        return new LambdaExpression(body, resultShape);
    }

    public static NewExpression newObject(String... members) {
        return new NewExpression(Arrays.asList(members));
    }

    public static MethodCallExpression call(String methodName, Expression... arguments) {
        return new MethodCallExpression(methodName, Arrays.asList(arguments));
    }

    /**
     * Chains a stage call onto a source, quoting lambda arguments the way
     * compiled query providers hand them over.
     */
    public static MethodCallExpression stage(Expression source, String methodName, Expression... arguments) {
        Expression[] all = new Expression[arguments.length + 1];
        all[0] = source;
        for (int i = 0; i < arguments.length; i++) {
            Expression argument = arguments[i];
            all[i + 1] = argument instanceof LambdaExpression ? quote(argument) : argument;
        }
        return call(methodName, all);
    }
}
