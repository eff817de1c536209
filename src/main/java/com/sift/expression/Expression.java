package com.sift.expression;

/**
 * A node of a query expression tree.
 * The node set is closed: compilers dispatch over exactly these shapes and
 * reject anything they cannot translate.
 */
public sealed interface Expression
        permits BinaryExpression, UnaryExpression, MemberExpression, ConstantExpression,
                MethodCallExpression, LambdaExpression, NewExpression {
}
