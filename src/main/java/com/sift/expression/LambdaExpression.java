package com.sift.expression;

import java.util.List;
import java.util.Objects;

/**
 * Represents a single-parameter lambda over the queried document.
 * The result shape lists the property names of the value the lambda produces,
 * which projections use when the body is not a plain member reference.
 */
public final class LambdaExpression implements Expression {
    private final Expression body;
    private final List<String> resultShape;

    public LambdaExpression(Expression body) {
        this(body, List.of());
    }

    public LambdaExpression(Expression body, List<String> resultShape) {
        this.body = Objects.requireNonNull(body, "body");
        this.resultShape = List.copyOf(resultShape);
    }

    public Expression getBody() {
        return body;
    }

    public List<String> getResultShape() {
        return resultShape;
    }

    @Override
    public String toString() {
        return "x => " + body;
    }
}
