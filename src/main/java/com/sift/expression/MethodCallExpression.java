package com.sift.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Represents a method call. The receiver of an instance call, or the previous
 * stage of a chained query call, is always the first argument.
 */
public final class MethodCallExpression implements Expression {
    private final String methodName;
    private final List<Expression> arguments;

    public MethodCallExpression(String methodName, List<Expression> arguments) {
        this.methodName = Objects.requireNonNull(methodName, "methodName");
        this.arguments = List.copyOf(arguments);
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    public Expression getArgument(int index) {
        return arguments.get(index);
    }

    @Override
    public String toString() {
        return methodName + arguments.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
