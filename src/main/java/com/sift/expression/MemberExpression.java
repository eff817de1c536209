package com.sift.expression;

import java.util.Objects;

/**
 * Represents a reference to a field of the document being queried
 */
public final class MemberExpression implements Expression {
    private final String name;

    public MemberExpression(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "x." + name;
    }
}
