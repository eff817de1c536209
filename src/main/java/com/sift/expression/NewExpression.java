package com.sift.expression;

import java.util.List;

/**
 * Represents construction of a tuple or record, e.g. a composite group-by key.
 * Members are the declared names of the constructed fields, in declaration order.
 */
public final class NewExpression implements Expression {
    private final List<String> members;

    public NewExpression(List<String> members) {
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    public List<String> getMembers() {
        return members;
    }

    @Override
    public String toString() {
        return "new " + members;
    }
}
