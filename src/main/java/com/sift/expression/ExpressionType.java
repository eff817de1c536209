package com.sift.expression;

/**
 * Operators carried by binary and unary expression nodes
 */
public enum ExpressionType {
    GREATER_THAN(">", Category.COMPARISON),
    LESS_THAN("<", Category.COMPARISON),
    GREATER_THAN_OR_EQUAL(">=", Category.COMPARISON),
    LESS_THAN_OR_EQUAL("<=", Category.COMPARISON),
    EQUAL("==", Category.COMPARISON),
    NOT_EQUAL("!=", Category.COMPARISON),
    AND_ALSO("&&", Category.LOGICAL),
    OR_ELSE("||", Category.LOGICAL),
    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    MODULO("%", Category.ARITHMETIC),
    POWER("^", Category.ARITHMETIC),
    NOT("!", Category.UNARY),
    NEGATE("-", Category.UNARY),
    CONVERT("", Category.UNARY),
    QUOTE("", Category.UNARY);

    private final String symbol;
    private final Category category;

    ExpressionType(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isBinary() {
        return category != Category.UNARY;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    public boolean isLogical() {
        return category == Category.LOGICAL;
    }

    private enum Category {
        COMPARISON,
        LOGICAL,
        ARITHMETIC,
        UNARY
    }
}
