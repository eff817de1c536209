package com.sift.aggregation;

import java.util.List;

/**
 * Drops pipeline rows for which the expression is false
 */
public final class FilterStage implements PipelineStage {
    private final String expression;

    public FilterStage(String expression) {
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public List<String> serialize() {
        return List.of("FILTER", expression);
    }

    @Override
    public String toString() {
        return "Filter(" + expression + ")";
    }
}
