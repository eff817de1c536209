package com.sift.aggregation;

import java.util.List;

/**
 * Search query selecting the documents that enter the pipeline
 */
public final class QueryStage implements PipelineStage {
    private final String expression;

    public QueryStage(String expression) {
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public List<String> serialize() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return "Query(" + expression + ")";
    }
}
