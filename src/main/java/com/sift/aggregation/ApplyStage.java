package com.sift.aggregation;

import java.util.List;

/**
 * Computes a new value per row and publishes it under an alias
 */
public final class ApplyStage implements PipelineStage {
    private final String expression;
    private final String alias;

    public ApplyStage(String expression, String alias) {
        this.expression = expression;
        this.alias = alias;
    }

    public String getExpression() {
        return expression;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public List<String> serialize() {
        return List.of("APPLY", expression, "AS", alias);
    }

    @Override
    public String toString() {
        return "Apply(" + expression + " AS " + alias + ")";
    }
}
