package com.sift.aggregation;

import java.util.List;

/**
 * Reducer over one field, e.g. AVG, SUM, COUNT_DISTINCT
 */
public final class SingleArgumentReduction extends Reduction {
    private final String field;

    public SingleArgumentReduction(ReduceFunction function, String field) {
        super(function);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    protected List<String> arguments() {
        return List.of("@" + field);
    }

    @Override
    public String getAlias() {
        return field + "_" + getFunction().name();
    }
}
