package com.sift.aggregation;

import com.sift.query.QuerySyntax;

import java.util.List;

/**
 * Reducer over a field plus a numeric parameter: QUANTILE (the quantile) or RANDOM_SAMPLE (the sample size)
 */
public final class TwoArgumentReduction extends Reduction {
    private final String field;
    private final Number parameter;

    public TwoArgumentReduction(ReduceFunction function, String field, Number parameter) {
        super(function);
        this.field = field;
        this.parameter = parameter;
    }

    public String getField() {
        return field;
    }

    public Number getParameter() {
        return parameter;
    }

    @Override
    protected List<String> arguments() {
        return List.of("@" + field, QuerySyntax.literal(parameter));
    }

    @Override
    public String getAlias() {
        return field + "_" + getFunction().name();
    }
}
