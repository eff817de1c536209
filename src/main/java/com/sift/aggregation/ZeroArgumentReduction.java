package com.sift.aggregation;

import java.util.List;

/**
 * Reducer without arguments (COUNT)
 */
public final class ZeroArgumentReduction extends Reduction {

    public ZeroArgumentReduction(ReduceFunction function) {
        super(function);
    }

    @Override
    protected List<String> arguments() {
        return List.of();
    }

    @Override
    public String getAlias() {
        return getFunction().name();
    }
}
