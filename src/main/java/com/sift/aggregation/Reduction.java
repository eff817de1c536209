package com.sift.aggregation;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the reducer stages. A reducer collapses each group into a value
 * published under its alias.
 */
public abstract class Reduction implements PipelineStage {
    private final ReduceFunction function;

    protected Reduction(ReduceFunction function) {
        this.function = function;
    }

    public ReduceFunction getFunction() {
        return function;
    }

    /**
     * Reducer arguments following the argument count
     */
    protected abstract List<String> arguments();

    /**
     * Name the reduced value is published under
     */
    public abstract String getAlias();

    @Override
    public List<String> serialize() {
        List<String> arguments = arguments();
        List<String> args = new ArrayList<>(arguments.size() + 5);
        args.add("REDUCE");
        args.add(function.name());
        args.add(Integer.toString(arguments.size()));
        args.addAll(arguments);
        args.add("AS");
        args.add(getAlias());
        return args;
    }

    @Override
    public String toString() {
        return "Reduce(" + function + " " + String.join(" ", arguments()) + ")";
    }
}
