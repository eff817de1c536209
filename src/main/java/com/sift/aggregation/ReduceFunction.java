package com.sift.aggregation;

/**
 * Reducer functions of an aggregation group
 */
public enum ReduceFunction {
    AVG,
    STDDEV,
    SUM,
    MIN,
    MAX,
    COUNT,
    COUNT_DISTINCT,
    COUNT_DISTINCTISH,
    TOLIST,
    QUANTILE,
    RANDOM_SAMPLE,
    FIRST_VALUE
}
