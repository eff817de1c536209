package com.sift.aggregation;

import java.util.List;

/**
 * One step of an aggregation pipeline, executed by the engine in pipeline order
 */
public interface PipelineStage {

    /**
     * Engine argument list of this stage, e.g. {@code GROUPBY 1 @city}
     */
    List<String> serialize();
}
