package com.sift.aggregation;

import java.util.ArrayList;
import java.util.List;

/**
 * Working stack of pipeline stages. Stages are emitted in push order; peek and
 * pop expose the most recently pushed stage so it can be merged with the next one.
 */
public class PipelineStack {

    private final List<PipelineStage> stages = new ArrayList<>();

    public void push(PipelineStage stage) {
        stages.add(stage);
    }

    /**
     * The most recently pushed stage, or null when empty
     */
    public PipelineStage peek() {
        return stages.isEmpty() ? null : stages.get(stages.size() - 1);
    }

    public PipelineStage pop() {
        if (stages.isEmpty()) {
            throw new IllegalStateException("Pipeline stack is empty");
        }
        return stages.remove(stages.size() - 1);
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    public int size() {
        return stages.size();
    }

    /**
     * Snapshot of the stages in pipeline order
     */
    public List<PipelineStage> toList() {
        return List.copyOf(stages);
    }
}
