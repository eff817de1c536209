package com.sift.aggregation;

import com.sift.query.SortDirection;

import java.util.List;

/**
 * Sorts the pipeline rows by a field
 */
public final class SortByStage implements PipelineStage {
    private final String field;
    private final SortDirection direction;

    public SortByStage(String field, SortDirection direction) {
        this.field = field;
        this.direction = direction;
    }

    public String getField() {
        return field;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    public List<String> serialize() {
        return List.of("SORTBY", "2", "@" + field, direction.getKeyword());
    }

    @Override
    public String toString() {
        return "SortBy(" + field + " " + direction.getKeyword() + ")";
    }
}
