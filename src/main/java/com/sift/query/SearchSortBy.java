package com.sift.query;

import java.util.List;

/**
 * Sort applied to search results
 */
public final class SearchSortBy {
    private final String field;
    private final SortDirection direction;

    public SearchSortBy(String field, SortDirection direction) {
        this.field = field;
        this.direction = direction;
    }

    public String getField() {
        return field;
    }

    public SortDirection getDirection() {
        return direction;
    }

    public List<String> serialize() {
        return List.of("SORTBY", field, direction.getKeyword());
    }
}
