package com.sift.query;

/**
 * Sort order of a search or aggregation sort
 */
public enum SortDirection {
    ASCENDING("ASC"),
    DESCENDING("DESC");

    private final String keyword;

    SortDirection(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
