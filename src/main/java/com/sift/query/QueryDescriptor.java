package com.sift.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A compiled search: index, query text and the optional sort, projection, limit and geo filter.
 * Instances are immutable; {@link Builder} accumulates state while a call chain is assembled.
 */
public final class QueryDescriptor {

    public static final String MATCH_ALL = "*";

    private final String indexName;
    private final String queryText;
    private final SearchSortBy sortBy;
    private final ReturnFields returnFields;
    private final SearchLimit limit;
    private final GeoFilter geoFilter;

    private QueryDescriptor(Builder builder) {
        this.indexName = builder.indexName;
        this.queryText = builder.queryText;
        this.sortBy = builder.sortBy;
        this.returnFields = builder.returnFields;
        this.limit = builder.limit;
        this.geoFilter = builder.geoFilter;
    }

    public static Builder builder(String indexName) {
        return new Builder(indexName);
    }

    public String getIndexName() {
        return indexName;
    }

    public String getQueryText() {
        return queryText;
    }

    public SearchSortBy getSortBy() {
        return sortBy;
    }

    public ReturnFields getReturnFields() {
        return returnFields;
    }

    public SearchLimit getLimit() {
        return limit;
    }

    public GeoFilter getGeoFilter() {
        return geoFilter;
    }

    /**
     * Argument list of the search command: index, query and any options
     */
    public List<String> serialize() {
        List<String> args = new ArrayList<>();
        args.add(indexName);
        args.add(queryText);
        if (limit != null) {
            args.addAll(limit.serialize());
        }
        if (sortBy != null) {
            args.addAll(sortBy.serialize());
        }
        if (returnFields != null) {
            args.addAll(returnFields.serialize());
        }
        if (geoFilter != null) {
            args.addAll(geoFilter.serialize());
        }
        return args;
    }

    @Override
    public String toString() {
        return String.join(" ", serialize());
    }

    /**
     * Mutable accumulator used while assembling a query
     */
    public static final class Builder {
        private final String indexName;
        private String queryText = MATCH_ALL;
        private SearchSortBy sortBy;
        private ReturnFields returnFields;
        private SearchLimit limit;
        private GeoFilter geoFilter;

        private Builder(String indexName) {
            this.indexName = Objects.requireNonNull(indexName, "indexName");
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public Builder sortBy(SearchSortBy sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder returnFields(ReturnFields returnFields) {
            this.returnFields = returnFields;
            return this;
        }

        public Builder limit(SearchLimit limit) {
            this.limit = limit;
            return this;
        }

        public Builder geoFilter(GeoFilter geoFilter) {
            this.geoFilter = geoFilter;
            return this;
        }

        public SearchLimit getLimit() {
            return limit;
        }

        public QueryDescriptor build() {
            return new QueryDescriptor(this);
        }
    }
}
