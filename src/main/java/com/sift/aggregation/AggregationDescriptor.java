package com.sift.aggregation;

import com.sift.query.QueryDescriptor;
import com.sift.query.SearchLimit;

import java.util.ArrayList;
import java.util.List;

/**
 * A compiled aggregation: index, optional query and limit, and the ordered pipeline stages
 */
public final class AggregationDescriptor {
    private final String indexName;
    private final QueryStage query;
    private final SearchLimit limit;
    private final List<PipelineStage> stages;

    public AggregationDescriptor(String indexName, QueryStage query, SearchLimit limit, List<PipelineStage> stages) {
        this.indexName = indexName;
        this.query = query;
        this.limit = limit;
        this.stages = List.copyOf(stages);
    }

    public String getIndexName() {
        return indexName;
    }

    public QueryStage getQuery() {
        return query;
    }

    public SearchLimit getLimit() {
        return limit;
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    /**
     * Argument list of the aggregate command: index, query, stages in pipeline order, then the limit.
     * An empty group-by that follows a reducer is emitted before that reducer.
     */
    public List<String> serialize() {
        List<String> args = new ArrayList<>();
        args.add(indexName);
        args.add(query != null ? query.getExpression() : QueryDescriptor.MATCH_ALL);
        for (int i = 0; i < stages.size(); i++) {
            PipelineStage stage = stages.get(i);
            PipelineStage next = i + 1 < stages.size() ? stages.get(i + 1) : null;
            // an all-rows group is listed after its reducer but is sent ahead of it
            if (stage instanceof Reduction && isGroupAll(next)) {
                args.addAll(next.serialize());
                args.addAll(stage.serialize());
                i++;
            } else {
                args.addAll(stage.serialize());
            }
        }
        if (limit != null) {
            args.addAll(limit.serialize());
        }
        return args;
    }

    private static boolean isGroupAll(PipelineStage stage) {
        return stage instanceof GroupByStage && ((GroupByStage) stage).getFields().isEmpty();
    }

    @Override
    public String toString() {
        return String.join(" ", serialize());
    }
}
