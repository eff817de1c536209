package com.sift.aggregation;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups rows by the listed fields. An empty field list groups all rows together.
 */
public final class GroupByStage implements PipelineStage {
    private final List<String> fields;

    public GroupByStage(List<String> fields) {
        this.fields = List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }

    @Override
    public List<String> serialize() {
        List<String> args = new ArrayList<>(fields.size() + 2);
        args.add("GROUPBY");
        args.add(Integer.toString(fields.size()));
        for (String field : fields) {
            args.add("@" + field);
        }
        return args;
    }

    @Override
    public String toString() {
        return "GroupBy" + fields;
    }
}
