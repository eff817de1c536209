package com.sift.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Projection of a search: the fields returned for each hit
 */
public final class ReturnFields {
    private final List<String> fields;

    public ReturnFields(List<String> fields) {
        this.fields = List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }

    public List<String> serialize() {
        List<String> args = new ArrayList<>(fields.size() + 2);
        args.add("RETURN");
        args.add(Integer.toString(fields.size()));
        args.addAll(fields);
        return args;
    }
}
