package com.sift.aggregation;

import com.sift.query.SortDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * FIRST_VALUE reducer: the field's value in the first row of the group,
 * optionally ordered by another field
 */
public final class FirstValueReduction extends Reduction {
    private final String field;
    private final String sortField;
    private final SortDirection direction;

    public FirstValueReduction(String field) {
        this(field, null, null);
    }

    public FirstValueReduction(String field, String sortField, SortDirection direction) {
        super(ReduceFunction.FIRST_VALUE);
        this.field = field;
        this.sortField = sortField;
        this.direction = direction;
    }

    public String getField() {
        return field;
    }

    public String getSortField() {
        return sortField;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    protected List<String> arguments() {
        List<String> args = new ArrayList<>(4);
        args.add("@" + field);
        if (sortField != null) {
            args.add("BY");
            args.add("@" + sortField);
            if (direction != null) {
                args.add(direction.getKeyword());
            }
        }
        return args;
    }

    @Override
    public String getAlias() {
        return field + "_" + getFunction().name();
    }
}
