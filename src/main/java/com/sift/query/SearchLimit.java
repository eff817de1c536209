package com.sift.query;

import java.util.List;
import java.util.Objects;

/**
 * Offset/count window over a result set
 */
public final class SearchLimit {

    /** Count used when a skip is requested without a take */
    public static final int DEFAULT_PAGE_SIZE = 100;

    private final int offset;
    private final int count;

    public SearchLimit(int offset, int count) {
        this.offset = offset;
        this.count = count;
    }

    public int getOffset() {
        return offset;
    }

    public int getCount() {
        return count;
    }

    public SearchLimit withOffset(int newOffset) {
        return new SearchLimit(newOffset, count);
    }

    public SearchLimit withCount(int newCount) {
        return new SearchLimit(offset, newCount);
    }

    public List<String> serialize() {
        return List.of("LIMIT", Integer.toString(offset), Integer.toString(count));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchLimit)) return false;
        SearchLimit that = (SearchLimit) o;
        return offset == that.offset && count == that.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, count);
    }

    @Override
    public String toString() {
        return "LIMIT " + offset + " " + count;
    }
}
