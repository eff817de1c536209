package com.sift.index;

import java.util.Objects;

/**
 * Index metadata for a single document field
 */
public class FieldMetadata {
    private final String name;
    private final FieldKind kind;
    private final boolean numericValue;
    private final boolean searchable;

    public FieldMetadata(String name, FieldKind kind, boolean numericValue, boolean searchable) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.numericValue = numericValue;
        this.searchable = searchable;
    }

    public static FieldMetadata of(String name, FieldKind kind) {
        return new FieldMetadata(name, kind, kind == FieldKind.NUMERIC, true);
    }

    public static FieldMetadata indexed(String name, boolean numericValue) {
        return new FieldMetadata(name, FieldKind.INDEXED, numericValue, true);
    }

    public static FieldMetadata notSearchable(String name) {
        return new FieldMetadata(name, FieldKind.TAG, false, false);
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    public boolean isNumericValue() {
        return numericValue;
    }

    public boolean isSearchable() {
        return searchable;
    }

    /**
     * The kind used for query generation. INDEXED fields become NUMERIC when
     * their value type is numeric and TAG otherwise.
     */
    public FieldKind getEffectiveKind() {
        if (kind != FieldKind.INDEXED) {
            return kind;
        }
        return numericValue ? FieldKind.NUMERIC : FieldKind.TAG;
    }

    @Override
    public String toString() {
        return name + ":" + kind + (searchable ? "" : "(not searchable)");
    }
}
