package com.sift.index;

/**
 * Declared classification of an indexed field; controls which predicate syntax the field accepts
 */
public enum FieldKind {
    TAG,
    TEXT,
    NUMERIC,
    GEO,
    /** Deferred: resolved to NUMERIC or TAG from the field's value type */
    INDEXED
}
