package com.sift.query;

/**
 * Classifies why an expression could not be compiled
 */
public enum CompilationError {
    /** The queried document type carries no index declaration */
    MISSING_INDEX_METADATA,
    /** A field-name position holds an expression shape that names no field */
    UNRESOLVABLE_FIELD_REFERENCE,
    /** The field has no searchable index metadata */
    FIELD_NOT_SEARCHABLE,
    /** The field's kind does not support equality predicates */
    UNSUPPORTED_FIELD_KIND_FOR_EQUALITY,
    /** A comparison is not rooted at a field reference */
    INVALID_FILTER_SHAPE,
    /** Operator, method or stage outside the supported grammar */
    UNSUPPORTED_OPERATOR,
    /** A binary operator appears where only AND/OR may combine predicates */
    UNKNOWN_SEPARATOR,
    /** A stage call's arguments do not have the shape the stage needs */
    INVALID_STAGE_ARGUMENT
}
