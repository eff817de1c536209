package com.sift.query;

import com.sift.expression.ExpressionType;
import com.sift.index.DocumentIndex;
import com.sift.index.FieldKind;
import com.sift.index.FieldMetadata;

import java.math.BigDecimal;

/**
 * Rendering rules of the search query grammar shared by the predicate compiler
 * and the method call translators
 */
public final class QuerySyntax {

    /**
     * Characters that must be backslash-escaped inside a tag literal
     */
    private static final String TAG_ESCAPE_CHARS = ",.<>{}[]\"':;!@#$%^&*()-+=~| ";

    private QuerySyntax() {
    }

    /**
     * Escape a tag literal so that every reserved character is preceded by a backslash
     */
    public static String escapeTag(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (TAG_ESCAPE_CHARS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Render a constant the way the engine expects it in query text
     */
    public static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return value.toString();
            }
            // shortest decimal form of the boxed type, 0.1f renders as 0.1
            return plainNumber(new BigDecimal(value.toString()));
        }
        if (value instanceof BigDecimal) {
            return plainNumber((BigDecimal) value);
        }
        if (value instanceof Enum<?>) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    private static String plainNumber(BigDecimal number) {
        if (number.signum() == 0) {
            return "0";
        }
        return number.stripTrailingZeros().toPlainString();
    }

    /**
     * Look up the metadata of a field that a predicate filters on
     *
     * @throws QueryCompilationException FIELD_NOT_SEARCHABLE if the field is unknown or not searchable
     */
    public static FieldMetadata requireSearchable(DocumentIndex index, String fieldName) {
        FieldMetadata field = index.findField(fieldName).orElse(null);
        if (field == null || !field.isSearchable()) {
            throw new QueryCompilationException(CompilationError.FIELD_NOT_SEARCHABLE,
                    "Searches can only be performed on fields declared searchable in index "
                            + index.getIndexName(), fieldName);
        }
        return field;
    }

    /**
     * Render a field-rooted comparison, e.g. {@code @age:[(21 inf]} or {@code -@tag:{a\ b}}
     *
     * @param operator comparison operator
     * @param field    metadata of the compared field
     * @param value    rendered right-hand side
     */
    public static String comparison(ExpressionType operator, FieldMetadata field, String value) {
        String left = "@" + field.getName();
        return switch (operator) {
            case GREATER_THAN -> left + ":[(" + value + " inf]";
            case LESS_THAN -> left + ":[-inf (" + value + "]";
            case GREATER_THAN_OR_EQUAL -> left + ":[" + value + " inf]";
            case LESS_THAN_OR_EQUAL -> left + ":[-inf " + value + "]";
            case EQUAL -> equality(field, value, false);
            case NOT_EQUAL -> equality(field, value, true);
            default -> throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "Operator " + operator + " cannot compare a field in a search query", field.getName());
        };
    }

    private static String equality(FieldMetadata field, String value, boolean negated) {
        StringBuilder sb = new StringBuilder();
        if (negated) {
            sb.append('-');
        }
        sb.append('@').append(field.getName()).append(':');

        FieldKind kind = field.getEffectiveKind();
        switch (kind) {
            case TAG -> sb.append('{').append(escapeTag(value)).append('}');
            case TEXT -> sb.append('"').append(value).append('"');
            case NUMERIC -> sb.append('[').append(value).append(' ').append(value).append(']');
            default -> throw new QueryCompilationException(CompilationError.UNSUPPORTED_FIELD_KIND_FOR_EQUALITY,
                    "Equality searches are only supported for tag, text and numeric fields, not " + kind,
                    field.getName());
        }
        return sb.toString();
    }
}
