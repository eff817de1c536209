package com.sift.query;

import com.sift.expression.ConstantExpression;
import com.sift.expression.Expression;
import com.sift.expression.ExpressionType;
import com.sift.expression.MemberExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.index.DocumentIndex;
import com.sift.index.FieldKind;
import com.sift.index.FieldMetadata;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates the method calls allowed inside a filter into search query fragments.
 *
 * Supported calls (receiver first):
 * <ul>
 *   <li>{@code Contains(field, value)}: text match on TEXT fields, tag match on TAG fields</li>
 *   <li>{@code Contains(values, field)}: membership of the field in a constant list</li>
 *   <li>{@code StartsWith(field, value)} / {@code EndsWith(field, value)}: prefix and suffix matches</li>
 *   <li>{@code Equals(field, value)}: same as {@code ==}</li>
 *   <li>{@code GeoFilter(source, field, lon, lat, radius, unit)}: radius search on GEO fields</li>
 * </ul>
 */
@Component
public class MethodCallTranslator {

    private final FieldResolver fieldResolver;
    private final Map<String, CallTranslation> translations;

    public MethodCallTranslator(FieldResolver fieldResolver) {
        this.fieldResolver = fieldResolver;
        Map<String, CallTranslation> table = new HashMap<>();
        table.put("Contains", this::translateContains);
        table.put("StartsWith", (call, index) -> translateAffix(call, index, true));
        table.put("EndsWith", (call, index) -> translateAffix(call, index, false));
        table.put("Equals", this::translateEquals);
        table.put("GeoFilter", this::translateGeoFilterPredicate);
        this.translations = Map.copyOf(table);
    }

    /**
     * Translate a method call into query text
     *
     * @param call  the call
     * @param index index declaration of the queried document
     * @return the query fragment
     * @throws QueryCompilationException UNSUPPORTED_OPERATOR if the method is not supported
     */
    public String translate(MethodCallExpression call, DocumentIndex index) {
        CallTranslation translation = translations.get(call.getMethodName());
        if (translation == null) {
            throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "Method " + call.getMethodName() + " is not supported in search queries", call);
        }
        return translation.translate(call, index);
    }

    /**
     * Read a {@code GeoFilter(source, field, lon, lat, radius, unit)} call
     */
    public GeoFilter translateGeoFilter(MethodCallExpression call) {
        String field = fieldResolver.resolveFieldName(CallChain.argument(call, 1));
        double longitude = CallChain.doubleArgument(call, 2);
        double latitude = CallChain.doubleArgument(call, 3);
        double radius = CallChain.doubleArgument(call, 4);
        GeoUnit unit;
        try {
            unit = GeoUnit.from(CallChain.constantArgument(call, 5));
        } catch (IllegalArgumentException e) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    "Unknown geo distance unit", call, e);
        }
        return new GeoFilter(field, longitude, latitude, radius, unit);
    }

    private String translateGeoFilterPredicate(MethodCallExpression call, DocumentIndex index) {
        GeoFilter geoFilter = translateGeoFilter(call);
        FieldMetadata field = QuerySyntax.requireSearchable(index, geoFilter.getField());
        if (field.getEffectiveKind() != FieldKind.GEO) {
            throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "GeoFilter requires a GEO field, " + field.getName() + " is " + field.getEffectiveKind(), call);
        }
        return geoFilter.toQueryText();
    }

    private String translateContains(MethodCallExpression call, DocumentIndex index) {
        Expression receiver = CallChain.argument(call, 0);
        Expression argument = CallChain.argument(call, 1);

        if (receiver instanceof MemberExpression) {
            FieldMetadata field = QuerySyntax.requireSearchable(index, ((MemberExpression) receiver).getName());
            String value = QuerySyntax.literal(CallChain.constantArgument(call, 1));
            return switch (field.getEffectiveKind()) {
                case TEXT -> "@" + field.getName() + ":" + value;
                case TAG -> "@" + field.getName() + ":{" + QuerySyntax.escapeTag(value) + "}";
                default -> throw unsupportedKind(field, call);
            };
        }

        if (receiver instanceof ConstantExpression && argument instanceof MemberExpression) {
            FieldMetadata field = QuerySyntax.requireSearchable(index, ((MemberExpression) argument).getName());
            return translateMembership(field, ((ConstantExpression) receiver).getValue(), call);
        }

        throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                "Contains must be called on a field or on a constant list of values", call);
    }

    private String translateMembership(FieldMetadata field, Object values, MethodCallExpression call) {
        List<String> literals = toLiterals(values, call);
        if (literals.isEmpty()) {
            throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                    "Membership test against an empty list", call);
        }

        String name = "@" + field.getName();
        return switch (field.getEffectiveKind()) {
            case TAG -> literals.stream()
                    .map(QuerySyntax::escapeTag)
                    .collect(Collectors.joining("|", name + ":{", "}"));
            case NUMERIC -> literals.stream()
                    .map(v -> name + ":[" + v + " " + v + "]")
                    .collect(Collectors.joining("|", "(", ")"));
            case TEXT -> literals.stream()
                    .collect(Collectors.joining("|", name + ":(", ")"));
            default -> throw unsupportedKind(field, call);
        };
    }

    private List<String> toLiterals(Object values, MethodCallExpression call) {
        List<String> literals = new ArrayList<>();
        if (values instanceof Collection<?>) {
            for (Object value : (Collection<?>) values) {
                literals.add(QuerySyntax.literal(value));
            }
        } else if (values != null && values.getClass().isArray()) {
            int length = Array.getLength(values);
            for (int i = 0; i < length; i++) {
                literals.add(QuerySyntax.literal(Array.get(values, i)));
            }
        } else {
            throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                    "Contains on a constant requires a collection or array", call);
        }
        return literals;
    }

    private String translateAffix(MethodCallExpression call, DocumentIndex index, boolean prefix) {
        Expression receiver = CallChain.argument(call, 0);
        if (!(receiver instanceof MemberExpression)) {
            throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                    call.getMethodName() + " must be called on a field", call);
        }

        FieldMetadata field = QuerySyntax.requireSearchable(index, ((MemberExpression) receiver).getName());
        String value = QuerySyntax.literal(CallChain.constantArgument(call, 1));
        return switch (field.getEffectiveKind()) {
            case TEXT -> "@" + field.getName() + ":" + (prefix ? value + "*" : "*" + value);
            case TAG -> {
                String escaped = QuerySyntax.escapeTag(value);
                yield "@" + field.getName() + ":{" + (prefix ? escaped + "*" : "*" + escaped) + "}";
            }
            default -> throw unsupportedKind(field, call);
        };
    }

    private String translateEquals(MethodCallExpression call, DocumentIndex index) {
        Expression receiver = CallChain.argument(call, 0);
        if (!(receiver instanceof MemberExpression)) {
            throw new QueryCompilationException(CompilationError.INVALID_FILTER_SHAPE,
                    "Equals must be called on a field", call);
        }
        FieldMetadata field = QuerySyntax.requireSearchable(index, ((MemberExpression) receiver).getName());
        String value = QuerySyntax.literal(CallChain.constantArgument(call, 1));
        return QuerySyntax.comparison(ExpressionType.EQUAL, field, value);
    }

    private QueryCompilationException unsupportedKind(FieldMetadata field, MethodCallExpression call) {
        return new QueryCompilationException(CompilationError.UNSUPPORTED_FIELD_KIND_FOR_EQUALITY,
                call.getMethodName() + " is not supported on " + field.getEffectiveKind() + " field "
                        + field.getName(), call);
    }

    @FunctionalInterface
    private interface CallTranslation {
        String translate(MethodCallExpression call, DocumentIndex index);
    }
}
