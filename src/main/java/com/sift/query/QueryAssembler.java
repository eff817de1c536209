package com.sift.query;

import com.sift.expression.Expression;
import com.sift.expression.LambdaExpression;
import com.sift.expression.MemberExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.expression.NewExpression;
import com.sift.index.DocumentIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Assembles a chain of query-stage calls (Where, OrderBy, Select, Take, Skip,
 * First, Any, GeoFilter) into a {@link QueryDescriptor}
 */
public class QueryAssembler {

    private static final Logger logger = LoggerFactory.getLogger(QueryAssembler.class);

    private final PredicateCompiler predicateCompiler;
    private final FieldResolver fieldResolver;
    private final MethodCallTranslator methodCallTranslator;
    private final int defaultPageSize;

    public QueryAssembler(PredicateCompiler predicateCompiler, FieldResolver fieldResolver,
                          MethodCallTranslator methodCallTranslator) {
        this(predicateCompiler, fieldResolver, methodCallTranslator, SearchLimit.DEFAULT_PAGE_SIZE);
    }

    public QueryAssembler(PredicateCompiler predicateCompiler, FieldResolver fieldResolver,
                          MethodCallTranslator methodCallTranslator, int defaultPageSize) {
        this.predicateCompiler = predicateCompiler;
        this.fieldResolver = fieldResolver;
        this.methodCallTranslator = methodCallTranslator;
        this.defaultPageSize = defaultPageSize;
    }

    /**
     * Assemble a query from the outermost call of a chain, or from a bare filter lambda
     *
     * @param expression the chain
     * @param index      index declaration of the queried document
     * @return the compiled query
     * @throws QueryCompilationException if the chain cannot be compiled
     */
    public QueryDescriptor assemble(Expression expression, DocumentIndex index) {
        if (index == null) {
            throw new QueryCompilationException(CompilationError.MISSING_INDEX_METADATA,
                    "Searches can only be performed on document types that declare an index", expression);
        }

        QueryDescriptor.Builder query = QueryDescriptor.builder(index.getIndexName());
        if (expression instanceof MethodCallExpression) {
            // applied in chained order from the outermost call inwards
            for (MethodCallExpression call : CallChain.unwind((MethodCallExpression) expression)) {
                applyStage(query, call, index);
            }
        } else if (expression instanceof LambdaExpression) {
            query.queryText(predicateCompiler.compile(((LambdaExpression) expression).getBody(), index));
        }

        QueryDescriptor descriptor = query.build();
        logger.debug("Assembled query for index {}: {}", index.getIndexName(), descriptor);
        return descriptor;
    }

    private void applyStage(QueryDescriptor.Builder query, MethodCallExpression call, DocumentIndex index) {
        String stage = CallChain.stageName(call);
        switch (stage) {
            case "Where" -> query.queryText(compilePredicateArgument(call, index));
            case "OrderBy" -> query.sortBy(translateOrderBy(call, SortDirection.ASCENDING));
            case "OrderByDescending" -> query.sortBy(translateOrderBy(call, SortDirection.DESCENDING));
            case "Select" -> query.returnFields(translateSelect(call));
            case "Take" -> {
                SearchLimit limit = query.getLimit() != null ? query.getLimit() : new SearchLimit(0, 0);
                query.limit(limit.withCount(CallChain.intArgument(call, 1)));
            }
            case "Skip" -> {
                SearchLimit limit = query.getLimit() != null ? query.getLimit() : new SearchLimit(0, defaultPageSize);
                query.limit(limit.withOffset(CallChain.intArgument(call, 1)));
            }
            case "First", "FirstOrDefault", "Any" -> {
                SearchLimit limit = query.getLimit() != null ? query.getLimit() : new SearchLimit(0, 1);
                query.limit(limit.withCount(1));
                if (CallChain.hasArgument(call, 1)) {
                    query.queryText(compilePredicateArgument(call, index));
                }
            }
            case "GeoFilter" -> query.geoFilter(methodCallTranslator.translateGeoFilter(call));
            default -> throw new QueryCompilationException(CompilationError.UNSUPPORTED_OPERATOR,
                    "Query stage " + stage + " is not supported", call);
        }
    }

    private String compilePredicateArgument(MethodCallExpression call, DocumentIndex index) {
        return predicateCompiler.compile(CallChain.lambdaArgument(call, 1).getBody(), index);
    }

    private SearchSortBy translateOrderBy(MethodCallExpression call, SortDirection direction) {
        return new SearchSortBy(fieldResolver.resolveFieldName(CallChain.argument(call, 1)), direction);
    }

    private ReturnFields translateSelect(MethodCallExpression call) {
        LambdaExpression projection = CallChain.lambdaArgument(call, 1);
        Expression body = projection.getBody();
        if (body instanceof MemberExpression) {
            return new ReturnFields(List.of(((MemberExpression) body).getName()));
        }
        if (!projection.getResultShape().isEmpty()) {
            return new ReturnFields(projection.getResultShape());
        }
        if (body instanceof NewExpression) {
            return new ReturnFields(((NewExpression) body).getMembers());
        }
        throw new QueryCompilationException(CompilationError.UNRESOLVABLE_FIELD_REFERENCE,
                "Projection declares no result fields", call);
    }
}
