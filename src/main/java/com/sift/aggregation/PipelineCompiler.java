package com.sift.aggregation;

import com.sift.expression.Expression;
import com.sift.expression.LambdaExpression;
import com.sift.expression.MethodCallExpression;
import com.sift.index.DocumentIndex;
import com.sift.query.CallChain;
import com.sift.query.CompilationError;
import com.sift.query.FieldResolver;
import com.sift.query.PredicateCompiler;
import com.sift.query.QueryCompilationException;
import com.sift.query.SearchLimit;
import com.sift.query.SortDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compiles a chain of aggregation-stage calls into an {@link AggregationDescriptor}.
 *
 * The chain is walked from the first chained call to the last, pushing stages onto a
 * {@link PipelineStack}. Two stack rules shape the pipeline:
 * <ul>
 *   <li>consecutive group-bys merge into one, the newer fields first</li>
 *   <li>a reducer not directly preceded by a group-by or a single-field reducer is
 *       followed by an empty group-by, aggregating over all rows</li>
 * </ul>
 * Stage names without a pipeline counterpart are skipped.
 */
public class PipelineCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PipelineCompiler.class);

    private final PredicateCompiler predicateCompiler;
    private final ValueExpressionCompiler valueExpressionCompiler;
    private final FieldResolver fieldResolver;
    private final int defaultPageSize;

    public PipelineCompiler(PredicateCompiler predicateCompiler, ValueExpressionCompiler valueExpressionCompiler,
                            FieldResolver fieldResolver) {
        this(predicateCompiler, valueExpressionCompiler, fieldResolver, SearchLimit.DEFAULT_PAGE_SIZE);
    }

    public PipelineCompiler(PredicateCompiler predicateCompiler, ValueExpressionCompiler valueExpressionCompiler,
                            FieldResolver fieldResolver, int defaultPageSize) {
        this.predicateCompiler = predicateCompiler;
        this.valueExpressionCompiler = valueExpressionCompiler;
        this.fieldResolver = fieldResolver;
        this.defaultPageSize = defaultPageSize;
    }

    /**
     * Compile an aggregation chain
     *
     * @param expression the outermost (last chained) stage call
     * @param index      index declaration of the aggregated document
     * @return the compiled aggregation
     * @throws QueryCompilationException if a stage cannot be compiled
     */
    public AggregationDescriptor compile(Expression expression, DocumentIndex index) {
        if (index == null) {
            throw new QueryCompilationException(CompilationError.MISSING_INDEX_METADATA,
                    "Aggregations can only be performed on document types that declare an index", expression);
        }
        if (!(expression instanceof MethodCallExpression)) {
            return new AggregationDescriptor(index.getIndexName(), null, null, List.of());
        }

        List<MethodCallExpression> calls = CallChain.unwind((MethodCallExpression) expression);
        Compilation compilation = new Compilation(index);
        for (int i = calls.size() - 1; i >= 0; i--) {
            compilation.apply(calls.get(i), i == calls.size() - 1);
        }

        AggregationDescriptor descriptor = new AggregationDescriptor(index.getIndexName(),
                compilation.query, compilation.limit, compilation.stack.toList());
        logger.debug("Compiled aggregation for index {}: {}", index.getIndexName(), descriptor);
        return descriptor;
    }

    /**
     * Working state of one compile call
     */
    private final class Compilation {
        private final DocumentIndex index;
        private final PipelineStack stack = new PipelineStack();
        private QueryStage query;
        private SearchLimit limit;

        private Compilation(DocumentIndex index) {
            this.index = index;
        }

        void apply(MethodCallExpression call, boolean innermost) {
            String stage = CallChain.stageName(call);
            switch (stage) {
                case "Where" -> {
                    LambdaExpression predicate = CallChain.lambdaArgument(call, 1);
                    if (innermost) {
                        query = new QueryStage(predicateCompiler.compile(predicate.getBody(), index));
                    } else {
                        stack.push(new FilterStage(valueExpressionCompiler.compile(predicate.getBody())));
                    }
                }
                case "Filter" -> stack.push(new FilterStage(
                        valueExpressionCompiler.compile(CallChain.lambdaArgument(call, 1).getBody())));
                case "First", "FirstOrDefault" -> limit = limit != null ? limit.withCount(1) : new SearchLimit(0, 1);
                case "Average" -> pushReduction(singleArgument(call, ReduceFunction.AVG));
                case "StandardDeviation" -> pushReduction(singleArgument(call, ReduceFunction.STDDEV));
                case "Sum" -> pushReduction(singleArgument(call, ReduceFunction.SUM));
                case "Min" -> pushReduction(singleArgument(call, ReduceFunction.MIN));
                case "Max" -> pushReduction(singleArgument(call, ReduceFunction.MAX));
                case "CountDistinct" -> pushReduction(singleArgument(call, ReduceFunction.COUNT_DISTINCT));
                case "CountDistinctish" -> pushReduction(singleArgument(call, ReduceFunction.COUNT_DISTINCTISH));
                case "Distinct" -> pushReduction(singleArgument(call, ReduceFunction.TOLIST));
                case "Count", "LongCount" -> pushReduction(new ZeroArgumentReduction(ReduceFunction.COUNT));
                case "Quantile" -> pushReduction(twoArgument(call, ReduceFunction.QUANTILE));
                case "RandomSample" -> pushReduction(twoArgument(call, ReduceFunction.RANDOM_SAMPLE));
                case "FirstValue" -> pushReduction(firstValue(call));
                case "OrderBy" -> stack.push(sortBy(call, SortDirection.ASCENDING));
                case "OrderByDescending" -> stack.push(sortBy(call, SortDirection.DESCENDING));
                case "Take" -> {
                    int count = CallChain.intArgument(call, 1);
                    limit = limit != null ? limit.withCount(count) : new SearchLimit(0, count);
                }
                case "Skip" -> {
                    int offset = CallChain.intArgument(call, 1);
                    limit = limit != null ? limit.withOffset(offset) : new SearchLimit(offset, defaultPageSize);
                }
                case "GroupBy" -> pushGroupBy(fieldResolver.resolveFieldNames(CallChain.argument(call, 1)));
                case "Apply" -> stack.push(translateApply(call));
                default -> logger.debug("Skipping aggregation stage {} with no pipeline counterpart", stage);
            }
        }

        private void pushGroupBy(List<String> fields) {
            if (stack.peek() instanceof GroupByStage) {
                GroupByStage existing = (GroupByStage) stack.pop();
                List<String> merged = new ArrayList<>(fields);
                merged.addAll(existing.getFields());
                stack.push(new GroupByStage(merged));
            } else {
                stack.push(new GroupByStage(fields));
            }
        }

        private void pushReduction(Reduction reduction) {
            PipelineStage previous = stack.peek();
            boolean groupAll = !(previous instanceof GroupByStage) && !(previous instanceof SingleArgumentReduction);
            stack.push(reduction);
            if (groupAll) {
                stack.push(new GroupByStage(List.of()));
            }
        }
    }

    private SingleArgumentReduction singleArgument(MethodCallExpression call, ReduceFunction function) {
        return new SingleArgumentReduction(function, fieldResolver.resolveFieldName(CallChain.argument(call, 1)));
    }

    private TwoArgumentReduction twoArgument(MethodCallExpression call, ReduceFunction function) {
        String field = fieldResolver.resolveFieldName(CallChain.argument(call, 1));
        Object parameter = CallChain.constantArgument(call, 2);
        if (!(parameter instanceof Number)) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    call.getMethodName() + " expects a numeric parameter", call);
        }
        return new TwoArgumentReduction(function, field, (Number) parameter);
    }

    private FirstValueReduction firstValue(MethodCallExpression call) {
        String field = fieldResolver.resolveFieldName(CallChain.argument(call, 1));
        if (!CallChain.hasArgument(call, 2)) {
            return new FirstValueReduction(field);
        }
        String sortField = fieldResolver.resolveFieldName(CallChain.argument(call, 2));
        SortDirection direction = CallChain.hasArgument(call, 3)
                ? sortDirection(CallChain.constantArgument(call, 3), call)
                : null;
        return new FirstValueReduction(field, sortField, direction);
    }

    private SortByStage sortBy(MethodCallExpression call, SortDirection direction) {
        return new SortByStage(fieldResolver.resolveFieldName(CallChain.argument(call, 1)), direction);
    }

    private ApplyStage translateApply(MethodCallExpression call) {
        String expression = valueExpressionCompiler.compile(CallChain.lambdaArgument(call, 1).getBody());
        Object alias = CallChain.constantArgument(call, 2);
        if (alias == null || alias.toString().isBlank()) {
            throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                    "Apply requires an alias", call);
        }
        return new ApplyStage(expression, alias.toString());
    }

    private static SortDirection sortDirection(Object value, MethodCallExpression call) {
        if (value instanceof SortDirection) {
            return (SortDirection) value;
        }
        String text = String.valueOf(value).toUpperCase(Locale.ROOT);
        for (SortDirection direction : SortDirection.values()) {
            if (direction.name().equals(text) || direction.getKeyword().equals(text)) {
                return direction;
            }
        }
        throw new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT,
                "Unknown sort direction " + value, call);
    }
}
