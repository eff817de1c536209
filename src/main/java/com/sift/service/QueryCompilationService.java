package com.sift.service;

import com.sift.aggregation.AggregationDescriptor;
import com.sift.aggregation.PipelineCompiler;
import com.sift.expression.Expression;
import com.sift.index.DocumentIndex;
import com.sift.index.IndexRegistry;
import com.sift.query.QueryAssembler;
import com.sift.query.QueryCompilationException;
import com.sift.query.QueryDescriptor;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for compiling query and aggregation call chains against registered indexes.
 *
 * Resolves the index declaration of the target document type, delegates to the
 * compilers, and records compile metrics. Compilation failures are logged and
 * rethrown unchanged; no partial result is ever returned.
 */
@Service
public class QueryCompilationService {

    private static final Logger logger = LoggerFactory.getLogger(QueryCompilationService.class);

    private final IndexRegistry indexRegistry;
    private final QueryAssembler queryAssembler;
    private final PipelineCompiler pipelineCompiler;
    private final CompilerMetrics metrics;

    public QueryCompilationService(IndexRegistry indexRegistry, QueryAssembler queryAssembler,
                                   PipelineCompiler pipelineCompiler, CompilerMetrics metrics) {
        this.indexRegistry = indexRegistry;
        this.queryAssembler = queryAssembler;
        this.pipelineCompiler = pipelineCompiler;
        this.metrics = metrics;
    }

    /**
     * Compile a query chain against the index of a document type
     *
     * @param documentType the queried document type
     * @param expression   outermost call of the chain, or a filter lambda
     * @return the compiled query
     * @throws QueryCompilationException if the type is not indexed or the chain cannot be compiled
     */
    public QueryDescriptor compileQuery(String documentType, Expression expression) {
        Timer.Sample sample = metrics.startTimer();
        try {
            QueryDescriptor query = queryAssembler.assemble(expression, findIndex(documentType));
            metrics.recordQueryCompiled();
            logger.debug("Compiled query for {}: {}", documentType, query.getQueryText());
            return query;
        } catch (QueryCompilationException e) {
            metrics.recordFailure(e.getError());
            logger.warn("Failed to compile query for {}: {}", documentType, e.getMessage());
            throw e;
        } finally {
            metrics.recordQueryLatency(sample);
        }
    }

    /**
     * Compile an aggregation chain against the index of a document type
     *
     * @param documentType the aggregated document type
     * @param expression   outermost stage call of the chain
     * @return the compiled aggregation
     * @throws QueryCompilationException if the type is not indexed or a stage cannot be compiled
     */
    public AggregationDescriptor compileAggregation(String documentType, Expression expression) {
        Timer.Sample sample = metrics.startTimer();
        try {
            AggregationDescriptor aggregation = pipelineCompiler.compile(expression, findIndex(documentType));
            metrics.recordAggregationCompiled();
            logger.debug("Compiled aggregation for {} with {} stages", documentType, aggregation.getStages().size());
            return aggregation;
        } catch (QueryCompilationException e) {
            metrics.recordFailure(e.getError());
            logger.warn("Failed to compile aggregation for {}: {}", documentType, e.getMessage());
            throw e;
        } finally {
            metrics.recordAggregationLatency(sample);
        }
    }

    private DocumentIndex findIndex(String documentType) {
        return indexRegistry.find(documentType).orElse(null);
    }
}
