package com.sift.service;

import com.sift.TestIndexes;
import com.sift.aggregation.AggregationDescriptor;
import com.sift.aggregation.PipelineCompiler;
import com.sift.expression.Expression;
import com.sift.index.IndexRegistry;
import com.sift.query.CompilationError;
import com.sift.query.QueryAssembler;
import com.sift.query.QueryCompilationException;
import com.sift.query.QueryDescriptor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.sift.expression.Expressions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueryCompilationService
 */
@ExtendWith(MockitoExtension.class)
class QueryCompilationServiceTest {

    @Mock
    private QueryAssembler queryAssembler;

    @Mock
    private PipelineCompiler pipelineCompiler;

    private IndexRegistry indexRegistry;
    private SimpleMeterRegistry meterRegistry;
    private CompilerMetrics metrics;
    private QueryCompilationService service;

    @BeforeEach
    void setUp() {
        indexRegistry = new IndexRegistry();
        indexRegistry.register(TestIndexes.person());
        meterRegistry = new SimpleMeterRegistry();
        metrics = new CompilerMetrics(meterRegistry);
        metrics.init();
        service = new QueryCompilationService(indexRegistry, queryAssembler, pipelineCompiler, metrics);
    }

    @Test
    void testCompileQuery_WithRegisteredType_ShouldDelegateWithIndex() {
        // Given: The assembler returns a query for the Person index
        Expression filter = lambda(greaterThan(member("Age"), constant(21)));
        QueryDescriptor expected = QueryDescriptor.builder("person-idx").queryText("(@Age:[(21 inf])").build();
        when(queryAssembler.assemble(eq(filter), any())).thenReturn(expected);

        // When: Compiling the query
        QueryDescriptor query = service.compileQuery("Person", filter);

        // Then: The registered index is passed through and the compile is counted
        assertThat(query).isSameAs(expected);
        verify(queryAssembler).assemble(filter, indexRegistry.find("Person").orElseThrow());
        assertThat(metrics.getQueriesCompiled().count()).isEqualTo(1.0);
        assertThat(metrics.getQueryCompileLatency().count()).isEqualTo(1L);
    }

    @Test
    void testCompileQuery_WithUnregisteredType_ShouldPassNullIndex() {
        // Given: The assembler rejects a missing index
        Expression filter = lambda(greaterThan(member("Age"), constant(21)));
        when(queryAssembler.assemble(filter, null)).thenThrow(
                new QueryCompilationException(CompilationError.MISSING_INDEX_METADATA, "no index", filter));

        // When / Then: The failure is rethrown unchanged and counted by classification
        assertThatThrownBy(() -> service.compileQuery("Invoice", filter))
                .isInstanceOfSatisfying(QueryCompilationException.class,
                        e -> assertThat(e.getError()).isEqualTo(CompilationError.MISSING_INDEX_METADATA));
        assertThat(metrics.getCompilationsFailed().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("sift.compiler.errors").tag("error", "MISSING_INDEX_METADATA")
                .counter().count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesCompiled().count()).isZero();
    }

    @Test
    void testCompileAggregation_ShouldDelegateToPipelineCompiler() {
        // Given: The pipeline compiler returns an empty pipeline
        Expression chain = stage(constant("people"), "Count");
        AggregationDescriptor expected = new AggregationDescriptor("person-idx", null, null, List.of());
        when(pipelineCompiler.compile(eq(chain), any())).thenReturn(expected);

        // When: Compiling the aggregation
        AggregationDescriptor aggregation = service.compileAggregation("Person", chain);

        // Then: The result is returned and counted
        assertThat(aggregation).isSameAs(expected);
        assertThat(metrics.getAggregationsCompiled().count()).isEqualTo(1.0);
        assertThat(metrics.getAggregationCompileLatency().count()).isEqualTo(1L);
        verifyNoInteractions(queryAssembler);
    }

    @Test
    void testCompileAggregation_WhenStageFails_ShouldRecordFailure() {
        Expression chain = stage(constant("people"), "Apply", lambda(member("Age")));
        when(pipelineCompiler.compile(eq(chain), any())).thenThrow(
                new QueryCompilationException(CompilationError.INVALID_STAGE_ARGUMENT, "Apply requires an alias", chain));

        assertThatThrownBy(() -> service.compileAggregation("Person", chain))
                .isInstanceOf(QueryCompilationException.class)
                .hasMessageContaining("Apply requires an alias");
        assertThat(meterRegistry.get("sift.compiler.errors").tag("error", "INVALID_STAGE_ARGUMENT")
                .counter().count()).isEqualTo(1.0);
        assertThat(metrics.getAggregationCompileLatency().count()).isEqualTo(1L);
    }
}
