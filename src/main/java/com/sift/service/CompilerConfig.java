package com.sift.service;

import com.sift.aggregation.PipelineCompiler;
import com.sift.aggregation.ValueExpressionCompiler;
import com.sift.query.FieldResolver;
import com.sift.query.MethodCallTranslator;
import com.sift.query.PredicateCompiler;
import com.sift.query.QueryAssembler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the query and aggregation compilers
 */
@Configuration
public class CompilerConfig {
    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    @Value("${sift.compiler.default-page-size:100}")
    private int defaultPageSize;

    @Bean
    public QueryAssembler queryAssembler(PredicateCompiler predicateCompiler, FieldResolver fieldResolver,
                                         MethodCallTranslator methodCallTranslator) {
        logger.info("Query assembler initialized with default page size {}", defaultPageSize);
        return new QueryAssembler(predicateCompiler, fieldResolver, methodCallTranslator, defaultPageSize);
    }

    @Bean
    public PipelineCompiler pipelineCompiler(PredicateCompiler predicateCompiler,
                                             ValueExpressionCompiler valueExpressionCompiler,
                                             FieldResolver fieldResolver) {
        return new PipelineCompiler(predicateCompiler, valueExpressionCompiler, fieldResolver, defaultPageSize);
    }

    /**
     * Local registry for compiler metrics when no monitoring system supplies one
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
