package com.sift.service;

import com.sift.query.CompilationError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for query and aggregation compilation
 * Tracks compile counts, failures by error classification, and compile latency
 */
@Component
public class CompilerMetrics {

    private final MeterRegistry meterRegistry;

    private Counter queriesCompiled;
    private Counter aggregationsCompiled;
    private Counter compilationsFailed;
    private Timer queryCompileLatency;
    private Timer aggregationCompileLatency;

    public CompilerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        queriesCompiled = Counter.builder("sift.compiler.queries.compiled")
            .description("Total number of search queries compiled")
            .register(meterRegistry);

        aggregationsCompiled = Counter.builder("sift.compiler.aggregations.compiled")
            .description("Total number of aggregation pipelines compiled")
            .register(meterRegistry);

        compilationsFailed = Counter.builder("sift.compiler.failed")
            .description("Total number of compilations that failed")
            .register(meterRegistry);

        queryCompileLatency = Timer.builder("sift.compiler.query.latency")
            .description("Latency of search query compilation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofNanos(1000))
            .maximumExpectedValue(Duration.ofMillis(100))
            .register(meterRegistry);

        aggregationCompileLatency = Timer.builder("sift.compiler.aggregation.latency")
            .description("Latency of aggregation pipeline compilation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofNanos(1000))
            .maximumExpectedValue(Duration.ofMillis(100))
            .register(meterRegistry);
    }

    public void recordQueryCompiled() {
        queriesCompiled.increment();
    }

    public void recordAggregationCompiled() {
        aggregationsCompiled.increment();
    }

    /**
     * Count a failure, both in total and tagged by its classification
     */
    public void recordFailure(CompilationError error) {
        compilationsFailed.increment();
        meterRegistry.counter("sift.compiler.errors", "error", error.name()).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryCompileLatency);
    }

    public void recordAggregationLatency(Timer.Sample sample) {
        sample.stop(aggregationCompileLatency);
    }

    public Counter getQueriesCompiled() {
        return queriesCompiled;
    }

    public Counter getAggregationsCompiled() {
        return aggregationsCompiled;
    }

    public Counter getCompilationsFailed() {
        return compilationsFailed;
    }

    public Timer getQueryCompileLatency() {
        return queryCompileLatency;
    }

    public Timer getAggregationCompileLatency() {
        return aggregationCompileLatency;
    }
}
