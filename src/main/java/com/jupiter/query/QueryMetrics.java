package com.jupiter.query;

import com.jupiter.query.provider.QueryBackend;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics collector for query execution
 * Tracks executions, failures, per-backend latency, result sizes,
 * dropped text-query fragments and audit sink failures
 */
public class QueryMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter queriesExecuted;
    private final Counter queriesFailed;
    private final Counter validationFailures;
    private final Counter fragmentsDropped;
    private final Counter auditFailures;
    private final Timer queryExecutionLatency;
    private final Map<QueryBackend, Timer> backendLatency = new EnumMap<>(QueryBackend.class);
    private final Map<QueryBackend, Counter> backendQueries = new EnumMap<>(QueryBackend.class);
    private final DistributionSummary resultSize;

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        queriesExecuted = Counter.builder("jupiter.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("jupiter.query.failed")
            .description("Total number of queries that failed")
            .register(meterRegistry);

        validationFailures = Counter.builder("jupiter.query.validation.failed")
            .description("Total number of queries rejected by AST validation")
            .register(meterRegistry);

        fragmentsDropped = Counter.builder("jupiter.query.parser.fragments.dropped")
            .description("Text query fragments dropped by the parser")
            .register(meterRegistry);

        auditFailures = Counter.builder("jupiter.query.audit.failures")
            .description("Audit records that could not be written")
            .register(meterRegistry);

        // Timers with histogram support for percentile calculation
        queryExecutionLatency = Timer.builder("jupiter.query.execution.latency")
            .description("Latency of overall query execution")
            .publishPercentiles(0.5, 0.95, 0.99) // P50, P95, P99
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        for (QueryBackend backend : QueryBackend.values()) {
            if (backend == QueryBackend.AUTO) {
                continue;
            }
            backendQueries.put(backend, Counter.builder("jupiter.query.backend.executed")
                .description("Queries executed per backend")
                .tag("backend", backend.getValue())
                .register(meterRegistry));

            backendLatency.put(backend, Timer.builder("jupiter.query.backend.latency")
                .description("Latency of query execution per backend")
                .tag("backend", backend.getValue())
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram()
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry));
        }

        resultSize = DistributionSummary.builder("jupiter.query.result.size")
            .description("Distribution of query result sizes (number of records)")
            .baseUnit("records")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(1.0)
            .maximumExpectedValue(100000.0)
            .register(meterRegistry);
    }

    public void recordQueryExecuted(QueryBackend backend) {
        queriesExecuted.increment();
        Counter counter = backendQueries.get(backend);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordValidationFailure() {
        validationFailures.increment();
    }

    public void recordFragmentDropped() {
        fragmentsDropped.increment();
    }

    public void recordAuditFailure() {
        auditFailures.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Stop the sample against the overall timer and the backend's timer
     */
    public void recordQueryLatency(Timer.Sample sample, QueryBackend backend) {
        long nanos = sample.stop(queryExecutionLatency);
        Timer timer = backendLatency.get(backend);
        if (timer != null) {
            timer.record(Duration.ofNanos(nanos));
        }
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getValidationFailures() {
        return validationFailures;
    }

    public Counter getFragmentsDropped() {
        return fragmentsDropped;
    }

    public Counter getAuditFailures() {
        return auditFailures;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public Timer getBackendLatency(QueryBackend backend) {
        return backendLatency.get(backend);
    }

    public Counter getBackendQueries(QueryBackend backend) {
        return backendQueries.get(backend);
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }
}
