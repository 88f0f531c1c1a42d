package com.jupiter.query;

import com.jupiter.audit.QueryAuditSink;
import com.jupiter.domain.BackendInfo;
import com.jupiter.domain.QueryAuditRecord;
import com.jupiter.domain.QueryResult;
import com.jupiter.domain.ValidationResult;
import com.jupiter.query.ast.ExampleQueries;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.parser.TextQueryParser;
import com.jupiter.query.provider.ProviderRegistry;
import com.jupiter.query.provider.QueryBackend;
import com.jupiter.query.provider.QueryProvider;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * QueryManager routes query ASTs to a query provider and decorates the
 * results.
 *
 * Backend selection, in priority order:
 * 1. The backend requested by the caller ({@code auto} counts as none). A
 *    requested backend that is not registered is an error.
 * 2. The configured default ({@code jupiter.query.backend}). A configured
 *    backend that is not registered falls through to auto-detection.
 * 3. Auto-detection: the SQL backend when registered, otherwise mock.
 *
 * Every execution gets a query id, backend, execution time and timestamp, is
 * counted in {@link QueryMetrics} and is reported to the {@link QueryAuditSink}.
 * Audit failures are logged and counted but never change the result.
 * Nothing thrown by a provider escapes this class.
 */
public class QueryManager {

    private static final Logger log = LoggerFactory.getLogger(QueryManager.class);

    private static final DateTimeFormatter QUERY_ID_FORMATTER =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS").withZone(ZoneOffset.UTC);

    private final ProviderRegistry registry;
    private final TextQueryParser parser;
    private final QueryAuditSink auditSink;
    private final QueryMetrics metrics;
    private final QueryBackend configuredBackend;
    private final Clock clock;

    public QueryManager(ProviderRegistry registry, TextQueryParser parser, QueryAuditSink auditSink,
                        QueryMetrics metrics, QueryBackend configuredBackend, Clock clock) {
        this.registry = registry;
        this.parser = parser;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.configuredBackend = configuredBackend != null ? configuredBackend : QueryBackend.AUTO;
        this.clock = clock;

        log.info("QueryManager initialized (configured backend: {}, available: {})",
            this.configuredBackend, registry.backends());
        if (this.configuredBackend != QueryBackend.AUTO && !registry.isRegistered(this.configuredBackend)) {
            log.warn("Configured backend {} is not available, falling back to auto-detection",
                this.configuredBackend);
        }
    }

    /**
     * Execute an AST.
     *
     * @param ast the query to run
     * @param backend requested backend, or null/{@code AUTO} to select one
     * @param userId user recorded in the audit log, may be null
     * @return the result envelope; never null, never thrown through
     */
    public QueryResult execute(QueryAst ast, QueryBackend backend, String userId) {
        long startNanos = System.nanoTime();
        Timer.Sample sample = metrics.startQueryTimer();

        String queryId = ast != null && ast.getQueryId() != null ? ast.getQueryId() : generateQueryId();
        String tenantId = ast != null ? ast.getTenantId() : null;
        QueryBackend selected = null;
        QueryResult result;

        try {
            if (ast == null) {
                result = QueryResult.failure("Query AST must not be null");
            } else {
                Optional<QueryBackend> resolved = resolveBackend(backend);
                if (resolved.isEmpty()) {
                    result = QueryResult.failure(unavailableMessage(backend));
                } else {
                    selected = resolved.get();
                    QueryProvider provider = registry.get(selected).orElseThrow();
                    QueryAst identified = ast.getQueryId() != null ? ast : ast.withQueryId(queryId);
                    log.debug("Executing query {} on {} backend", queryId, selected);
                    result = provider.executeAst(identified);
                    if (result == null) {
                        result = QueryResult.failure("Provider " + selected + " returned no result");
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Query {} execution failed: {}", queryId, e.getMessage(), e);
            result = QueryResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        QueryBackend tagged = selected != null ? selected : explicitOrConfigured(backend);
        result.setQueryId(queryId);
        result.setBackend(tagged.getValue());
        result.setExecutionTime((System.nanoTime() - startNanos) / 1_000_000_000.0);
        result.setTimestamp(clock.instant().toString());

        recordMetrics(result, sample, selected);
        audit(result, userId, tenantId);

        if (result.isSuccess()) {
            log.info("Query {} completed on {} backend: {} rows of {} in {}s",
                queryId, tagged, result.getData().size(), result.getTotal(), result.getExecutionTime());
        } else {
            log.warn("Query {} failed on {} backend: {}", queryId, tagged, result.getError());
        }
        return result;
    }

    /**
     * Parse a text query and execute it
     */
    public QueryResult executeText(String text, String tenantId, String userId, QueryBackend backend) {
        QueryAst ast = parser.parse(text, tenantId);
        return execute(ast, backend, userId);
    }

    /**
     * Validate an AST against the requested backend, or the one that would be
     * selected for execution.
     */
    public ValidationResult validate(QueryAst ast, QueryBackend backend) {
        try {
            Optional<QueryBackend> resolved = resolveBackend(backend);
            if (resolved.isEmpty()) {
                return ValidationResult.invalid(unavailableMessage(backend));
            }
            ValidationResult validation = registry.get(resolved.get()).orElseThrow().validateAst(ast);
            if (!validation.isValid()) {
                metrics.recordValidationFailure();
            }
            return validation;
        } catch (RuntimeException e) {
            log.error("Query validation failed: {}", e.getMessage(), e);
            return ValidationResult.invalid(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public List<String> getAvailableBackends() {
        return registry.backends().stream()
            .map(QueryBackend::getValue)
            .collect(Collectors.toList());
    }

    public BackendInfo describeBackend(QueryBackend backend) {
        return registry.get(backend)
            .map(provider -> new BackendInfo(true, provider.backend().getValue(), provider.description()))
            .orElseGet(BackendInfo::unavailable);
    }

    public Map<String, QueryAst> getExampleQueries() {
        return ExampleQueries.all();
    }

    /**
     * Backend used when the caller does not request one
     */
    public Optional<QueryBackend> selectBackend() {
        return resolveBackend(null);
    }

    private Optional<QueryBackend> resolveBackend(QueryBackend requested) {
        if (requested != null && requested != QueryBackend.AUTO) {
            return registry.isRegistered(requested) ? Optional.of(requested) : Optional.empty();
        }
        if (configuredBackend != QueryBackend.AUTO && registry.isRegistered(configuredBackend)) {
            return Optional.of(configuredBackend);
        }
        if (registry.isRegistered(QueryBackend.SQL)) {
            return Optional.of(QueryBackend.SQL);
        }
        if (registry.isRegistered(QueryBackend.MOCK)) {
            return Optional.of(QueryBackend.MOCK);
        }
        return Optional.empty();
    }

    private QueryBackend explicitOrConfigured(QueryBackend requested) {
        if (requested != null && requested != QueryBackend.AUTO) {
            return requested;
        }
        return configuredBackend;
    }

    private static String unavailableMessage(QueryBackend requested) {
        if (requested != null && requested != QueryBackend.AUTO) {
            return "Provider " + requested + " not available";
        }
        return "No query provider available";
    }

    private String generateQueryId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "query_" + QUERY_ID_FORMATTER.format(clock.instant()) + "_" + suffix;
    }

    private void recordMetrics(QueryResult result, Timer.Sample sample, QueryBackend backend) {
        metrics.recordQueryLatency(sample, backend);
        if (result.isSuccess()) {
            metrics.recordQueryExecuted(backend);
            metrics.recordResultSize(result.getData().size());
        } else {
            metrics.recordQueryFailed();
        }
    }

    private void audit(QueryResult result, String userId, String tenantId) {
        try {
            auditSink.record(QueryAuditRecord.of(result, userId, tenantId));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit record for query {}: {}", result.getQueryId(), e.getMessage());
            metrics.recordAuditFailure();
        }
    }
}
