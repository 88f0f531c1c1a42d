package com.jupiter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jupiter.audit.LoggingQueryAuditSink;
import com.jupiter.audit.QueryAuditSink;
import com.jupiter.query.QueryManager;
import com.jupiter.query.QueryMetrics;
import com.jupiter.query.parser.TextQueryParser;
import com.jupiter.query.provider.AstValidator;
import com.jupiter.query.provider.ProviderRegistry;
import com.jupiter.query.provider.QueryBackend;
import com.jupiter.query.provider.QueryProvider;
import com.jupiter.query.provider.clickhouse.ClickHouseQueryProvider;
import com.jupiter.query.provider.clickhouse.ClickHouseSqlBuilder;
import com.jupiter.query.provider.clickhouse.FieldMapping;
import com.jupiter.query.provider.mock.MockDatasetLoader;
import com.jupiter.query.provider.mock.MockQueryProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Wires the query engine: parser, providers, registry, manager, metrics and
 * audit sink.
 *
 * The mock provider is registered unless {@code jupiter.query.mock.enabled}
 * is false. The SQL provider is registered only when
 * {@code jupiter.query.clickhouse.url} is configured.
 */
@Configuration
public class QueryEngineConfig {

    @Value("${jupiter.query.backend:auto}")
    private String backend;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    public QueryMetrics queryMetrics(MeterRegistry meterRegistry) {
        return new QueryMetrics(meterRegistry);
    }

    @Bean
    public AstValidator astValidator() {
        return new AstValidator();
    }

    @Bean
    public TextQueryParser textQueryParser(QueryMetrics queryMetrics) {
        return new TextQueryParser(queryMetrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jupiter.query.mock", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MockQueryProvider mockQueryProvider(ObjectMapper objectMapper, Clock clock, AstValidator astValidator,
                                               @Value("${jupiter.query.mock.data-path:}") String dataPath) {
        MockDatasetLoader loader = new MockDatasetLoader(objectMapper, clock);
        return new MockQueryProvider(loader.load(dataPath), astValidator, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryAuditSink queryAuditSink(ObjectMapper objectMapper) {
        return new LoggingQueryAuditSink(objectMapper);
    }

    @Bean
    public ProviderRegistry providerRegistry(ObjectProvider<QueryProvider> providers) {
        return new ProviderRegistry(providers.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public QueryManager queryManager(ProviderRegistry providerRegistry, TextQueryParser textQueryParser,
                                     QueryAuditSink queryAuditSink, QueryMetrics queryMetrics, Clock clock) {
        return new QueryManager(providerRegistry, textQueryParser, queryAuditSink, queryMetrics,
            QueryBackend.fromValue(backend), clock);
    }

    /**
     * SQL provider over the ClickHouse pool
     */
    @Configuration
    @ConditionalOnProperty(prefix = "jupiter.query.clickhouse", name = "url")
    public static class ClickHouseProviderConfig {

        @Value("${jupiter.query.clickhouse.table:" + ClickHouseSqlBuilder.DEFAULT_TABLE + "}")
        private String table;

        @Bean
        public FieldMapping fieldMapping() {
            return FieldMapping.ocsfDefaults();
        }

        @Bean
        public ClickHouseSqlBuilder clickHouseSqlBuilder(FieldMapping fieldMapping, Clock clock) {
            return new ClickHouseSqlBuilder(fieldMapping, table, clock);
        }

        @Bean
        public ClickHouseQueryProvider clickHouseQueryProvider(
                @Qualifier("clickHouseJdbcTemplate") JdbcTemplate clickHouseJdbcTemplate,
                ClickHouseSqlBuilder clickHouseSqlBuilder, AstValidator astValidator) {
            return new ClickHouseQueryProvider(clickHouseJdbcTemplate, clickHouseSqlBuilder, astValidator);
        }
    }
}
