package com.jupiter.config;

import com.jupiter.domain.QueryResult;
import com.jupiter.query.QueryManager;
import com.jupiter.query.provider.ProviderRegistry;
import com.jupiter.query.provider.QueryBackend;
import com.jupiter.query.provider.clickhouse.ClickHouseQueryProvider;
import com.jupiter.query.provider.mock.MockQueryProvider;
import com.jupiter.storage.warm.ClickHouseConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryEngineConfig Tests")
class QueryEngineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(QueryEngineConfig.class, ClickHouseConfig.class);

    @Test
    @DisplayName("Should register only the mock provider by default")
    void shouldRegisterMockByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(MockQueryProvider.class);
            assertThat(context).doesNotHaveBean(ClickHouseQueryProvider.class);
            assertThat(context).doesNotHaveBean(HikariDataSource.class);

            QueryManager manager = context.getBean(QueryManager.class);
            assertThat(manager.getAvailableBackends()).containsExactly("mock");

            QueryResult result = manager.executeText("activity_name = failed_login", "main_tenant", "test", null);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getBackend()).isEqualTo("mock");
            assertThat(result.getTotal()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("Should register the SQL provider when a ClickHouse URL is configured")
    void shouldRegisterSqlProviderWithUrl() {
        contextRunner
            .withPropertyValues("jupiter.query.clickhouse.url=jdbc:clickhouse://localhost:8123/jupiter_siem")
            .run(context -> {
                assertThat(context).hasSingleBean(ClickHouseQueryProvider.class);
                assertThat(context).hasBean("clickHouseJdbcTemplate");

                ProviderRegistry registry = context.getBean(ProviderRegistry.class);
                assertThat(registry.backends()).containsExactly(QueryBackend.MOCK, QueryBackend.SQL);
                assertThat(context.getBean(QueryManager.class).selectBackend()).contains(QueryBackend.SQL);
            });
    }

    @Test
    @DisplayName("Should honour the configured backend and the mock switch")
    void shouldHonourBackendProperties() {
        contextRunner
            .withPropertyValues(
                "jupiter.query.clickhouse.url=jdbc:clickhouse://localhost:8123/jupiter_siem",
                "jupiter.query.backend=mock")
            .run(context -> assertThat(context.getBean(QueryManager.class).selectBackend())
                .contains(QueryBackend.MOCK));

        contextRunner
            .withPropertyValues("jupiter.query.mock.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(MockQueryProvider.class);
                assertThat(context.getBean(QueryManager.class).getAvailableBackends()).isEmpty();
            });
    }

    @Test
    @DisplayName("Should fail to start on an unknown backend name")
    void shouldRejectUnknownBackend() {
        contextRunner
            .withPropertyValues("jupiter.query.backend=oracle")
            .run(context -> assertThat(context).hasFailed());
    }
}
