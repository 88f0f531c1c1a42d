package com.jupiter.storage.warm;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Configuration for the ClickHouse JDBC connection pool
 * Only active when {@code jupiter.query.clickhouse.url} is set. The pool opens
 * its first connection on first use, so startup does not need a reachable
 * server.
 */
@Configuration
@ConditionalOnProperty(prefix = "jupiter.query.clickhouse", name = "url")
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    public static final String DRIVER_CLASS = "com.clickhouse.jdbc.ClickHouseDriver";

    @Value("${jupiter.query.clickhouse.url}")
    private String url;

    @Value("${jupiter.query.clickhouse.username:default}")
    private String username;

    @Value("${jupiter.query.clickhouse.password:}")
    private String password;

    @Value("${jupiter.query.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${jupiter.query.clickhouse.max-execution-time:300}")
    private int maxExecutionTimeSeconds;

    /**
     * Create ClickHouse DataSource with connection pooling
     */
    @Bean(name = "clickHouseDataSource", destroyMethod = "close")
    public HikariDataSource clickHouseDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("clickhouse-query");
        dataSource.setJdbcUrl(url);
        dataSource.setUsername(username);
        dataSource.setPassword(password);
        dataSource.setDriverClassName(DRIVER_CLASS);

        // Connection pool settings
        dataSource.setMaximumPoolSize(poolSize);
        dataSource.setMinimumIdle(Math.min(2, poolSize));
        dataSource.setConnectionTimeout(30000);
        dataSource.setIdleTimeout(600000);
        dataSource.setMaxLifetime(1800000);

        // ClickHouse-specific settings
        dataSource.addDataSourceProperty("socket_timeout", "300000");
        dataSource.addDataSourceProperty("compress", "true");
        dataSource.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionTimeSeconds));

        logger.info("ClickHouse DataSource configured: {} (pool size {})", url, poolSize);
        return dataSource;
    }

    /**
     * Create JdbcTemplate for ClickHouse queries
     */
    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
