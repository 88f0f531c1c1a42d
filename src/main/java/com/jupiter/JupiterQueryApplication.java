package com.jupiter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main Spring Boot application class for the Jupiter SIEM query engine.
 *
 * The only data source is the optional ClickHouse pool from
 * {@link com.jupiter.storage.warm.ClickHouseConfig}, so the default
 * single-DataSource auto-configuration is excluded.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class JupiterQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(JupiterQueryApplication.class, args);
    }
}
