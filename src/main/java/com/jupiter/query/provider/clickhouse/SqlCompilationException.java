package com.jupiter.query.provider.clickhouse;

/**
 * Thrown when an AST cannot be compiled to ClickHouse SQL
 */
public class SqlCompilationException extends RuntimeException {

    public SqlCompilationException(String message) {
        super(message);
    }
}
