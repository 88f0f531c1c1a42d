package com.jupiter.query.provider.clickhouse;

import com.jupiter.domain.QueryResult;
import com.jupiter.domain.ValidationResult;
import com.jupiter.query.QueryExecutionException;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.provider.AstValidator;
import com.jupiter.query.provider.QueryBackend;
import com.jupiter.query.provider.QueryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.net.InetAddress;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes query ASTs against ClickHouse.
 *
 * The AST is compiled by {@link ClickHouseSqlBuilder} and run through a
 * pooled {@link JdbcTemplate}. When the query is paginated a second
 * {@code count()} query computes {@code total}, so it means the same thing as
 * on the in-memory provider. The compiled SQL is returned with the result.
 */
public class ClickHouseQueryProvider implements QueryProvider {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseQueryProvider.class);

    static final int MAX_SQL_LENGTH = 100_000;

    private final JdbcTemplate jdbcTemplate;
    private final ClickHouseSqlBuilder sqlBuilder;
    private final AstValidator validator;

    public ClickHouseQueryProvider(JdbcTemplate jdbcTemplate, ClickHouseSqlBuilder sqlBuilder, AstValidator validator) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlBuilder = sqlBuilder;
        this.validator = validator;
    }

    @Override
    public QueryBackend backend() {
        return QueryBackend.SQL;
    }

    @Override
    public String description() {
        return "Production ClickHouse database with real log data";
    }

    @Override
    public ValidationResult validateAst(QueryAst ast) {
        ValidationResult structural;
        try {
            structural = validator.validate(ast);
        } catch (RuntimeException e) {
            log.error("ClickHouse query validation failed: {}", e.getMessage(), e);
            return ValidationResult.invalid("Validation failed: " + e.getMessage());
        }
        if (!structural.isValid()) {
            return structural;
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>(structural.getWarnings());
        try {
            String sql = sqlBuilder.build(ast);
            if (sql.length() > MAX_SQL_LENGTH) {
                warnings.add("Query is very large, may impact performance");
            }
        } catch (RuntimeException e) {
            errors.add("Failed to build SQL: " + e.getMessage());
        }
        return new ValidationResult(errors, warnings);
    }

    @Override
    public QueryResult executeAst(QueryAst ast) {
        long startNanos = System.nanoTime();
        QueryResult result;
        String sql = null;
        try {
            ValidationResult validation = validator.validate(ast);
            if (!validation.isValid()) {
                result = QueryResult.failure(String.join("; ", validation.getErrors()));
            } else {
                sql = sqlBuilder.build(ast);
                result = execute(ast, sql);
            }
        } catch (SqlCompilationException e) {
            log.warn("Failed to build SQL for query {}: {}", ast.getQueryId(), e.getMessage());
            result = QueryResult.failure("Failed to build SQL: " + e.getMessage());
        } catch (QueryExecutionException e) {
            log.error("ClickHouse query failed: {} (SQL: {})", e.getMessage(), e.getQuery(), e);
            result = QueryResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error executing ClickHouse query: {}", e.getMessage(), e);
            result = QueryResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        result.setSql(sql);
        result.setExecutionTime((System.nanoTime() - startNanos) / 1_000_000_000.0);
        return result;
    }

    private QueryResult execute(QueryAst ast, String sql) {
        log.debug("Executing ClickHouse query: {}", sql);
        try {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Map<String, Object> row : jdbcTemplate.queryForList(sql)) {
                rows.add(normalizeRow(row));
            }

            long total = rows.size();
            if (ast.getLimit() != null || ast.getOffset() != null) {
                String countSql = sqlBuilder.buildCount(ast);
                log.debug("Executing ClickHouse count query: {}", countSql);
                Long count = jdbcTemplate.queryForObject(countSql, Long.class);
                total = count != null ? count : rows.size();
            }

            int offset = ast.getOffset() != null ? ast.getOffset() : 0;
            QueryResult result = QueryResult.success(rows, total);
            result.setHasMore(offset + rows.size() < total);
            log.debug("ClickHouse query returned {} rows of {}", rows.size(), total);
            return result;
        } catch (DataAccessException e) {
            throw new QueryExecutionException("ClickHouse query failed: " + e.getMostSpecificCause().getMessage(),
                QueryBackend.SQL, sql, e);
        }
    }

    /**
     * Convert driver types into plain JSON-friendly values
     */
    private Map<String, Object> normalizeRow(Map<String, Object> row) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            Object value = entry.getValue();

            // Handle special types
            if (value instanceof java.sql.Timestamp) {
                // Convert timestamp to ISO 8601 string
                value = ((java.sql.Timestamp) value).toInstant().toString();
            } else if (value instanceof java.time.LocalDateTime) {
                value = ((java.time.LocalDateTime) value).toInstant(java.time.ZoneOffset.UTC).toString();
            } else if (value instanceof java.time.OffsetDateTime) {
                value = ((java.time.OffsetDateTime) value).toInstant().toString();
            } else if (value instanceof java.time.ZonedDateTime) {
                value = ((java.time.ZonedDateTime) value).toInstant().toString();
            } else if (value instanceof java.sql.Date) {
                value = ((java.sql.Date) value).toLocalDate().toString();
            } else if (value instanceof InetAddress) {
                value = ((InetAddress) value).getHostAddress();
            } else if (value instanceof java.sql.Array) {
                // Convert SQL array to Java array
                try {
                    value = ((java.sql.Array) value).getArray();
                } catch (SQLException e) {
                    throw new QueryExecutionException("Failed to read array column " + entry.getKey(),
                        QueryBackend.SQL, null, e);
                }
            }

            normalized.put(entry.getKey(), value);
        }
        return normalized;
    }
}
