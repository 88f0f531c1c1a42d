package com.jupiter.query.provider.clickhouse;

import com.jupiter.domain.QueryResult;
import com.jupiter.domain.ValidationResult;
import com.jupiter.query.QueryExecutionException;
import com.jupiter.query.ast.ComparisonOperator;
import com.jupiter.query.ast.Condition;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.LiteralType;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.ast.TimeRange;
import com.jupiter.query.provider.AstValidator;
import com.jupiter.query.provider.QueryBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.net.InetAddress;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClickHouseQueryProvider Tests")
class ClickHouseQueryProviderTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private ClickHouseQueryProvider provider;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        ClickHouseSqlBuilder sqlBuilder = new ClickHouseSqlBuilder(FieldMapping.ocsfDefaults(),
            ClickHouseSqlBuilder.DEFAULT_TABLE, clock);
        provider = new ClickHouseQueryProvider(jdbcTemplate, sqlBuilder, new AstValidator());
    }

    @Test
    @DisplayName("Should execute compiled SQL and normalize driver values")
    void shouldExecuteAndNormalizeRows() throws Exception {
        // Given
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("time", Timestamp.from(Instant.parse("2024-06-01T11:59:00Z")));
        row.put("src_endpoint.ip", InetAddress.getByName("192.168.1.5"));
        row.put("severity", "High");
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(row));

        QueryAst ast = QueryAst.builder()
            .tenantId("t1")
            .where(Condition.of("src_endpoint.ip", ComparisonOperator.IN_SUBNET, Literal.string("192.168.0.0/16")))
            .build();

        // When
        QueryResult result = provider.executeAst(ast);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotal()).isEqualTo(1);
        assertThat(result.getData().get(0))
            .containsEntry("time", "2024-06-01T11:59:00Z")
            .containsEntry("src_endpoint.ip", "192.168.1.5")
            .containsEntry("severity", "High");
        assertThat(result.getSql()).isEqualTo("SELECT * FROM jupiter_siem.ocsf_events WHERE tenant_id = 't1'"
            + " AND isIPAddressInRange(toString(src_endpoint_ip), '192.168.0.0/16')");
        verify(jdbcTemplate, never()).queryForObject(anyString(), eq(Long.class));
    }

    @Test
    @DisplayName("Should run a count query for paginated requests")
    void shouldCountPaginatedQueries() {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(Map.of("severity", "High")));
        when(jdbcTemplate.queryForObject(startsWith("SELECT count() FROM ("), eq(Long.class))).thenReturn(42L);

        QueryResult result = provider.executeAst(QueryAst.builder().limit(1).offset(3).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotal()).isEqualTo(42);
        assertThat(result.isHasMore()).isTrue();
        assertThat(result.getSql()).endsWith("LIMIT 1 OFFSET 3");
    }

    @Test
    @DisplayName("Should turn database errors into a failed result")
    void shouldReportDatabaseErrors() {
        when(jdbcTemplate.queryForList(anyString()))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        QueryResult result = provider.executeAst(QueryAst.builder().timeRange(TimeRange.last("1h")).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("ClickHouse query failed: Connection refused");
        assertThat(result.getError()).endsWith("[Backend: sql]");
        assertThat(result.getData()).isEmpty();
        assertThat(result.getSql()).isNotNull();
        assertThat(result.getExecutionTime()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Should fail without touching the database when the AST is invalid")
    void shouldRejectInvalidAst() {
        QueryResult result = provider.executeAst(QueryAst.builder()
            .where(Condition.eq("bad field", "x"))
            .build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Invalid field name in condition: bad field");
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Should report compile errors from validation")
    void shouldReportCompileErrorsOnValidation() {
        QueryAst ast = QueryAst.builder()
            .where(Condition.of("file.size", ComparisonOperator.GT, new Literal(Double.NaN, LiteralType.FLOAT)))
            .build();

        ValidationResult validation = provider.validateAst(ast);

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getErrors()).containsExactly("Failed to build SQL: Non-finite numeric literal: NaN");
        assertThat(provider.backend()).isEqualTo(QueryBackend.SQL);
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Should report validation failures instead of throwing")
    void shouldNeverThrowFromValidation() {
        // Given
        QueryAst oversizedWindow = QueryAst.builder().timeRange(TimeRange.last("200000000000000d")).build();
        AstValidator failingValidator = mock(AstValidator.class);
        when(failingValidator.validate(any())).thenThrow(new IllegalStateException("validator unavailable"));
        ClickHouseQueryProvider failing = new ClickHouseQueryProvider(jdbcTemplate,
            new ClickHouseSqlBuilder(FieldMapping.ocsfDefaults(), ClickHouseSqlBuilder.DEFAULT_TABLE, Clock.systemUTC()),
            failingValidator);

        // When
        ValidationResult oversized = provider.validateAst(oversizedWindow);
        ValidationResult broken = failing.validateAst(oversizedWindow);

        // Then
        assertThat(oversized.isValid()).isFalse();
        assertThat(oversized.getErrors())
            .containsExactly("Invalid relative time range '200000000000000d', expected <N>m, <N>h or <N>d");
        assertThat(broken.isValid()).isFalse();
        assertThat(broken.getErrors()).containsExactly("Validation failed: validator unavailable");
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Should carry the failing SQL on execution errors")
    void shouldCarryFailingSql() {
        QueryExecutionException error = new QueryExecutionException("ClickHouse query failed: timeout",
            QueryBackend.SQL, "SELECT 1", new IllegalStateException("timeout"));

        assertThat(error.getQuery()).isEqualTo("SELECT 1");
        assertThat(error.getMessage()).isEqualTo("ClickHouse query failed: timeout [Backend: sql]");
    }
}
