package com.jupiter.query.provider.clickhouse;

import com.jupiter.query.ast.ComparisonOperator;
import com.jupiter.query.ast.Condition;
import com.jupiter.query.ast.Expression;
import com.jupiter.query.ast.Field;
import com.jupiter.query.ast.FunctionCall;
import com.jupiter.query.ast.GroupBy;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.LiteralList;
import com.jupiter.query.ast.LiteralType;
import com.jupiter.query.ast.LogicalExpression;
import com.jupiter.query.ast.OrderBy;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.ast.SelectField;
import com.jupiter.query.ast.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClickHouseSqlBuilderTest {

    private static final String TABLE = ClickHouseSqlBuilder.DEFAULT_TABLE;

    private ClickHouseSqlBuilder builder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        builder = new ClickHouseSqlBuilder(FieldMapping.ocsfDefaults(), TABLE, clock);
    }

    private String where(Expression expression) {
        String sql = builder.build(QueryAst.builder().where(expression).build());
        return sql.substring(("SELECT * FROM " + TABLE + " WHERE ").length());
    }

    @Test
    void testTenantFilterTimeWindowAndLimit() {
        // Given
        QueryAst ast = QueryAst.builder()
            .tenantId("t1")
            .where(Condition.eq("severity", "high"))
            .timeRange(TimeRange.last("1h"))
            .limit(10)
            .build();

        // When
        String sql = builder.build(ast);

        // Then
        assertThat(sql).isEqualTo("SELECT * FROM " + TABLE
            + " WHERE tenant_id = 't1' AND time >= '2024-06-01 11:00:00'"
            + " AND lowerUTF8(toString(severity)) = lowerUTF8('high') LIMIT 10");
    }

    @Test
    void testStringLiteralsAreEscaped() {
        // Given
        Condition injection = Condition.eq("message", "'; DROP TABLE --");

        // When
        String sql = where(injection);

        // Then
        assertThat(sql).isEqualTo("lowerUTF8(toString(message)) = lowerUTF8('''; DROP TABLE --')");
        assertThat(ClickHouseSqlBuilder.escape("a\\b'c")).isEqualTo("a\\\\b''c");
        assertThat(ClickHouseSqlBuilder.quote("it's")).isEqualTo("'it''s'");
    }

    @Test
    void testTenantIdIsEscaped() {
        String sql = builder.build(QueryAst.builder().tenantId("t1' OR '1'='1").build());

        assertThat(sql).isEqualTo("SELECT * FROM " + TABLE + " WHERE tenant_id = 't1'' OR ''1''=''1'");
    }

    @Test
    void testFieldsAreMappedToColumns() {
        assertThat(where(Condition.eq("user.name", "Admin")))
            .isEqualTo("lowerUTF8(toString(actor_user_name)) = lowerUTF8('Admin')");
        assertThat(where(Condition.eq("custom.unmapped_field", "x")))
            .isEqualTo("lowerUTF8(toString(custom.unmapped_field)) = lowerUTF8('x')");
    }

    @Test
    void testPatternOperatorsUseEscapedIlike() {
        assertThat(where(Condition.of("message", ComparisonOperator.CONTAINS, Literal.string("50%_off"))))
            .isEqualTo("toString(message) ILIKE '%50\\\\%\\\\_off%'");
        assertThat(where(Condition.of("process.name", ComparisonOperator.STARTS_WITH, Literal.string("power"))))
            .isEqualTo("toString(process_name) ILIKE 'power%'");
        assertThat(where(Condition.of("file.name", ComparisonOperator.ENDS_WITH, Literal.string(".exe"))))
            .isEqualTo("toString(file_name) ILIKE '%.exe'");
        assertThat(where(Condition.of("process.cmd_line", ComparisonOperator.REGEX, Literal.string("-enc\\s"))))
            .isEqualTo("match(toString(process_cmd_line), '(?i)-enc\\\\s')");
    }

    @Test
    void testSetMembership() {
        assertThat(where(Condition.in("process.name", "cmd.exe", "PowerShell.exe")))
            .isEqualTo("lowerUTF8(toString(process_name)) IN (lowerUTF8('cmd.exe'), lowerUTF8('PowerShell.exe'))");
        assertThat(where(Condition.of("severity", ComparisonOperator.NOT_IN, LiteralList.ofStrings("Low"))))
            .isEqualTo("lowerUTF8(toString(severity)) NOT IN (lowerUTF8('Low'))");
        assertThat(where(Condition.of("severity", ComparisonOperator.IN, new LiteralList(List.of()))))
            .isEqualTo("0");
        assertThat(where(Condition.of("severity", ComparisonOperator.NOT_IN, new LiteralList(List.of()))))
            .isEqualTo("severity IS NOT NULL");
    }

    @Test
    void testSetMembershipValuesAreEscaped() {
        // Given
        Condition in = Condition.in("user.name", "'; DROP TABLE --");
        Condition notIn = Condition.of("user.name", ComparisonOperator.NOT_IN, LiteralList.ofStrings("o'brien", "a\\b"));

        // When / Then
        assertThat(where(in))
            .isEqualTo("lowerUTF8(toString(actor_user_name)) IN (lowerUTF8('''; DROP TABLE --'))");
        assertThat(where(notIn))
            .isEqualTo("lowerUTF8(toString(actor_user_name)) NOT IN (lowerUTF8('o''brien'), lowerUTF8('a\\\\b'))");
    }

    @Test
    void testStringComparisonsFoldUnicodeCase() {
        assertThat(where(Condition.eq("name", "école")))
            .isEqualTo("lowerUTF8(toString(name)) = lowerUTF8('école')");
        assertThat(where(Condition.of("device.name", ComparisonOperator.CONTAINS, Field.of("device.hostname"))))
            .isEqualTo("position(lowerUTF8(toString(device_name)), lowerUTF8(toString(device_hostname))) > 0");
    }

    @Test
    void testSubnetMembership() {
        assertThat(where(Condition.of("src_endpoint.ip", ComparisonOperator.IN_SUBNET, Literal.string("192.168.0.0/16"))))
            .isEqualTo("isIPAddressInRange(toString(src_endpoint_ip), '192.168.0.0/16')");
    }

    @Test
    void testTypedLiterals() {
        assertThat(where(Condition.of("file.size", ComparisonOperator.GT, Literal.integer(1024))))
            .isEqualTo("toFloat64OrNull(toString(file_size)) > 1024");
        assertThat(where(Condition.of("enrichment.threat_score", ComparisonOperator.LTE, Literal.floating(7.50))))
            .isEqualTo("toFloat64OrNull(toString(enrichment_threat_score)) <= 7.5");
        assertThat(where(Condition.of("is_alert", ComparisonOperator.EQUALS, Literal.bool(true))))
            .isEqualTo("lowerUTF8(toString(is_alert)) IN ('true', '1')");
        assertThat(where(Condition.of("is_alert", ComparisonOperator.NOT_EQUALS, Literal.bool(true))))
            .isEqualTo("lowerUTF8(toString(is_alert)) IN ('false', '0')");
        assertThat(where(Condition.of("time", ComparisonOperator.GTE, Literal.timestamp("2024-01-01T00:00:00Z"))))
            .isEqualTo("time >= parseDateTime64BestEffort('2024-01-01T00:00:00Z', 3, 'UTC')");
        assertThat(where(Condition.of("severity", ComparisonOperator.EQUALS, new Literal(null, LiteralType.STRING))))
            .isEqualTo("0");

        assertThat(builder.serializeLiteral(Literal.ipAddress("10.0.0.1"))).isEqualTo("toIPv4('10.0.0.1')");
        assertThat(builder.serializeLiteral(Literal.ipAddress("2001:db8::1"))).isEqualTo("toIPv6('2001:db8::1')");
        assertThat(builder.serializeLiteral(Literal.bool(false))).isEqualTo("0");
        assertThat(builder.serializeLiteral(new Literal(null, LiteralType.INTEGER))).isEqualTo("NULL");
    }

    @Test
    void testNullChecksAndFieldComparisons() {
        assertThat(where(Condition.isNull("user.name"))).isEqualTo("actor_user_name IS NULL");
        assertThat(where(Condition.of("src_endpoint.port", ComparisonOperator.LT, Field.of("dst_endpoint.port"))))
            .isEqualTo("toFloat64OrNull(toString(src_endpoint_port)) < toFloat64OrNull(toString(dst_endpoint_port))");
        assertThat(where(Condition.of("device.name", ComparisonOperator.EQUALS, Field.of("device.hostname"))))
            .isEqualTo("lowerUTF8(toString(device_name)) = lowerUTF8(toString(device_hostname))");
    }

    @Test
    void testLogicalExpressions() {
        Condition a = Condition.eq("severity", "High");
        Condition b = Condition.eq("activity_name", "failed_login");

        assertThat(where(LogicalExpression.or(a, LogicalExpression.not(b))))
            .isEqualTo("(lowerUTF8(toString(severity)) = lowerUTF8('High')"
                + " OR NOT ifNull((lowerUTF8(toString(activity_name)) = lowerUTF8('failed_login')), 0))");
        assertThat(where(LogicalExpression.and(a, b)))
            .isEqualTo("(lowerUTF8(toString(severity)) = lowerUTF8('High')"
                + " AND lowerUTF8(toString(activity_name)) = lowerUTF8('failed_login'))");
    }

    @Test
    void testNegationTreatsMissingValuesAsNoMatch() {
        // Given
        Expression negated = LogicalExpression.not(Condition.eq("severity", "high"));

        // When
        String sql = where(negated);

        // Then
        assertThat(sql).isEqualTo("NOT ifNull((lowerUTF8(toString(severity)) = lowerUTF8('high')), 0)");
    }

    @Test
    void testAbsoluteTimeRange() {
        QueryAst ast = QueryAst.builder()
            .timeRange(TimeRange.between(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z")))
            .build();

        assertThat(builder.build(ast)).isEqualTo("SELECT * FROM " + TABLE
            + " WHERE time >= '2024-01-01 00:00:00' AND time <= '2024-01-02 00:00:00'");
    }

    @Test
    void testGroupByWithAliasesOrderAndPagination() {
        // Given
        QueryAst ast = QueryAst.builder()
            .select(SelectField.of("user.name"), SelectField.of(FunctionCall.count(), "events"))
            .groupBy(GroupBy.of("user.name"))
            .orderBy(OrderBy.desc("events"), OrderBy.asc("user.name"))
            .limit(5)
            .offset(10)
            .build();

        // When
        String sql = builder.build(ast);

        // Then
        assertThat(sql).isEqualTo("SELECT actor_user_name AS `user.name`, count() AS `events` FROM " + TABLE
            + " GROUP BY actor_user_name ORDER BY `events` DESC, `user.name` ASC LIMIT 5 OFFSET 10");
    }

    @Test
    void testGroupByWithoutSelectAddsCount() {
        QueryAst ast = QueryAst.builder()
            .groupBy(GroupBy.of("severity")
                .withHaving(Condition.of(FunctionCall.count(), ComparisonOperator.GT, Literal.integer(5))))
            .build();

        assertThat(builder.build(ast)).isEqualTo("SELECT severity, count() AS count FROM " + TABLE
            + " GROUP BY severity HAVING toFloat64OrNull(toString(count())) > 5");
    }

    @Test
    void testOrderByUnselectedFieldUsesColumn() {
        QueryAst ast = QueryAst.builder()
            .select(SelectField.of("message"))
            .orderBy(OrderBy.desc("time"))
            .offset(20)
            .build();

        assertThat(builder.build(ast)).isEqualTo("SELECT message FROM " + TABLE
            + " ORDER BY time DESC OFFSET 20 ROWS");
    }

    @Test
    void testCountQueryWrapsUnpagedQuery() {
        QueryAst ast = QueryAst.builder()
            .tenantId("t1")
            .orderBy(OrderBy.desc("time"))
            .limit(10)
            .offset(30)
            .build();

        assertThat(builder.buildCount(ast))
            .isEqualTo("SELECT count() FROM (SELECT * FROM " + TABLE + " WHERE tenant_id = 't1')");
    }

    @Test
    void testInvalidInputIsRejected() {
        assertThatThrownBy(() -> builder.build(QueryAst.builder().where(Condition.eq("name; DROP", "x")).build()))
            .isInstanceOf(SqlCompilationException.class)
            .hasMessage("Invalid field name: name; DROP");
        assertThatThrownBy(() -> builder.build(QueryAst.builder().timeRange(TimeRange.last("5y")).build()))
            .isInstanceOf(SqlCompilationException.class)
            .hasMessage("Invalid relative time range: 5y");
        assertThatThrownBy(() -> builder.build(QueryAst.builder()
                .where(Condition.of("file.size", ComparisonOperator.EQUALS, new Literal("1; DROP", LiteralType.INTEGER)))
                .build()))
            .isInstanceOf(SqlCompilationException.class);
        assertThatThrownBy(() -> new ClickHouseSqlBuilder(FieldMapping.ocsfDefaults(), "events; DROP", Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
