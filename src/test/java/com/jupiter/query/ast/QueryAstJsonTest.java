package com.jupiter.query.ast;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueryAst JSON Tests")
class QueryAstJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    @DisplayName("Should read a saved query with nested expressions")
    void shouldDeserializeSavedQuery() throws Exception {
        // Given
        String json = """
            {
              "tenant_id": "main_tenant",
              "select": [
                {"field": {"type": "field", "name": "src_endpoint.ip"}, "alias": "source_ip"},
                {"field": {"type": "function", "name": "count", "args": []}}
              ],
              "where": {
                "type": "logical",
                "operator": "and",
                "conditions": [
                  {"type": "condition",
                   "left": {"type": "field", "name": "activity_name"},
                   "operator": "eq",
                   "right": {"type": "literal", "value": "failed_login", "literal_type": "string"}},
                  {"type": "condition",
                   "left": {"type": "field", "name": "src_endpoint.ip"},
                   "operator": "in_subnet",
                   "right": {"type": "literal", "value": "10.0.0.0/8"}}
                ]
              },
              "group_by": {"fields": [{"type": "field", "name": "src_endpoint.ip"}]},
              "order_by": [{"field": {"type": "field", "name": "count"}, "direction": "desc"}],
              "limit": 50,
              "time_range": {"last": "24h"}
            }
            """;

        // When
        QueryAst ast = objectMapper.readValue(json, QueryAst.class);

        // Then
        assertThat(ast.getTenantId()).isEqualTo("main_tenant");
        assertThat(ast.getSelect()).containsExactly(
            SelectField.of(Field.of("src_endpoint.ip"), "source_ip"),
            SelectField.of(FunctionCall.count(), null));
        assertThat(ast.getWhere()).isEqualTo(LogicalExpression.and(
            Condition.eq("activity_name", "failed_login"),
            Condition.of("src_endpoint.ip", ComparisonOperator.IN_SUBNET, Literal.string("10.0.0.0/8"))));
        assertThat(ast.getGroupBy()).isEqualTo(GroupBy.of("src_endpoint.ip"));
        assertThat(ast.getOrderBy()).containsExactly(OrderBy.desc("count"));
        assertThat(ast.getLimit()).isEqualTo(50);
        assertThat(ast.getOffset()).isNull();
        assertThat(ast.getTimeRange()).isEqualTo(TimeRange.last("24h"));
    }

    @Test
    @DisplayName("Should write the same shape it reads")
    void shouldSerializeWithWireNames() throws Exception {
        QueryAst ast = QueryAst.builder()
            .queryId("q1")
            .where(Condition.of("time", ComparisonOperator.GTE, Literal.timestamp(Instant.parse("2024-01-01T00:00:00Z"))))
            .timeRange(TimeRange.between(Instant.parse("2024-01-01T00:00:00Z"), null))
            .build();

        String json = objectMapper.writeValueAsString(ast);

        assertThat(json).contains("\"query_id\":\"q1\"");
        assertThat(json).contains("\"operator\":\"gte\"");
        assertThat(json).contains("\"literal_type\":\"timestamp\"");
        assertThat(json).contains("\"value\":\"2024-01-01T00:00:00Z\"");
        assertThat(objectMapper.readValue(json, QueryAst.class)).isEqualTo(ast);
    }

    @Test
    @DisplayName("Should reject unknown operators")
    void shouldRejectUnknownOperator() {
        String json = """
            {"where": {"type": "condition", "left": {"type": "field", "name": "a"},
                       "operator": "approx", "right": {"type": "literal", "value": 1}}}
            """;

        assertThatThrownBy(() -> objectMapper.readValue(json, QueryAst.class))
            .hasMessageContaining("approx");
    }

    @Test
    @DisplayName("Should compute relative windows against a clock")
    void shouldResolveRelativeWindow() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

        assertThat(TimeRange.last("15m").resolveCutoff(clock)).contains(Instant.parse("2024-06-01T11:45:00Z"));
        assertThat(TimeRange.last("2h").resolveCutoff(clock)).contains(Instant.parse("2024-06-01T10:00:00Z"));
        assertThat(TimeRange.last("7d").resolveCutoff(clock)).contains(Instant.parse("2024-05-25T12:00:00Z"));
        assertThat(TimeRange.last("0h").getRelativeDuration()).isEmpty();
        assertThat(TimeRange.last("1w").getRelativeDuration()).isEmpty();
    }

    @Test
    @DisplayName("Should derive default aliases for aggregate calls")
    void shouldDeriveDefaultAlias() {
        assertThat(FunctionCall.count().getDefaultAlias()).isEqualTo("count");
        assertThat(FunctionCall.of(AggregateFunction.SUM, Field.of("file.size")).getDefaultAlias())
            .isEqualTo("sum_file_size");
        assertThat(SelectField.of(FunctionCall.count(), "events").getOutputName()).isEqualTo("events");
    }
}
