package com.jupiter.query.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalogue of ready-made ASTs for common OCSF hunting queries, used by
 * operator tooling to seed the query builder.
 */
public final class ExampleQueries {

    public static final String FAILED_LOGINS = "failed_logins";
    public static final String SUSPICIOUS_PROCESSES = "suspicious_processes";

    private static final Map<String, QueryAst> EXAMPLES;

    static {
        Map<String, QueryAst> examples = new LinkedHashMap<>();

        examples.put(FAILED_LOGINS, QueryAst.builder()
            .select(
                SelectField.of("activity_name"),
                SelectField.of(Field.of("src_endpoint.ip"), "source_ip"),
                SelectField.of(Field.of("user.name"), "username"),
                SelectField.of(FunctionCall.count(), "count"))
            .where(LogicalExpression.and(
                Condition.eq("activity_name", "failed_login"),
                Condition.of("time", ComparisonOperator.GTE, Literal.timestamp("2024-01-01T00:00:00Z"))))
            .groupBy(GroupBy.of("activity_name", "src_endpoint.ip", "user.name"))
            .orderBy(OrderBy.desc("count"))
            .limit(100)
            .timeRange(TimeRange.last("24h"))
            .build());

        examples.put(SUSPICIOUS_PROCESSES, QueryAst.builder()
            .select(
                SelectField.of("process.name"),
                SelectField.of("process.cmd_line"),
                SelectField.of("device.name"),
                SelectField.of("time"))
            .where(LogicalExpression.and(
                Condition.of("class_uid", ComparisonOperator.EQUALS, Literal.integer(1002)),
                Condition.in("process.name", "powershell.exe", "cmd.exe", "wscript.exe")))
            .orderBy(OrderBy.desc("time"))
            .timeRange(TimeRange.last("1h"))
            .build());

        EXAMPLES = Collections.unmodifiableMap(examples);
    }

    private ExampleQueries() {
        throw new UnsupportedOperationException("ExampleQueries is a utility class and cannot be instantiated");
    }

    public static Map<String, QueryAst> all() {
        return EXAMPLES;
    }
}
