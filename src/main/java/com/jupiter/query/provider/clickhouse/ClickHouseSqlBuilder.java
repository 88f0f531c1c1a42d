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
import com.jupiter.query.ast.Operand;
import com.jupiter.query.ast.OrderBy;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.ast.SelectField;
import com.jupiter.query.ast.TimeRange;
import com.jupiter.query.provider.AstValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles query ASTs to ClickHouse SQL.
 *
 * Values are inlined as escaped literals and identifiers are validated, so the
 * generated text is safe to execute as-is. Operators are lowered so that the
 * database applies the same matching rules as the in-memory provider:
 * case-insensitive string comparison (Unicode-aware {@code lowerUTF8}),
 * numeric comparison through
 * {@code toFloat64OrNull} (non-numeric values never match) and NULL for
 * missing values.
 */
public class ClickHouseSqlBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ClickHouseSqlBuilder.class);

    private static final DateTimeFormatter DATETIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final Pattern NUMBER = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

    public static final String DEFAULT_TABLE = "jupiter_siem.ocsf_events";

    private final FieldMapping fieldMapping;
    private final String table;
    private final Clock clock;

    public ClickHouseSqlBuilder(FieldMapping fieldMapping, String table, Clock clock) {
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.fieldMapping = fieldMapping;
        this.table = table;
        this.clock = clock;
    }

    public FieldMapping getFieldMapping() {
        return fieldMapping;
    }

    /**
     * Build the complete query.
     *
     * @throws SqlCompilationException if the AST cannot be expressed in SQL
     */
    public String build(QueryAst ast) {
        StringBuilder sql = new StringBuilder(buildUnpaged(ast));

        if (!ast.getOrderBy().isEmpty()) {
            sql.append(" ORDER BY ").append(buildOrderByClause(ast));
        }

        if (ast.getLimit() != null) {
            sql.append(" LIMIT ").append(ast.getLimit());
            if (ast.getOffset() != null) {
                sql.append(" OFFSET ").append(ast.getOffset());
            }
        } else if (ast.getOffset() != null) {
            sql.append(" OFFSET ").append(ast.getOffset()).append(" ROWS");
        }

        String compiled = sql.toString();
        logger.debug("Compiled ClickHouse SQL: {}", compiled);
        return compiled;
    }

    /**
     * Count of all rows the query would return without ORDER BY, LIMIT and
     * OFFSET.
     */
    public String buildCount(QueryAst ast) {
        return "SELECT count() FROM (" + buildUnpaged(ast) + ")";
    }

    private String buildUnpaged(QueryAst ast) {
        StringBuilder sql = new StringBuilder();

        // SELECT clause
        sql.append("SELECT ").append(buildSelectClause(ast.getSelect(), ast.getGroupBy()));

        // FROM clause
        sql.append(" FROM ").append(table);

        // WHERE clause
        List<String> where = new ArrayList<>();
        if (ast.getTenantId() != null) {
            where.add(fieldMapping.toColumn("tenant_id") + " = " + quote(ast.getTenantId()));
        }
        buildTimeClause(ast.getTimeRange()).ifPresent(where::add);
        if (ast.getWhere() != null) {
            where.add(buildExpression(ast.getWhere()));
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }

        // GROUP BY / HAVING
        GroupBy groupBy = ast.getGroupBy();
        if (groupBy != null) {
            if (groupBy.getFields().isEmpty()) {
                throw new SqlCompilationException("GROUP BY requires at least one field");
            }
            sql.append(" GROUP BY ").append(groupBy.getFields().stream()
                .map(this::column)
                .collect(Collectors.joining(", ")));
            if (groupBy.getHaving() != null) {
                sql.append(" HAVING ").append(buildExpression(groupBy.getHaving()));
            }
        }

        return sql.toString();
    }

    private String buildSelectClause(List<SelectField> select, GroupBy groupBy) {
        if (select.isEmpty()) {
            if (groupBy == null) {
                return "*";
            }
            List<String> parts = new ArrayList<>();
            for (Field field : groupBy.getFields()) {
                parts.add(aliasedColumn(field, null));
            }
            parts.add("count() AS count");
            return String.join(", ", parts);
        }

        List<String> parts = new ArrayList<>();
        for (SelectField selectField : select) {
            if (selectField.getAlias() != null && !AstValidator.isValidAlias(selectField.getAlias())) {
                throw new SqlCompilationException("Invalid alias: " + selectField.getAlias());
            }
            Operand operand = selectField.getField();
            if (operand instanceof Field) {
                Field field = (Field) operand;
                parts.add(field.isWildcard() ? "*" : aliasedColumn(field, selectField.getAlias()));
            } else if (operand instanceof FunctionCall) {
                parts.add(buildFunction((FunctionCall) operand) + " AS " + backtick(selectField.getOutputName()));
            } else {
                throw new SqlCompilationException("Unsupported SELECT entry: " + operand);
            }
        }
        return String.join(", ", parts);
    }

    /**
     * Mapped columns are renamed back to the logical field name so rows carry
     * the same keys as the in-memory provider.
     */
    private String aliasedColumn(Field field, String alias) {
        String column = column(field);
        String outputName = alias != null ? alias : field.getName();
        return column.equals(outputName) ? column : column + " AS " + backtick(outputName);
    }

    private Optional<String> buildTimeClause(TimeRange timeRange) {
        if (timeRange == null) {
            return Optional.empty();
        }
        String timeColumn = fieldMapping.toColumn("time");
        List<String> bounds = new ArrayList<>();
        if (timeRange.getStart() != null) {
            bounds.add(timeColumn + " >= " + quote(DATETIME_FORMATTER.format(timeRange.getStart())));
        }
        if (timeRange.getEnd() != null) {
            bounds.add(timeColumn + " <= " + quote(DATETIME_FORMATTER.format(timeRange.getEnd())));
        }
        if (timeRange.isRelative()) {
            Instant cutoff = timeRange.resolveCutoff(clock)
                .orElseThrow(() -> new SqlCompilationException(
                    "Invalid relative time range: " + timeRange.getLast()));
            bounds.add(timeColumn + " >= " + quote(DATETIME_FORMATTER.format(cutoff)));
        }
        return bounds.isEmpty() ? Optional.empty() : Optional.of(String.join(" AND ", bounds));
    }

    private String buildExpression(Expression expression) {
        if (expression instanceof LogicalExpression) {
            LogicalExpression logical = (LogicalExpression) expression;
            List<Expression> children = logical.getConditions();
            if (children.isEmpty()) {
                throw new SqlCompilationException(logical.getOperator().name()
                    + " expression requires at least one condition");
            }
            return switch (logical.getOperator()) {
                case AND -> "(" + children.stream().map(this::buildExpression)
                    .collect(Collectors.joining(" AND ")) + ")";
                case OR -> "(" + children.stream().map(this::buildExpression)
                    .collect(Collectors.joining(" OR ")) + ")";
                // only the first child is evaluated; NULL (missing value) counts as no match
                case NOT -> "NOT ifNull((" + buildExpression(children.get(0)) + "), 0)";
            };
        }
        if (expression instanceof Condition) {
            return buildCondition((Condition) expression);
        }
        throw new SqlCompilationException("Unsupported expression: " + expression);
    }

    private String buildCondition(Condition condition) {
        ComparisonOperator operator = condition.getOperator();
        String left = operand(condition.getLeft());

        if (operator == ComparisonOperator.IS_NULL) {
            return left + " IS NULL";
        }
        if (operator == ComparisonOperator.IS_NOT_NULL) {
            return left + " IS NOT NULL";
        }

        Operand right = condition.getRight();
        if (right == null) {
            throw new SqlCompilationException("Operator " + operator.getValue() + " requires a value");
        }
        if (operator.isSetMembership()) {
            return buildSetMembership(left, right, operator == ComparisonOperator.NOT_IN);
        }
        if (right instanceof Field) {
            return buildFieldComparison(left, operator, column((Field) right));
        }
        if (!(right instanceof Literal)) {
            throw new SqlCompilationException("Operator " + operator.getValue()
                + " requires a literal or field, got: " + right);
        }

        Literal literal = (Literal) right;
        if (literal.getValue() == null) {
            // comparisons with NULL never match
            return "0";
        }
        String text = literal.asText();

        return switch (operator) {
            case EQUALS -> buildEquality(left, literal, false);
            case NOT_EQUALS -> buildEquality(left, literal, true);
            case GT, GTE, LT, LTE -> buildOrdering(left, literal, operator);
            case CONTAINS -> "toString(" + left + ") ILIKE " + quote("%" + escapeLike(text) + "%");
            case STARTS_WITH -> "toString(" + left + ") ILIKE " + quote(escapeLike(text) + "%");
            case ENDS_WITH -> "toString(" + left + ") ILIKE " + quote("%" + escapeLike(text));
            case REGEX -> "match(toString(" + left + "), " + quote("(?i)" + text) + ")";
            case IN_SUBNET -> "isIPAddressInRange(toString(" + left + "), " + quote(text) + ")";
            default -> throw new SqlCompilationException("Unsupported operator: " + operator.getValue());
        };
    }

    private String buildEquality(String left, Literal literal, boolean negate) {
        String comparator = negate ? " != " : " = ";
        LiteralType type = literal.getLiteralType();
        if (type.isNumeric()) {
            return "toFloat64OrNull(toString(" + left + "))" + comparator + number(literal);
        }
        if (type == LiteralType.BOOLEAN) {
            Optional<Boolean> expected = toBoolean(literal.getValue());
            if (expected.isEmpty()) {
                return "0";
            }
            boolean matchTrue = expected.get() != negate;
            return "lowerUTF8(toString(" + left + ")) IN "
                + (matchTrue ? "('true', '1')" : "('false', '0')");
        }
        if (type == LiteralType.TIMESTAMP) {
            return left + comparator + timestamp(literal.asText());
        }
        return "lowerUTF8(toString(" + left + "))" + comparator + "lowerUTF8(" + quote(literal.asText()) + ")";
    }

    private String buildOrdering(String left, Literal literal, ComparisonOperator operator) {
        String symbol = orderingSymbol(operator);
        if (literal.getLiteralType() == LiteralType.TIMESTAMP) {
            return left + " " + symbol + " " + timestamp(literal.asText());
        }
        String right;
        if (literal.getLiteralType().isNumeric() || literal.getValue() instanceof Boolean
                || NUMBER.matcher(literal.asText().trim()).matches()) {
            right = number(literal);
        } else {
            // never numeric, so never matches
            right = "toFloat64OrNull(" + quote(literal.asText()) + ")";
        }
        return "toFloat64OrNull(toString(" + left + ")) " + symbol + " " + right;
    }

    private String buildFieldComparison(String left, ComparisonOperator operator, String right) {
        if (operator.isOrdering()) {
            return "toFloat64OrNull(toString(" + left + ")) " + orderingSymbol(operator)
                + " toFloat64OrNull(toString(" + right + "))";
        }
        String leftText = "lowerUTF8(toString(" + left + "))";
        String rightText = "lowerUTF8(toString(" + right + "))";
        return switch (operator) {
            case EQUALS -> leftText + " = " + rightText;
            case NOT_EQUALS -> leftText + " != " + rightText;
            case CONTAINS -> "position(" + leftText + ", " + rightText + ") > 0";
            case STARTS_WITH -> "startsWith(" + leftText + ", " + rightText + ")";
            case ENDS_WITH -> "endsWith(" + leftText + ", " + rightText + ")";
            default -> "0";
        };
    }

    private String buildSetMembership(String left, Operand right, boolean negate) {
        List<Literal> values;
        if (right instanceof LiteralList) {
            values = ((LiteralList) right).getValues();
        } else if (right instanceof Literal) {
            values = List.of((Literal) right);
        } else {
            throw new SqlCompilationException("IN requires literal values, got: " + right);
        }
        List<String> rendered = values.stream()
            .map(Literal::getValue)
            .filter(Objects::nonNull)
            .map(value -> "lowerUTF8(" + quote(String.valueOf(value)) + ")")
            .collect(Collectors.toList());
        if (rendered.isEmpty()) {
            return negate ? left + " IS NOT NULL" : "0";
        }
        return "lowerUTF8(toString(" + left + "))" + (negate ? " NOT IN (" : " IN (")
            + String.join(", ", rendered) + ")";
    }

    private String buildOrderByClause(QueryAst ast) {
        Set<String> outputNames = outputNames(ast);
        List<String> keys = new ArrayList<>();
        for (OrderBy orderBy : ast.getOrderBy()) {
            String name = orderBy.getField().getName();
            String key = outputNames.contains(name) ? backtick(name) : column(orderBy.getField());
            keys.add(key + (orderBy.isAscending() ? " ASC" : " DESC"));
        }
        return String.join(", ", keys);
    }

    private Set<String> outputNames(QueryAst ast) {
        Set<String> names = new HashSet<>();
        if (ast.getSelect().isEmpty() && ast.getGroupBy() != null) {
            ast.getGroupBy().getFields().forEach(field -> names.add(field.getName()));
            names.add("count");
        }
        for (SelectField selectField : ast.getSelect()) {
            Operand operand = selectField.getField();
            if (operand instanceof Field && ((Field) operand).isWildcard()) {
                continue;
            }
            names.add(selectField.getOutputName());
        }
        return names;
    }

    private String operand(Operand operand) {
        if (operand instanceof Field) {
            return column((Field) operand);
        }
        if (operand instanceof FunctionCall) {
            return buildFunction((FunctionCall) operand);
        }
        if (operand instanceof Literal) {
            return serializeLiteral((Literal) operand);
        }
        throw new SqlCompilationException("Unsupported operand: " + operand);
    }

    private String buildFunction(FunctionCall function) {
        List<String> args = new ArrayList<>();
        for (Operand arg : function.getArgs()) {
            if (arg instanceof Field && ((Field) arg).isWildcard()) {
                continue;
            }
            args.add(operand(arg));
        }
        return function.getName().getClickHouseName() + "(" + String.join(", ", args) + ")";
    }

    /**
     * Column for a logical field name
     */
    String column(Field field) {
        String name = field.getName();
        if (field.isWildcard() || !AstValidator.isValidFieldName(name)) {
            throw new SqlCompilationException("Invalid field name: " + name);
        }
        return fieldMapping.toColumn(name);
    }

    /**
     * Render a literal by type: quoted strings, raw numbers, 1/0 booleans,
     * parsed ISO timestamps and typed IP addresses.
     */
    String serializeLiteral(Literal literal) {
        Object value = literal.getValue();
        if (value == null) {
            return "NULL";
        }
        return switch (literal.getLiteralType()) {
            case STRING -> quote(literal.asText());
            case INTEGER, FLOAT -> number(literal);
            case BOOLEAN -> toBoolean(value)
                .map(flag -> flag ? "1" : "0")
                .orElseThrow(() -> new SqlCompilationException("Invalid boolean literal: " + value));
            case TIMESTAMP -> timestamp(literal.asText());
            case IP_ADDRESS -> (literal.asText().contains(":") ? "toIPv6(" : "toIPv4(")
                + quote(literal.asText()) + ")";
        };
    }

    private String number(Literal literal) {
        Object value = literal.getValue();
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new SqlCompilationException("Non-finite numeric literal: " + value);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        String text = String.valueOf(value).trim();
        if (!NUMBER.matcher(text).matches()) {
            throw new SqlCompilationException("Literal of type " + literal.getLiteralType().getValue()
                + " has a non-numeric value: " + value);
        }
        return text;
    }

    private static String timestamp(String isoValue) {
        return "parseDateTime64BestEffort(" + quote(isoValue) + ", 3, 'UTC')";
    }

    private static Optional<Boolean> toBoolean(Object value) {
        if (value instanceof Boolean) {
            return Optional.of((Boolean) value);
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text) || "1".equals(text)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equals(text) || "0".equals(text)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    private static String orderingSymbol(ComparisonOperator operator) {
        return switch (operator) {
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
            default -> throw new SqlCompilationException("Not an ordering operator: " + operator.getValue());
        };
    }

    private static String backtick(String name) {
        return "`" + name + "`";
    }

    /**
     * Quote a string literal, doubling single quotes and backslashes
     */
    static String quote(String value) {
        return "'" + escape(value) + "'";
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "''");
    }

    /**
     * Escape LIKE metacharacters so the value matches literally
     */
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
