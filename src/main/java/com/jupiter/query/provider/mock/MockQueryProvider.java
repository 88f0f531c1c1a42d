package com.jupiter.query.provider.mock;

import com.jupiter.domain.QueryResult;
import com.jupiter.domain.ValidationResult;
import com.jupiter.query.ast.Field;
import com.jupiter.query.ast.FunctionCall;
import com.jupiter.query.ast.GroupBy;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.Operand;
import com.jupiter.query.ast.OrderBy;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.ast.SelectField;
import com.jupiter.query.ast.TimeRange;
import com.jupiter.query.provider.AstValidator;
import com.jupiter.query.provider.QueryBackend;
import com.jupiter.query.provider.QueryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Reference query executor over an in-memory set of OCSF records.
 *
 * The pipeline runs in this order: tenant filter, WHERE, time range,
 * GROUP BY/HAVING or SELECT projection, ORDER BY, then OFFSET and LIMIT.
 * {@code total} is the row count before pagination.
 *
 * The record set is immutable, so a single instance serves concurrent
 * callers without locking.
 */
public class MockQueryProvider implements QueryProvider {

    private static final Logger log = LoggerFactory.getLogger(MockQueryProvider.class);

    private final List<Map<String, Object>> records;
    private final AstValidator validator;
    private final Clock clock;

    public MockQueryProvider(List<Map<String, Object>> records, AstValidator validator, Clock clock) {
        this.records = MockDatasetLoader.freeze(records);
        this.validator = validator;
        this.clock = clock;
        log.info("Mock query provider initialized with {} records", this.records.size());
    }

    @Override
    public QueryBackend backend() {
        return QueryBackend.MOCK;
    }

    @Override
    public String description() {
        return "Mock provider with sample OCSF data for development";
    }

    @Override
    public ValidationResult validateAst(QueryAst ast) {
        try {
            return validator.validate(ast);
        } catch (RuntimeException e) {
            log.error("Mock query validation failed: {}", e.getMessage(), e);
            return ValidationResult.invalid("Validation failed: " + describe(e));
        }
    }

    @Override
    public QueryResult executeAst(QueryAst ast) {
        long startNanos = System.nanoTime();
        QueryResult result;
        try {
            ValidationResult validation = validator.validate(ast);
            if (!validation.isValid()) {
                result = QueryResult.failure(String.join("; ", validation.getErrors()));
            } else {
                result = execute(ast);
            }
        } catch (RuntimeException e) {
            log.error("Mock query execution failed: {}", e.getMessage(), e);
            result = QueryResult.failure(describe(e));
        }
        result.setExecutionTime((System.nanoTime() - startNanos) / 1_000_000_000.0);
        return result;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private QueryResult execute(QueryAst ast) {
        List<Map<String, Object>> filtered = records.stream()
            .filter(record -> matchesTenant(record, ast.getTenantId()))
            .filter(record -> ast.getWhere() == null
                || new ConditionEvaluator(recordResolver(record)).evaluate(ast.getWhere()))
            .filter(timeFilter(ast.getTimeRange()))
            .collect(Collectors.toList());

        List<ResultRow> rows;
        if (ast.getGroupBy() != null) {
            rows = group(filtered, ast.getGroupBy(), ast.getSelect());
        } else {
            rows = project(filtered, ast.getSelect());
        }

        if (!ast.getOrderBy().isEmpty()) {
            rows.sort(orderComparator(ast.getOrderBy(), outputNames(ast)));
        }

        int total = rows.size();
        int offset = ast.getOffset() != null ? ast.getOffset() : 0;
        int from = Math.min(offset, total);
        int to = ast.getLimit() != null ? (int) Math.min(total, (long) from + ast.getLimit()) : total;
        List<Map<String, Object>> page = rows.subList(from, to).stream()
            .map(ResultRow::values)
            .collect(Collectors.toList());

        log.debug("Mock query matched {} records, returning {} rows", total, page.size());

        QueryResult result = QueryResult.success(page, total);
        result.setHasMore(to < total);
        return result;
    }

    private static boolean matchesTenant(Map<String, Object> record, String tenantId) {
        if (tenantId == null) {
            return true;
        }
        Object value = record.get("tenant_id");
        return value != null && tenantId.equals(String.valueOf(value));
    }

    private Predicate<Map<String, Object>> timeFilter(TimeRange timeRange) {
        if (timeRange == null) {
            return record -> true;
        }
        Instant start = timeRange.getStart();
        Instant end = timeRange.getEnd();
        Optional<Instant> cutoff = timeRange.resolveCutoff(clock);
        if (timeRange.isRelative() && cutoff.isEmpty()) {
            log.warn("Ignoring unparseable relative time range '{}'", timeRange.getLast());
        }
        if (start == null && end == null && cutoff.isEmpty()) {
            return record -> true;
        }
        return record -> {
            Optional<Instant> time = RecordValues.toInstant(record.get("time"));
            if (time.isEmpty()) {
                return false;
            }
            Instant eventTime = time.get();
            if (start != null && eventTime.isBefore(start)) {
                return false;
            }
            if (end != null && eventTime.isAfter(end)) {
                return false;
            }
            return cutoff.isEmpty() || !eventTime.isBefore(cutoff.get());
        };
    }

    private static Function<Operand, Object> recordResolver(Map<String, Object> record) {
        return operand -> {
            if (operand instanceof Field) {
                return RecordValues.resolve(record, ((Field) operand).getName());
            }
            if (operand instanceof Literal) {
                return ((Literal) operand).getValue();
            }
            if (operand instanceof FunctionCall) {
                return Aggregator.compute((FunctionCall) operand, List.of(record));
            }
            return null;
        };
    }

    private static Function<Operand, Object> groupResolver(List<Map<String, Object>> group) {
        return operand -> {
            if (operand instanceof FunctionCall) {
                return Aggregator.compute((FunctionCall) operand, group);
            }
            return recordResolver(group.get(0)).apply(operand);
        };
    }

    private List<ResultRow> group(List<Map<String, Object>> filtered, GroupBy groupBy, List<SelectField> select) {
        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> record : filtered) {
            List<Object> key = new ArrayList<>(groupBy.getFields().size());
            for (Field field : groupBy.getFields()) {
                key.add(RecordValues.resolve(record, field.getName()));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<ResultRow> rows = new ArrayList<>();
        for (Map.Entry<List<Object>, List<Map<String, Object>>> entry : groups.entrySet()) {
            List<Map<String, Object>> members = entry.getValue();
            if (groupBy.getHaving() != null
                    && !new ConditionEvaluator(groupResolver(members)).evaluate(groupBy.getHaving())) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            if (select.isEmpty()) {
                for (int i = 0; i < groupBy.getFields().size(); i++) {
                    row.put(groupBy.getFields().get(i).getName(), entry.getKey().get(i));
                }
                row.put("count", (long) members.size());
            } else {
                Function<Operand, Object> resolver = groupResolver(members);
                for (SelectField selectField : select) {
                    row.put(selectField.getOutputName(), resolver.apply(selectField.getField()));
                }
            }
            rows.add(new ResultRow(row, members.get(0)));
        }
        return rows;
    }

    private List<ResultRow> project(List<Map<String, Object>> filtered, List<SelectField> select) {
        List<ResultRow> rows = new ArrayList<>(filtered.size());
        if (!select.isEmpty() && select.stream().allMatch(SelectField::isAggregate)) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (SelectField selectField : select) {
                row.put(selectField.getOutputName(), Aggregator.compute((FunctionCall) selectField.getField(), filtered));
            }
            rows.add(new ResultRow(row, filtered.isEmpty() ? Map.of() : filtered.get(0)));
            return rows;
        }

        for (Map<String, Object> record : filtered) {
            if (select.isEmpty()) {
                rows.add(new ResultRow(new LinkedHashMap<>(record), record));
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (SelectField selectField : select) {
                Operand operand = selectField.getField();
                if (operand instanceof Field && ((Field) operand).isWildcard()) {
                    row.putAll(record);
                } else if (operand instanceof Field) {
                    row.put(selectField.getOutputName(), RecordValues.resolve(record, ((Field) operand).getName()));
                }
            }
            rows.add(new ResultRow(row, record));
        }
        return rows;
    }

    /**
     * Names an ORDER BY key can refer to in the output. Any other key is read
     * from the source record, as the SQL backend orders by the column.
     */
    private static Set<String> outputNames(QueryAst ast) {
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

    /**
     * Sort on every ORDER BY key in turn, nulls last in both directions.
     */
    private static Comparator<ResultRow> orderComparator(List<OrderBy> orderBy, Set<String> outputNames) {
        Comparator<ResultRow> comparator = null;
        for (OrderBy key : orderBy) {
            String name = key.getField().getName();
            boolean fromOutput = outputNames.contains(name);
            Comparator<ResultRow> next = (a, b) -> {
                Object left = fromOutput ? a.values().get(name) : RecordValues.resolve(a.source(), name);
                Object right = fromOutput ? b.values().get(name) : RecordValues.resolve(b.source(), name);
                if (left == null || right == null) {
                    return RecordValues.NATURAL_ORDER.compare(left, right);
                }
                int comparison = RecordValues.NATURAL_ORDER.compare(left, right);
                return key.isAscending() ? comparison : -comparison;
            };
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    /**
     * Output row plus the record it was produced from
     */
    private static final class ResultRow {

        private final Map<String, Object> values;
        private final Map<String, Object> source;

        ResultRow(Map<String, Object> values, Map<String, Object> source) {
            this.values = values;
            this.source = source;
        }

        Map<String, Object> values() {
            return values;
        }

        Map<String, Object> source() {
            return source;
        }
    }
}
