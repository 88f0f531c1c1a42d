package com.jupiter.query.provider.mock;

import com.jupiter.query.ast.AggregateFunction;
import com.jupiter.query.ast.Field;
import com.jupiter.query.ast.FunctionCall;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.Operand;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Computes aggregate functions over a group of records.
 *
 * Null and missing values are skipped, so {@code count(field)} counts
 * non-null values while {@code count()} and {@code count(*)} count rows.
 */
final class Aggregator {

    private Aggregator() {
        throw new UnsupportedOperationException("Aggregator is a utility class and cannot be instantiated");
    }

    static Object compute(FunctionCall function, List<Map<String, Object>> rows) {
        Operand argument = function.getArgs().isEmpty() ? null : function.getArgs().get(0);
        boolean allRows = argument == null || (argument instanceof Field && ((Field) argument).isWildcard());

        if (function.getName() == AggregateFunction.COUNT && allRows) {
            return (long) rows.size();
        }

        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object value = argumentValue(argument, row, rows);
            if (value != null) {
                values.add(value);
            }
        }

        return switch (function.getName()) {
            case COUNT -> (long) values.size();
            case COUNT_DISTINCT -> {
                Set<Object> distinct = new HashSet<>(values);
                yield (long) distinct.size();
            }
            case SUM -> sum(values);
            case AVG -> average(values);
            case MIN -> values.stream().min(RecordValues.NATURAL_ORDER).orElse(null);
            case MAX -> values.stream().max(RecordValues.NATURAL_ORDER).orElse(null);
            case FIRST -> values.isEmpty() ? null : values.get(0);
            case LAST -> values.isEmpty() ? null : values.get(values.size() - 1);
        };
    }

    private static Object argumentValue(Operand argument, Map<String, Object> row, List<Map<String, Object>> rows) {
        if (argument instanceof Field) {
            return RecordValues.resolve(row, ((Field) argument).getName());
        }
        if (argument instanceof Literal) {
            return ((Literal) argument).getValue();
        }
        if (argument instanceof FunctionCall) {
            return compute((FunctionCall) argument, rows);
        }
        return null;
    }

    /**
     * Sum of the numeric values. Stays integral when every input is an
     * integral number.
     */
    private static Number sum(List<Object> values) {
        boolean integral = true;
        long longSum = 0;
        double doubleSum = 0;
        for (Object value : values) {
            OptionalDouble number = RecordValues.toDouble(value);
            if (number.isEmpty()) {
                continue;
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                longSum += ((Number) value).longValue();
            } else {
                integral = false;
            }
            doubleSum += number.getAsDouble();
        }
        return integral ? (Number) longSum : (Number) doubleSum;
    }

    private static Double average(List<Object> values) {
        double total = 0;
        int count = 0;
        for (Object value : values) {
            OptionalDouble number = RecordValues.toDouble(value);
            if (number.isPresent()) {
                total += number.getAsDouble();
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }
}
