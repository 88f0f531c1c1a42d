package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate functions usable in SELECT lists and HAVING clauses.
 */
public enum AggregateFunction {

    COUNT("count", "count"),
    SUM("sum", "sum"),
    AVG("avg", "avg"),
    MIN("min", "min"),
    MAX("max", "max"),
    COUNT_DISTINCT("count_distinct", "uniqExact"),
    FIRST("first", "any"),
    LAST("last", "anyLast");

    private final String value;
    private final String clickHouseName;

    AggregateFunction(String value, String clickHouseName) {
        this.value = value;
        this.clickHouseName = clickHouseName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Name of the equivalent ClickHouse aggregate.
     */
    public String getClickHouseName() {
        return clickHouseName;
    }

    @JsonCreator
    public static AggregateFunction fromValue(String value) {
        for (AggregateFunction function : values()) {
            if (function.value.equalsIgnoreCase(value) || function.name().equalsIgnoreCase(value)) {
                return function;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate function: " + value);
    }
}
