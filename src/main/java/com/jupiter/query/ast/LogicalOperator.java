package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical connectives for combining conditions.
 */
public enum LogicalOperator {

    AND("and"),
    OR("or"),
    NOT("not");

    private final String value;

    LogicalOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LogicalOperator fromValue(String value) {
        for (LogicalOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown logical operator: " + value);
    }
}
