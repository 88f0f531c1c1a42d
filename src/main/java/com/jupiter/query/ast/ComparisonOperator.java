package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators for WHERE and HAVING conditions.
 *
 * The JSON representation uses the short wire names of the saved-query
 * format ({@code eq}, {@code gte}, {@code in_subnet}, ...).
 */
public enum ComparisonOperator {

    EQUALS("eq"),
    NOT_EQUALS("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    REGEX("regex"),
    IN("in"),
    NOT_IN("not_in"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null"),
    IN_SUBNET("in_subnet");

    private final String value;

    ComparisonOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * IS_NULL and IS_NOT_NULL take no right operand.
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    public boolean isSetMembership() {
        return this == IN || this == NOT_IN;
    }

    public boolean isOrdering() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    public boolean isPattern() {
        return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        for (ComparisonOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value) || operator.name().equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
