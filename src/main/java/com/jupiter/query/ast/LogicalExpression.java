package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * AND / OR / NOT over child expressions.
 *
 * NOT is expected to carry exactly one child and AND / OR at least one.
 * Evaluators only look at the first child of a NOT node; extra children are
 * reported as a validation warning.
 */
public final class LogicalExpression implements Expression {

    private final LogicalOperator operator;
    private final List<Expression> conditions;

    @JsonCreator
    public LogicalExpression(@JsonProperty("operator") LogicalOperator operator,
                             @JsonProperty("conditions") List<Expression> conditions) {
        this.operator = Objects.requireNonNull(operator, "Logical operator must not be null");
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static LogicalExpression and(Expression... conditions) {
        return new LogicalExpression(LogicalOperator.AND, Arrays.asList(conditions));
    }

    public static LogicalExpression or(Expression... conditions) {
        return new LogicalExpression(LogicalOperator.OR, Arrays.asList(conditions));
    }

    public static LogicalExpression not(Expression condition) {
        return new LogicalExpression(LogicalOperator.NOT, List.of(condition));
    }

    @JsonProperty("operator")
    public LogicalOperator getOperator() {
        return operator;
    }

    @JsonProperty("conditions")
    public List<Expression> getConditions() {
        return conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalExpression)) return false;
        LogicalExpression other = (LogicalExpression) o;
        return operator == other.operator && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, conditions);
    }

    @Override
    public String toString() {
        return operator.getValue() + conditions;
    }
}
