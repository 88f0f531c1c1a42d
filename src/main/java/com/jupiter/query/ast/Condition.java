package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single comparison: {@code left operator right}.
 *
 * The left operand is a {@link Field} or a {@link FunctionCall}; the right
 * operand is a {@link Literal}, a {@link LiteralList} (IN / NOT_IN) or a
 * {@link Field}, and is absent for the unary IS_NULL / IS_NOT_NULL operators.
 * Shape rules are checked by validation rather than here so that malformed
 * ASTs submitted as JSON can be reported instead of rejected outright.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Condition implements Expression {

    private final Operand left;
    private final ComparisonOperator operator;
    private final Operand right;

    @JsonCreator
    public Condition(@JsonProperty("left") Operand left,
                     @JsonProperty("operator") ComparisonOperator operator,
                     @JsonProperty("right") Operand right) {
        this.left = Objects.requireNonNull(left, "Condition left operand must not be null");
        this.operator = Objects.requireNonNull(operator, "Condition operator must not be null");
        this.right = right;
    }

    public static Condition of(Operand left, ComparisonOperator operator, Operand right) {
        return new Condition(left, operator, right);
    }

    public static Condition of(String field, ComparisonOperator operator, Operand right) {
        return new Condition(Field.of(field), operator, right);
    }

    public static Condition eq(String field, String value) {
        return new Condition(Field.of(field), ComparisonOperator.EQUALS, Literal.string(value));
    }

    public static Condition in(String field, String... values) {
        return new Condition(Field.of(field), ComparisonOperator.IN, LiteralList.ofStrings(values));
    }

    public static Condition isNull(String field) {
        return new Condition(Field.of(field), ComparisonOperator.IS_NULL, null);
    }

    @JsonProperty("left")
    public Operand getLeft() {
        return left;
    }

    @JsonProperty("operator")
    public ComparisonOperator getOperator() {
        return operator;
    }

    @JsonProperty("right")
    public Operand getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition)) return false;
        Condition other = (Condition) o;
        return left.equals(other.left) && operator == other.operator && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getValue() + (right != null ? " " + right : "") + ")";
    }
}
