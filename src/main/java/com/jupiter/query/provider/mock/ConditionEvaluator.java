package com.jupiter.query.provider.mock;

import com.jupiter.query.ast.ComparisonOperator;
import com.jupiter.query.ast.Condition;
import com.jupiter.query.ast.Expression;
import com.jupiter.query.ast.Field;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.LiteralList;
import com.jupiter.query.ast.LiteralType;
import com.jupiter.query.ast.LogicalExpression;
import com.jupiter.query.ast.Operand;
import com.jupiter.query.provider.CidrBlock;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Evaluates WHERE and HAVING expressions.
 *
 * Operand values are supplied by a resolver so the same rules apply to single
 * records (WHERE) and to groups (HAVING, where functions are computed over
 * the group). A missing value never matches, except for {@code is_null}.
 */
final class ConditionEvaluator {

    private final Function<Operand, Object> resolver;

    ConditionEvaluator(Function<Operand, Object> resolver) {
        this.resolver = resolver;
    }

    boolean evaluate(Expression expression) {
        if (expression instanceof LogicalExpression) {
            LogicalExpression logical = (LogicalExpression) expression;
            List<Expression> children = logical.getConditions();
            return switch (logical.getOperator()) {
                case AND -> children.stream().allMatch(this::evaluate);
                case OR -> children.stream().anyMatch(this::evaluate);
                // only the first child is evaluated
                case NOT -> !children.isEmpty() && !evaluate(children.get(0));
            };
        }
        if (expression instanceof Condition) {
            return evaluateCondition((Condition) expression);
        }
        return false;
    }

    private boolean evaluateCondition(Condition condition) {
        ComparisonOperator operator = condition.getOperator();
        Object value = resolver.apply(condition.getLeft());

        if (operator == ComparisonOperator.IS_NULL) {
            return value == null;
        }
        if (value == null) {
            return false;
        }
        if (operator == ComparisonOperator.IS_NOT_NULL) {
            return true;
        }

        Operand right = condition.getRight();
        if (operator.isSetMembership()) {
            return matchesSet(value, right, operator == ComparisonOperator.NOT_IN);
        }
        if (right instanceof Field) {
            return compareWithField(value, operator, resolver.apply(right));
        }
        if (!(right instanceof Literal)) {
            return false;
        }
        Literal literal = (Literal) right;
        if (literal.getValue() == null) {
            return false;
        }

        return switch (operator) {
            case EQUALS -> equalsLiteral(value, literal).orElse(false);
            case NOT_EQUALS -> equalsLiteral(value, literal).map(matched -> !matched).orElse(false);
            case GT, GTE, LT, LTE -> compareOrdering(value, literal, operator);
            case CONTAINS -> RecordValues.text(value).contains(RecordValues.text(literal.getValue()));
            case STARTS_WITH -> RecordValues.text(value).startsWith(RecordValues.text(literal.getValue()));
            case ENDS_WITH -> RecordValues.text(value).endsWith(RecordValues.text(literal.getValue()));
            case REGEX -> Pattern.compile(literal.asText(), Pattern.CASE_INSENSITIVE)
                .matcher(String.valueOf(value)).find();
            case IN_SUBNET -> CidrBlock.parse(literal.asText())
                .map(block -> block.contains(String.valueOf(value)))
                .orElse(false);
            default -> false;
        };
    }

    /**
     * Empty when the two values cannot be compared, which fails closed for
     * both equality and inequality.
     */
    private Optional<Boolean> equalsLiteral(Object value, Literal literal) {
        LiteralType type = literal.getLiteralType();
        if (type.isNumeric()) {
            OptionalDouble left = RecordValues.toDouble(value);
            OptionalDouble right = RecordValues.literalToDouble(literal.getValue());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(left.getAsDouble() == right.getAsDouble());
        }
        if (type == LiteralType.BOOLEAN) {
            Optional<Boolean> left = RecordValues.toBoolean(value);
            Optional<Boolean> right = RecordValues.toBoolean(literal.getValue());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(left.get().equals(right.get()));
        }
        if (type == LiteralType.TIMESTAMP) {
            Optional<Instant> left = RecordValues.toInstant(value);
            Optional<Instant> right = RecordValues.toInstant(literal.getValue());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(left.get().equals(right.get()));
        }
        return Optional.of(RecordValues.text(value).equals(RecordValues.text(literal.getValue())));
    }

    private boolean compareOrdering(Object value, Literal literal, ComparisonOperator operator) {
        int comparison;
        if (literal.getLiteralType() == LiteralType.TIMESTAMP) {
            Optional<Instant> left = RecordValues.toInstant(value);
            Optional<Instant> right = RecordValues.toInstant(literal.getValue());
            if (left.isEmpty() || right.isEmpty()) {
                return false;
            }
            comparison = left.get().compareTo(right.get());
        } else {
            OptionalDouble left = RecordValues.toDouble(value);
            OptionalDouble right = RecordValues.literalToDouble(literal.getValue());
            if (left.isEmpty() || right.isEmpty()) {
                return false;
            }
            comparison = Double.compare(left.getAsDouble(), right.getAsDouble());
        }
        return orderingHolds(comparison, operator);
    }

    private boolean compareWithField(Object value, ComparisonOperator operator, Object other) {
        if (other == null) {
            return false;
        }
        if (operator.isOrdering()) {
            OptionalDouble left = RecordValues.toDouble(value);
            OptionalDouble right = RecordValues.toDouble(other);
            if (left.isEmpty() || right.isEmpty()) {
                return false;
            }
            return orderingHolds(Double.compare(left.getAsDouble(), right.getAsDouble()), operator);
        }
        String left = RecordValues.text(value);
        String right = RecordValues.text(other);
        return switch (operator) {
            case EQUALS -> left.equals(right);
            case NOT_EQUALS -> !left.equals(right);
            case CONTAINS -> left.contains(right);
            case STARTS_WITH -> left.startsWith(right);
            case ENDS_WITH -> left.endsWith(right);
            default -> false;
        };
    }

    private boolean matchesSet(Object value, Operand right, boolean negate) {
        List<Literal> candidates;
        if (right instanceof LiteralList) {
            candidates = ((LiteralList) right).getValues();
        } else if (right instanceof Literal) {
            candidates = List.of((Literal) right);
        } else {
            return false;
        }
        String text = RecordValues.text(value);
        boolean member = candidates.stream()
            .map(Literal::getValue)
            .filter(Objects::nonNull)
            .map(RecordValues::text)
            .anyMatch(text::equals);
        return negate != member;
    }

    private static boolean orderingHolds(int comparison, ComparisonOperator operator) {
        return switch (operator) {
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
            default -> false;
        };
    }
}
