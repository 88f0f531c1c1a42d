package com.jupiter.query.provider;

import com.jupiter.domain.ValidationResult;
import com.jupiter.query.ast.ComparisonOperator;
import com.jupiter.query.ast.Condition;
import com.jupiter.query.ast.Expression;
import com.jupiter.query.ast.Field;
import com.jupiter.query.ast.FunctionCall;
import com.jupiter.query.ast.GroupBy;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.LiteralList;
import com.jupiter.query.ast.LogicalExpression;
import com.jupiter.query.ast.Operand;
import com.jupiter.query.ast.OrderBy;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.ast.SelectField;
import com.jupiter.query.ast.TimeRange;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural validation shared by every query provider.
 *
 * Errors make an AST non-executable; warnings flag queries that will run but
 * may be slow or behave differently than the caller expects.
 */
public class AstValidator {

    public static final int MAX_RECOMMENDED_LIMIT = 10000;

    private static final Pattern FIELD_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*$");
    private static final Pattern ALIAS = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern NUMBER = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern OR_TOKEN = Pattern.compile("\\s+OR\\s+", Pattern.CASE_INSENSITIVE);

    /**
     * Dotted identifier such as {@code src_endpoint.ip}. The wildcard is not
     * accepted here.
     */
    public static boolean isValidFieldName(String name) {
        return name != null && FIELD_NAME.matcher(name).matches();
    }

    public static boolean isValidAlias(String alias) {
        return alias != null && ALIAS.matcher(alias).matches();
    }

    public ValidationResult validate(QueryAst ast) {
        if (ast == null) {
            return ValidationResult.invalid("Query AST must not be null");
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (ast.getLimit() != null && ast.getLimit() < 0) {
            errors.add("LIMIT must not be negative: " + ast.getLimit());
        }
        if (ast.getOffset() != null && ast.getOffset() < 0) {
            errors.add("OFFSET must not be negative: " + ast.getOffset());
        }

        validateSelect(ast, errors);

        if (ast.getWhere() != null) {
            validateExpression(ast.getWhere(), false, errors, warnings);
        }

        GroupBy groupBy = ast.getGroupBy();
        if (groupBy != null) {
            if (groupBy.getFields().isEmpty()) {
                errors.add("GROUP BY requires at least one field");
            }
            for (Field field : groupBy.getFields()) {
                validateFieldName(field, "GROUP BY", errors);
            }
            if (groupBy.getHaving() != null) {
                validateExpression(groupBy.getHaving(), true, errors, warnings);
            }
        }

        for (OrderBy orderBy : ast.getOrderBy()) {
            validateFieldName(orderBy.getField(), "ORDER BY", errors);
        }

        validateTimeRange(ast.getTimeRange(), errors);

        if (ast.getTimeRange() == null) {
            warnings.add("No time range specified, query will scan all events");
        }
        if (ast.getLimit() != null && ast.getLimit() > MAX_RECOMMENDED_LIMIT) {
            warnings.add("Large LIMIT may impact performance");
        }
        if (ast.getSelect().isEmpty() && ast.getGroupBy() == null) {
            warnings.add("No SELECT fields specified, will return all fields");
        }
        if (ast.getWhere() == null && ast.getTimeRange() == null && ast.getTenantId() == null) {
            warnings.add("Query without filters may be slow on large datasets");
        }
        if (ast.getSourceText() != null && OR_TOKEN.matcher(ast.getSourceText()).find()) {
            warnings.add("Text query contains OR, all conditions are combined with AND");
        }

        return new ValidationResult(errors, warnings);
    }

    private void validateSelect(QueryAst ast, List<String> errors) {
        boolean hasAggregate = false;
        boolean hasPlainField = false;
        for (SelectField selectField : ast.getSelect()) {
            Operand operand = selectField.getField();
            if (operand instanceof Field) {
                Field field = (Field) operand;
                hasPlainField = true;
                if (!field.isWildcard()) {
                    validateFieldName(field, "SELECT", errors);
                }
            } else if (operand instanceof FunctionCall) {
                hasAggregate = true;
                validateFunction((FunctionCall) operand, errors);
            } else {
                errors.add("SELECT entries must be fields or aggregate functions: " + operand);
            }
            if (selectField.getAlias() != null && !isValidAlias(selectField.getAlias())) {
                errors.add("Invalid alias: " + selectField.getAlias());
            }
        }
        if (hasAggregate && hasPlainField && ast.getGroupBy() == null) {
            errors.add("Aggregate functions cannot be mixed with plain fields without GROUP BY");
        }
        if (ast.getGroupBy() != null) {
            for (SelectField selectField : ast.getSelect()) {
                if (selectField.getField() instanceof Field
                        && !ast.getGroupBy().getFields().contains((Field) selectField.getField())) {
                    errors.add("Field " + ((Field) selectField.getField()).getName()
                        + " must appear in GROUP BY or be used in an aggregate function");
                }
            }
        }
    }

    private void validateFunction(FunctionCall function, List<String> errors) {
        for (Operand arg : function.getArgs()) {
            if (arg instanceof Field) {
                Field field = (Field) arg;
                if (!field.isWildcard()) {
                    validateFieldName(field, "function argument", errors);
                }
            } else if (arg instanceof FunctionCall) {
                validateFunction((FunctionCall) arg, errors);
            } else if (!(arg instanceof Literal)) {
                errors.add("Unsupported argument for " + function.getName().getValue() + ": " + arg);
            }
        }
    }

    private void validateExpression(Expression expression, boolean allowAggregates,
                                    List<String> errors, List<String> warnings) {
        if (expression instanceof LogicalExpression) {
            LogicalExpression logical = (LogicalExpression) expression;
            List<Expression> children = logical.getConditions();
            switch (logical.getOperator()) {
                case AND, OR -> {
                    if (children.isEmpty()) {
                        errors.add(logical.getOperator().name() + " expression requires at least one condition");
                    }
                }
                case NOT -> {
                    if (children.isEmpty()) {
                        errors.add("NOT expression requires a condition");
                    } else if (children.size() > 1) {
                        warnings.add("NOT expression has " + children.size()
                            + " conditions, only the first one is evaluated");
                    }
                }
            }
            for (Expression child : children) {
                validateExpression(child, allowAggregates, errors, warnings);
            }
        } else if (expression instanceof Condition) {
            validateCondition((Condition) expression, allowAggregates, errors);
        } else {
            errors.add("Unsupported expression: " + expression);
        }
    }

    private void validateCondition(Condition condition, boolean allowAggregates, List<String> errors) {
        Operand left = condition.getLeft();
        ComparisonOperator operator = condition.getOperator();
        Operand right = condition.getRight();

        if (left instanceof Field) {
            Field field = (Field) left;
            if (field.isWildcard()) {
                errors.add("Wildcard field cannot be used in a condition");
            } else {
                validateFieldName(field, "condition", errors);
            }
        } else if (left instanceof FunctionCall) {
            if (!allowAggregates) {
                errors.add("Aggregate functions are not allowed in WHERE, use HAVING instead");
            }
            validateFunction((FunctionCall) left, errors);
        } else {
            errors.add("Left side of a condition must be a field or function: " + left);
        }

        if (operator.isUnary()) {
            return;
        }
        if (right == null) {
            errors.add("Operator " + operator.getValue() + " requires a value");
            return;
        }

        if (right instanceof LiteralList) {
            if (!operator.isSetMembership()) {
                errors.add("Operator " + operator.getValue() + " does not accept a list of values");
            }
        } else if (right instanceof Field) {
            if (operator.isSetMembership()) {
                errors.add("Operator " + operator.getValue() + " requires literal values, not a field");
            } else {
                validateFieldName((Field) right, "condition", errors);
            }
        } else if (right instanceof Literal) {
            validateLiteral((Literal) right, errors);
        } else {
            errors.add("Right side of a condition must be a literal, list or field: " + right);
        }
        if (right instanceof LiteralList) {
            for (Literal literal : ((LiteralList) right).getValues()) {
                validateLiteral(literal, errors);
            }
        }

        if (operator == ComparisonOperator.IN_SUBNET) {
            if (!(right instanceof Literal) || CidrBlock.parse(((Literal) right).asText()).isEmpty()) {
                errors.add("Operator in_subnet requires a CIDR literal, got: " + right);
            }
        }
        if (operator == ComparisonOperator.REGEX && right instanceof Literal) {
            String pattern = ((Literal) right).asText();
            if (pattern == null) {
                errors.add("Operator regex requires a pattern");
            } else {
                try {
                    Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    errors.add("Invalid regex pattern '" + pattern + "': " + e.getDescription());
                }
            }
        }
    }

    private void validateLiteral(Literal literal, List<String> errors) {
        if (literal.getValue() == null) {
            return;
        }
        switch (literal.getLiteralType()) {
            case INTEGER, FLOAT -> {
                if (!(literal.getValue() instanceof Number) && !NUMBER.matcher(literal.asText()).matches()) {
                    errors.add("Literal of type " + literal.getLiteralType().getValue()
                        + " has a non-numeric value: " + literal.getValue());
                }
            }
            case TIMESTAMP -> {
                try {
                    Instant.parse(literal.asText());
                } catch (DateTimeParseException e) {
                    errors.add("Timestamp literal is not an ISO-8601 instant: " + literal.getValue());
                }
            }
            case IP_ADDRESS -> {
                if (CidrBlock.parseAddress(literal.asText()).isEmpty()) {
                    errors.add("Invalid IP address literal: " + literal.getValue());
                }
            }
            default -> {
            }
        }
    }

    private void validateFieldName(Field field, String clause, List<String> errors) {
        if (!isValidFieldName(field.getName())) {
            errors.add("Invalid field name in " + clause + ": " + field.getName());
        }
    }

    private void validateTimeRange(TimeRange timeRange, List<String> errors) {
        if (timeRange == null) {
            return;
        }
        if (timeRange.isRelative() && timeRange.getRelativeDuration().isEmpty()) {
            errors.add("Invalid relative time range '" + timeRange.getLast()
                + "', expected <N>m, <N>h or <N>d");
        }
        if (timeRange.getStart() != null && timeRange.getEnd() != null
                && timeRange.getStart().isAfter(timeRange.getEnd())) {
            errors.add("Time range start must not be after end");
        }
    }
}
