package com.jupiter.query.parser;

import com.jupiter.query.QueryMetrics;
import com.jupiter.query.ast.ComparisonOperator;
import com.jupiter.query.ast.Condition;
import com.jupiter.query.ast.Expression;
import com.jupiter.query.ast.Field;
import com.jupiter.query.ast.Literal;
import com.jupiter.query.ast.LiteralList;
import com.jupiter.query.ast.LogicalExpression;
import com.jupiter.query.ast.QueryAst;
import com.jupiter.query.ast.SelectField;
import com.jupiter.query.provider.AstValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the flat text query language into a {@link QueryAst}.
 *
 * Grammar: {@code condition (("AND" | "OR") condition)*} where a condition is
 * {@code field op value}. Conditions are always combined with AND, including
 * those separated by OR; validation flags such queries with a warning.
 *
 * Operators are tried in a fixed order and the fragment is split at the first
 * occurrence of the matching token:
 * {@code =}, {@code CONTAINS}, {@code >}, {@code <}, {@code >=}, {@code <=},
 * {@code IN}, {@code REGEX}.
 *
 * Parsing never fails. Fragments that cannot be parsed are dropped, logged and
 * counted.
 */
public class TextQueryParser {

    private static final Logger log = LoggerFactory.getLogger(TextQueryParser.class);

    private static final Pattern CONNECTIVE = Pattern.compile("\\s+(?:AND|OR)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");

    private static final List<OperatorToken> OPERATORS = List.of(
        new OperatorToken(" = ", ComparisonOperator.EQUALS),
        new OperatorToken(" CONTAINS ", ComparisonOperator.CONTAINS),
        new OperatorToken(" > ", ComparisonOperator.GT),
        new OperatorToken(" < ", ComparisonOperator.LT),
        new OperatorToken(" >= ", ComparisonOperator.GTE),
        new OperatorToken(" <= ", ComparisonOperator.LTE),
        new OperatorToken(" IN ", ComparisonOperator.IN),
        new OperatorToken(" REGEX ", ComparisonOperator.REGEX)
    );

    private final QueryMetrics metrics;

    public TextQueryParser(QueryMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Parse a text query for the given tenant.
     *
     * @param text the text query, may be empty
     * @param tenantId tenant scope for the query, may be null
     * @return an AST selecting all fields; {@code where} is absent when no
     *         condition could be parsed
     */
    public QueryAst parse(String text, String tenantId) {
        QueryAst.Builder builder = QueryAst.builder()
            .tenantId(tenantId)
            .sourceText(text)
            .select(SelectField.of(Field.ALL));

        if (text == null || text.isBlank()) {
            return builder.build();
        }

        List<Expression> conditions = new ArrayList<>();
        try {
            for (String part : CONNECTIVE.split(text.trim())) {
                String fragment = part.trim();
                if (fragment.isEmpty()) {
                    continue;
                }
                Optional<Condition> condition = parseCondition(fragment);
                if (condition.isPresent()) {
                    conditions.add(condition.get());
                } else {
                    log.warn("Dropping unparseable query fragment: '{}'", fragment);
                    metrics.recordFragmentDropped();
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to parse text query '{}': {}", text, e.getMessage(), e);
        }

        if (conditions.size() == 1) {
            builder.where(conditions.get(0));
        } else if (conditions.size() > 1) {
            builder.where(LogicalExpression.and(conditions.toArray(new Expression[0])));
        }
        return builder.build();
    }

    Optional<Condition> parseCondition(String fragment) {
        for (OperatorToken token : OPERATORS) {
            int index = fragment.indexOf(token.text);
            if (index < 0) {
                continue;
            }
            String fieldName = fragment.substring(0, index).trim();
            String rawValue = fragment.substring(index + token.text.length());
            if (!AstValidator.isValidFieldName(fieldName)) {
                log.debug("Invalid field name '{}' in fragment '{}'", fieldName, fragment);
                return Optional.empty();
            }
            Field field = Field.of(fieldName);
            return switch (token.operator) {
                case GT, LT, GTE, LTE -> orderingLiteral(stripValue(rawValue))
                    .map(literal -> Condition.of(field, token.operator, literal));
                case IN -> inList(rawValue)
                    .map(list -> Condition.of(field, ComparisonOperator.IN, list));
                default -> Optional.of(Condition.of(field, token.operator, Literal.string(stripValue(rawValue))));
            };
        }
        return Optional.empty();
    }

    private Optional<Literal> orderingLiteral(String value) {
        if (NUMBER.matcher(value).matches()) {
            return Optional.of(Literal.floating(Double.parseDouble(value)));
        }
        try {
            return Optional.of(Literal.timestamp(Instant.parse(value)));
        } catch (DateTimeParseException e) {
            log.debug("Value '{}' is neither numeric nor an ISO-8601 instant", value);
            return Optional.empty();
        }
    }

    private Optional<LiteralList> inList(String rawValue) {
        String body = rawValue.trim();
        if (body.startsWith("(")) {
            body = body.substring(1);
        }
        if (body.endsWith(")")) {
            body = body.substring(0, body.length() - 1);
        }
        List<Literal> values = new ArrayList<>();
        for (String item : body.split(",")) {
            String value = stripValue(item);
            if (!value.isEmpty()) {
                values.add(Literal.string(value));
            }
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(new LiteralList(values));
    }

    /**
     * Trim whitespace, then any run of quote characters at either end.
     */
    static String stripValue(String raw) {
        String value = raw.strip();
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static final class OperatorToken {
        private final String text;
        private final ComparisonOperator operator;

        private OperatorToken(String text, ComparisonOperator operator) {
            this.text = text;
            this.operator = operator;
        }
    }
}
