package com.jupiter.query.provider.mock;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Value access and coercion rules for in-memory OCSF records.
 */
final class RecordValues {

    private static final Pattern NUMBER = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");

    // 2024-01-01T10:00:00Z, 2024-01-01T10:00:00.123+02:00, 2024-01-01 10:00:00
    private static final DateTimeFormatter EVENT_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .toFormatter();

    /**
     * Numbers before other values and nulls last. Numbers compare numerically,
     * everything else by its string form.
     */
    static final Comparator<Object> NATURAL_ORDER = (a, b) -> {
        if (a == null && b == null) return 0;
        if (a == null) return 1;
        if (b == null) return -1;
        boolean aNumber = a instanceof Number;
        boolean bNumber = b instanceof Number;
        if (aNumber && bNumber) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (aNumber != bNumber) {
            return aNumber ? -1 : 1;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    };

    private RecordValues() {
        throw new UnsupportedOperationException("RecordValues is a utility class and cannot be instantiated");
    }

    /**
     * Look up a field. The exact key wins; otherwise a dotted name navigates
     * nested objects ({@code user.name} reads {@code record.user.name}).
     * Returns null for missing fields.
     */
    @SuppressWarnings("unchecked")
    static Object resolve(Map<String, Object> record, String name) {
        if (record.containsKey(name)) {
            return record.get(name);
        }
        Object current = record;
        for (String segment : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Lower-cased string form used by case-insensitive comparisons.
     */
    static String text(Object value) {
        return value == null ? null : String.valueOf(value).toLowerCase(Locale.ROOT);
    }

    /**
     * Numeric form of a record value: numbers as-is, strings only when they
     * are fully numeric.
     */
    static OptionalDouble toDouble(Object value) {
        if (value instanceof Number) {
            return OptionalDouble.of(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            String candidate = ((String) value).trim();
            if (NUMBER.matcher(candidate).matches()) {
                return OptionalDouble.of(Double.parseDouble(candidate));
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Numeric form of a literal value. Booleans count as 1 and 0.
     */
    static OptionalDouble literalToDouble(Object value) {
        if (value instanceof Boolean) {
            return OptionalDouble.of((Boolean) value ? 1.0 : 0.0);
        }
        return toDouble(value);
    }

    /**
     * Parse an event time: ISO-8601 instants or offsets, local date-times
     * (taken as UTC) with a {@code T} or a space separator, or epoch
     * milliseconds.
     */
    static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant) {
            return Optional.of((Instant) value);
        }
        if (value instanceof Number) {
            return Optional.of(Instant.ofEpochMilli(((Number) value).longValue()));
        }
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = EVENT_TIME.parseBest(((String) value).trim(),
                OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Truthiness for boolean comparisons: {@code true}/{@code 1} and
     * {@code false}/{@code 0}, case-insensitive. Anything else is neither.
     */
    static Optional<Boolean> toBoolean(Object value) {
        String text = text(value);
        if ("true".equals(text) || "1".equals(text)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equals(text) || "0".equals(text)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
