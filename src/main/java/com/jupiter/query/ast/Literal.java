package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A typed constant. The raw value is kept next to its {@link LiteralType}
 * because serialization differs per backend.
 *
 * Values are restricted to JSON scalars: {@link String}, {@link Number},
 * {@link Boolean} or {@code null}. Timestamps are stored as ISO-8601 strings.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class Literal implements Operand {

    private final Object value;
    private final LiteralType literalType;

    @JsonCreator
    public Literal(@JsonProperty("value") Object value,
                   @JsonProperty("literal_type") LiteralType literalType) {
        this.value = value instanceof Instant ? value.toString() : value;
        this.literalType = literalType != null ? literalType : LiteralType.STRING;
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal floating(double value) {
        return new Literal(value, LiteralType.FLOAT);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal timestamp(Instant value) {
        return new Literal(value, LiteralType.TIMESTAMP);
    }

    public static Literal timestamp(String isoValue) {
        return new Literal(isoValue, LiteralType.TIMESTAMP);
    }

    public static Literal ipAddress(String value) {
        return new Literal(value, LiteralType.IP_ADDRESS);
    }

    @JsonProperty("value")
    public Object getValue() {
        return value;
    }

    @JsonProperty("literal_type")
    public LiteralType getLiteralType() {
        return literalType;
    }

    /**
     * String form of the value as used by case-insensitive comparisons.
     */
    public String asText() {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal other = (Literal) o;
        return Objects.equals(value, other.value) && literalType == other.literalType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, literalType);
    }

    @Override
    public String toString() {
        return literalType.getValue() + ":" + value;
    }
}
