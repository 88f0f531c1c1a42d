package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type tag carried by every {@link Literal}. Backends serialize values
 * differently per tag (booleans become 1/0 in SQL, IP addresses are wrapped
 * in an address constructor, and so on).
 */
public enum LiteralType {

    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    TIMESTAMP("timestamp"),
    IP_ADDRESS("ip_address");

    private final String value;

    LiteralType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    @JsonCreator
    public static LiteralType fromValue(String value) {
        for (LiteralType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown literal type: " + value);
    }
}
