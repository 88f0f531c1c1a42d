package com.jupiter.query.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of query backends. {@code AUTO} is a selector value only and is
 * never registered as a provider.
 */
public enum QueryBackend {

    MOCK("mock"),
    SQL("sql"),
    AUTO("auto");

    private final String value;

    QueryBackend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a configured or requested backend name. {@code clickhouse} is
     * accepted as an alias of {@code sql}.
     */
    @JsonCreator
    public static QueryBackend fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase();
        if ("clickhouse".equals(normalized)) {
            return SQL;
        }
        for (QueryBackend backend : values()) {
            if (backend.value.equals(normalized)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown query backend: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
