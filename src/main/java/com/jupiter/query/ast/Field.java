package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to a logical OCSF field by its dotted name (e.g. {@code user.name},
 * {@code src_endpoint.ip}).
 *
 * The special name {@code *} selects every field of a record and is only
 * meaningful inside a SELECT list.
 */
public final class Field implements Operand {

    public static final String ALL = "*";

    private final String name;

    @JsonCreator
    public Field(@JsonProperty("name") String name) {
        this.name = Objects.requireNonNull(name, "Field name must not be null");
    }

    public static Field of(String name) {
        return new Field(name);
    }

    public static Field all() {
        return new Field(ALL);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonIgnore
    public boolean isWildcard() {
        return ALL.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field)) return false;
        return name.equals(((Field) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
