package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One sort key of an ORDER BY list; the first entry is the primary key.
 */
public final class OrderBy {

    private final Field field;
    private final SortDirection direction;

    @JsonCreator
    public OrderBy(@JsonProperty("field") Field field,
                   @JsonProperty("direction") SortDirection direction) {
        this.field = Objects.requireNonNull(field, "Order by field must not be null");
        this.direction = direction != null ? direction : SortDirection.ASC;
    }

    public static OrderBy asc(String fieldName) {
        return new OrderBy(Field.of(fieldName), SortDirection.ASC);
    }

    public static OrderBy desc(String fieldName) {
        return new OrderBy(Field.of(fieldName), SortDirection.DESC);
    }

    @JsonProperty("field")
    public Field getField() {
        return field;
    }

    @JsonProperty("direction")
    public SortDirection getDirection() {
        return direction;
    }

    @JsonIgnore
    public boolean isAscending() {
        return direction == SortDirection.ASC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderBy)) return false;
        OrderBy other = (OrderBy) o;
        return field.equals(other.field) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + " " + direction.getValue();
    }
}
