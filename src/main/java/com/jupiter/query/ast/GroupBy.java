package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * GROUP BY clause with an optional HAVING filter over the groups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GroupBy {

    private final List<Field> fields;
    private final Expression having;

    @JsonCreator
    public GroupBy(@JsonProperty("fields") List<Field> fields,
                   @JsonProperty("having") Expression having) {
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.having = having;
    }

    public static GroupBy of(String... fieldNames) {
        return new GroupBy(Arrays.stream(fieldNames).map(Field::of).toList(), null);
    }

    public GroupBy withHaving(Expression having) {
        return new GroupBy(fields, having);
    }

    @JsonProperty("fields")
    public List<Field> getFields() {
        return fields;
    }

    @JsonProperty("having")
    public Expression getHaving() {
        return having;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupBy)) return false;
        GroupBy other = (GroupBy) o;
        return fields.equals(other.fields) && Objects.equals(having, other.having);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, having);
    }
}
