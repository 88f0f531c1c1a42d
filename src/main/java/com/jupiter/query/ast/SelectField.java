package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One entry of a SELECT list: a field or aggregate call, optionally renamed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SelectField {

    private final Operand field;
    private final String alias;

    @JsonCreator
    public SelectField(@JsonProperty("field") Operand field,
                       @JsonProperty("alias") String alias) {
        this.field = Objects.requireNonNull(field, "Select field must not be null");
        this.alias = alias;
    }

    public static SelectField of(String fieldName) {
        return new SelectField(Field.of(fieldName), null);
    }

    public static SelectField of(Operand field, String alias) {
        return new SelectField(field, alias);
    }

    @JsonProperty("field")
    public Operand getField() {
        return field;
    }

    @JsonProperty("alias")
    public String getAlias() {
        return alias;
    }

    /**
     * Name of the output column: the alias when present, otherwise the field
     * name or the function's default alias.
     */
    @JsonIgnore
    public String getOutputName() {
        if (alias != null) {
            return alias;
        }
        if (field instanceof FunctionCall) {
            return ((FunctionCall) field).getDefaultAlias();
        }
        if (field instanceof Field) {
            return ((Field) field).getName();
        }
        return String.valueOf(field);
    }

    @JsonIgnore
    public boolean isAggregate() {
        return field instanceof FunctionCall;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectField)) return false;
        SelectField other = (SelectField) o;
        return field.equals(other.field) && Objects.equals(alias, other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, alias);
    }

    @Override
    public String toString() {
        return alias == null ? String.valueOf(field) : field + " AS " + alias;
    }
}
