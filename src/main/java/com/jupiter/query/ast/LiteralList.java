package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Right-hand side of an IN / NOT_IN condition.
 */
public final class LiteralList implements Operand {

    private final List<Literal> values;

    @JsonCreator
    public LiteralList(@JsonProperty("values") List<Literal> values) {
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    public static LiteralList of(Literal... values) {
        return new LiteralList(Arrays.asList(values));
    }

    public static LiteralList ofStrings(String... values) {
        return new LiteralList(Arrays.stream(values).map(Literal::string).toList());
    }

    @JsonProperty("values")
    public List<Literal> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralList)) return false;
        return values.equals(((LiteralList) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
