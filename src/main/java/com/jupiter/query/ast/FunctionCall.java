package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate function application, e.g. {@code count()} or {@code sum(file.size)}.
 * Arguments may be fields, literals or nested function calls.
 */
public final class FunctionCall implements Operand {

    private final AggregateFunction name;
    private final List<Operand> args;

    @JsonCreator
    public FunctionCall(@JsonProperty("name") AggregateFunction name,
                        @JsonProperty("args") List<Operand> args) {
        this.name = Objects.requireNonNull(name, "Function name must not be null");
        this.args = args == null ? List.of() : List.copyOf(args);
    }

    public static FunctionCall of(AggregateFunction name, Operand... args) {
        return new FunctionCall(name, Arrays.asList(args));
    }

    public static FunctionCall count() {
        return new FunctionCall(AggregateFunction.COUNT, List.of());
    }

    @JsonProperty("name")
    public AggregateFunction getName() {
        return name;
    }

    @JsonProperty("args")
    public List<Operand> getArgs() {
        return args;
    }

    /**
     * Column name used when the call is selected without an alias:
     * {@code count} for {@code count()}, {@code sum_file_size} for
     * {@code sum(file.size)}.
     */
    @JsonIgnore
    public String getDefaultAlias() {
        for (Operand arg : args) {
            if (arg instanceof Field && !((Field) arg).isWildcard()) {
                return name.getValue() + "_" + ((Field) arg).getName().replace('.', '_');
            }
        }
        return name.getValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionCall)) return false;
        FunctionCall other = (FunctionCall) o;
        return name == other.name && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return name.getValue() + args;
    }
}
