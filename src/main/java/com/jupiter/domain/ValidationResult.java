package com.jupiter.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of validating a query AST against a provider.
 *
 * Syntactic and structural problems are reported as {@code errors} (the AST
 * cannot be executed); performance concerns are reported as {@code warnings}.
 */
public class ValidationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("warnings")
    private final List<String> warnings;

    @JsonCreator
    public ValidationResult(@JsonProperty("errors") List<String> errors,
                            @JsonProperty("warnings") List<String> warnings) {
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.valid = this.errors.isEmpty();
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(List.of(error), List.of());
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", errors=" + errors + ", warnings=" + warnings + "}";
    }
}
