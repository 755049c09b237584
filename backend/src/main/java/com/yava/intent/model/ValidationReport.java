package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of validating a candidate set of intents. Errors block a publish, warnings don't.
 */
@Value
public class ValidationReport {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("errors")
    List<ValidationIssue> errors;

    @JsonProperty("warnings")
    List<ValidationIssue> warnings;

    public ValidationReport(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.valid = this.errors.isEmpty();
    }

    public static ValidationReport ofErrors(List<ValidationIssue> errors) {
        return new ValidationReport(errors, List.of());
    }

    public static ValidationReport ofError(ValidationIssue error) {
        return new ValidationReport(List.of(error), List.of());
    }

    public boolean hasErrorFor(String intentId) {
        return errors.stream().anyMatch(e -> intentId.equals(e.getIntentId()));
    }
}
