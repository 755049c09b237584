package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One error or warning of a {@link ValidationReport}.
 * {@code row} is only set for problems found while normalizing bulk input.
 */
@Value
@AllArgsConstructor
public class ValidationIssue {

    @JsonProperty("intent_id")
    String intentId;

    @JsonProperty("field")
    String field;

    @JsonProperty("message")
    String message;

    @JsonProperty("row")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Integer row;

    public ValidationIssue(String intentId, String field, String message) {
        this(intentId, field, message, null);
    }

    public static ValidationIssue atRow(int row, String intentId, String field, String message) {
        return new ValidationIssue(intentId, field, message, row);
    }
}
