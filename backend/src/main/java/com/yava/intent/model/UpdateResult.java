package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of an operation that may publish a new registry snapshot.
 */
@Value
@AllArgsConstructor
public class UpdateResult {

    public enum Reason {
        PUBLISHED,
        NOTHING_STAGED,
        STALE,
        INVALID
    }

    @JsonProperty("success")
    boolean success;

    /** Version active after the call: the new one on success, the untouched one otherwise. */
    @JsonProperty("version")
    long version;

    @JsonProperty("reason")
    Reason reason;

    @JsonProperty("report")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    ValidationReport report;

    public static UpdateResult published(long version, ValidationReport report) {
        return new UpdateResult(true, version, Reason.PUBLISHED, report);
    }

    public static UpdateResult rejected(long version, Reason reason, ValidationReport report) {
        return new UpdateResult(false, version, reason, report);
    }
}
