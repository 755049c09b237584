package com.yava.intent.ingestion;

import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.ValidationIssue;
import lombok.Value;

import java.util.List;

/**
 * Records normalized from bulk input, plus any structural errors found on the way.
 * When there are errors the records must not be staged.
 */
@Value
public class IngestionResult {

    List<IntentRecord> records;
    List<ValidationIssue> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
