package com.yava.intent.registry;

import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.ValidationReport;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A validated replacement set waiting for explicit activation.
 * {@code baseVersion} is the active version it was staged against.
 */
@Value
public class StagedConfiguration {
    List<IntentRecord> records;
    ValidationReport report;
    long baseVersion;
    Instant stagedAt;
}
