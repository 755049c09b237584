package com.yava.intent.validation;

import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Well-formedness check for a single intent: required fields, formats and ranges.
 * Cross-record rules live in {@link IntentSetValidator}.
 */
@Component
public class IntentRecordValidator {

    /** INT-&lt;CATEGORY-CODE&gt;-&lt;4-digit-sequence&gt;, e.g. INT-PHR-0001. */
    public static final Pattern INTENT_ID_PATTERN = Pattern.compile("^INT-[A-Z0-9]{2,8}-\\d{4}$");

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    public List<ValidationIssue> check(IntentRecord record) {
        List<ValidationIssue> issues = new ArrayList<>();
        String id = record.getIntentId();

        if (isBlank(id)) {
            issues.add(new ValidationIssue(null, "intent_id", "intent_id is required"));
        } else if (!INTENT_ID_PATTERN.matcher(id).matches()) {
            issues.add(new ValidationIssue(id, "intent_id",
                "intent_id '" + id + "' does not match INT-<CATEGORY-CODE>-<4 digits>"));
        }

        requireText(issues, id, "intent_name", record.getIntentName());
        requireText(issues, id, "category", record.getCategory());
        requireText(issues, id, "agent_routing", record.getAgentRouting());
        requireText(issues, id, "description_short", record.getDescriptionShort());

        Integer priority = record.getPriority();
        if (priority != null && (priority < MIN_PRIORITY || priority > MAX_PRIORITY)) {
            issues.add(new ValidationIssue(id, "priority",
                "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", got " + priority));
        }

        List<String> utterances = record.getTrainingUtterances();
        if (utterances == null || utterances.isEmpty()) {
            issues.add(new ValidationIssue(id, "training_utterances", "at least one training utterance is required"));
        } else {
            for (int i = 0; i < utterances.size(); i++) {
                if (isBlank(utterances.get(i))) {
                    issues.add(new ValidationIssue(id, "training_utterances",
                        "training utterance #" + (i + 1) + " is empty"));
                }
            }
        }

        if (record.getKeywords() != null && record.getKeywords().stream().anyMatch(IntentRecordValidator::isBlank)) {
            issues.add(new ValidationIssue(id, "keywords", "keywords must not contain empty entries"));
        }

        Double threshold = record.getConfidenceThreshold();
        if (threshold != null && (threshold.isNaN() || threshold <= 0.0 || threshold > 1.0)) {
            issues.add(new ValidationIssue(id, "confidence_threshold",
                "confidence_threshold must be in (0, 1], got " + threshold));
        }

        if (record.getDisambiguationPrompt() != null && record.getDisambiguationPrompt().isBlank()) {
            issues.add(new ValidationIssue(id, "disambiguation_prompt", "disambiguation_prompt must not be blank when present"));
        }

        return issues;
    }

    private static void requireText(List<ValidationIssue> issues, String id, String field, String value) {
        if (isBlank(value)) {
            issues.add(new ValidationIssue(id, field, field + " is required"));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
