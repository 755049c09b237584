package com.yava.intent.validation;

import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.model.ValidationIssue;
import com.yava.intent.model.ValidationReport;
import com.yava.intent.service.TextMatching;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a candidate set of intents, either as a complete standalone set or
 * merged into an existing snapshot. Every rule is evaluated so the report lists
 * all problems at once.
 */
@Component
@Slf4j
public class IntentSetValidator {

    static final int RECOMMENDED_UTTERANCES = 5;

    private final IntentRecordValidator recordValidator;
    private final IntentClassifierProperties properties;

    public IntentSetValidator(IntentRecordValidator recordValidator, IntentClassifierProperties properties) {
        this.recordValidator = recordValidator;
        this.properties = properties;
    }

    /**
     * @param candidates records to validate
     * @param existing   snapshot to merge into, or {@code null} for a standalone (replace) set
     */
    public ValidationReport validate(List<IntentRecord> candidates, RegistrySnapshot existing) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        for (IntentRecord candidate : candidates) {
            errors.addAll(recordValidator.check(candidate));
        }

        List<IntentRecord> resulting = existing == null ? candidates : merge(existing, candidates);

        checkDuplicateIds(resulting, errors);
        checkDuplicateNames(resulting, errors);

        if (resulting.isEmpty()) {
            errors.add(new ValidationIssue(null, null, "registry must contain at least one intent"));
        }

        for (IntentRecord candidate : candidates) {
            List<String> utterances = candidate.getTrainingUtterances();
            int count = utterances == null ? 0 : utterances.size();
            if (count > 0 && count < RECOMMENDED_UTTERANCES) {
                warnings.add(new ValidationIssue(candidate.getIntentId(), "training_utterances",
                    "only " + count + " training utterances, at least " + RECOMMENDED_UTTERANCES + " recommended"));
            }
        }
        checkOverlap(candidates, resulting, warnings);

        ValidationReport report = new ValidationReport(errors, warnings);
        log.debug("Validated {} candidate intents ({} mode): {} errors, {} warnings",
                candidates.size(), existing == null ? "replace" : "merge",
                errors.size(), warnings.size());
        return report;
    }

    /**
     * Existing records minus any whose id is re-submitted, plus the candidates.
     */
    public static List<IntentRecord> merge(RegistrySnapshot existing, List<IntentRecord> candidates) {
        Set<String> replaced = candidates.stream()
            .map(IntentRecord::getIntentId)
            .collect(Collectors.toSet());
        List<IntentRecord> merged = new ArrayList<>();
        for (IntentRecord record : existing.getRecords()) {
            if (!replaced.contains(record.getIntentId())) {
                merged.add(record);
            }
        }
        merged.addAll(candidates);
        return merged;
    }

    private void checkDuplicateIds(List<IntentRecord> records, List<ValidationIssue> errors) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (IntentRecord record : records) {
            if (record.getIntentId() != null) {
                counts.merge(record.getIntentId(), 1, Integer::sum);
            }
        }
        counts.forEach((id, count) -> {
            if (count > 1) {
                errors.add(new ValidationIssue(id, "intent_id",
                    "duplicate intent_id '" + id + "' appears " + count + " times"));
            }
        });
    }

    private void checkDuplicateNames(List<IntentRecord> records, List<ValidationIssue> errors) {
        Map<String, List<String>> idsByName = new LinkedHashMap<>();
        for (IntentRecord record : records) {
            if (record.getCategory() == null || record.getIntentName() == null) {
                continue;
            }
            String key = key(record.getCategory()) + "/" + key(record.getIntentName());
            idsByName.computeIfAbsent(key, k -> new ArrayList<>()).add(record.getIntentId());
        }
        for (IntentRecord record : records) {
            if (record.getCategory() == null || record.getIntentName() == null) {
                continue;
            }
            List<String> ids = idsByName.remove(key(record.getCategory()) + "/" + key(record.getIntentName()));
            if (ids != null && ids.size() > 1) {
                errors.add(new ValidationIssue(ids.get(1), "intent_name",
                    "intent_name '" + record.getIntentName() + "' is used more than once in category '"
                        + record.getCategory() + "' by " + ids));
            }
        }
    }

    private void checkOverlap(List<IntentRecord> scope, List<IntentRecord> resulting, List<ValidationIssue> warnings) {
        double floor = properties.getValidation().getOverlapSimilarityFloor();
        Set<String> reported = new HashSet<>();
        for (IntentRecord record : scope) {
            if (record.hasDisambiguationPrompt() || record.getIntentId() == null) {
                continue;
            }
            for (IntentRecord other : resulting) {
                if (other == record || record.getIntentId().equals(other.getIntentId())) {
                    continue;
                }
                double similarity = overlap(record, other);
                if (similarity >= floor && reported.add(record.getIntentId() + "->" + other.getIntentId())) {
                    warnings.add(new ValidationIssue(record.getIntentId(), "disambiguation_prompt",
                        String.format(Locale.ROOT,
                            "training data overlaps with %s (%s) at %.2f and no disambiguation_prompt is configured",
                            other.getIntentId(), other.getIntentName(), similarity)));
                }
            }
        }
    }

    private static double overlap(IntentRecord a, IntentRecord b) {
        double best = 0.0;
        List<String> keywordsA = a.getKeywords() == null ? List.of() : a.getKeywords();
        List<String> keywordsB = b.getKeywords() == null ? List.of() : b.getKeywords();
        best = Math.max(best, TextMatching.tokenSimilarity(new HashSet<>(keywordsA), new HashSet<>(keywordsB)));
        if (a.getTrainingUtterances() == null || b.getTrainingUtterances() == null) {
            return best;
        }
        for (String left : a.getTrainingUtterances()) {
            Set<String> leftTokens = TextMatching.significantTokens(left);
            for (String right : b.getTrainingUtterances()) {
                best = Math.max(best, TextMatching.tokenSimilarity(leftTokens, TextMatching.significantTokens(right)));
            }
        }
        return best;
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
