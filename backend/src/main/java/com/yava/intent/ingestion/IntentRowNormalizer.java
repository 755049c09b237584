package com.yava.intent.ingestion;

import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.IntentRecordInput;
import com.yava.intent.model.ValidationIssue;
import com.yava.intent.service.TextMatching;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns loosely typed spreadsheet rows and API payloads into {@link IntentRecord}s.
 * Coercion failures are reported per row and field; nothing here checks semantics.
 */
@Component
@Slf4j
public class IntentRowNormalizer {

    private static final Map<String, String> COLUMN_ALIASES = Map.of(
        "id", "intent_id",
        "name", "intent_name",
        "agent", "agent_routing",
        "description", "description_short",
        "utterances", "training_utterances",
        "threshold", "confidence_threshold");

    private final IntentClassifierProperties properties;

    public IntentRowNormalizer(IntentClassifierProperties properties) {
        this.properties = properties;
    }

    /**
     * Normalize every row. Rows whose cells are all empty are skipped.
     * Row numbers in errors are 1-based positions in {@code rows}.
     */
    public IngestionResult normalizeRows(List<Map<String, Object>> rows) {
        List<IntentRecord> records = new ArrayList<>();
        List<ValidationIssue> errors = new ArrayList<>();
        if (rows == null) {
            return new IngestionResult(records, errors);
        }

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            Map<String, Object> cells = canonicalColumns(rows.get(i));
            if (cells.values().stream().allMatch(IntentRowNormalizer::isEmptyCell)) {
                log.debug("Skipping empty row {}", rowNumber);
                continue;
            }
            RowReader row = new RowReader(rowNumber, cells, errors);
            IntentRecord record = IntentRecord.builder()
                .intentId(row.text("intent_id"))
                .intentName(row.text("intent_name"))
                .category(row.text("category"))
                .agentRouting(row.text("agent_routing"))
                .priority(row.integer("priority", IntentRecord.DEFAULT_PRIORITY))
                .descriptionShort(row.text("description_short"))
                .disambiguationPrompt(row.text("disambiguation_prompt"))
                .trainingUtterances(row.list("training_utterances"))
                .keywords(TextMatching.normalizeKeywords(row.list("keywords")))
                .confidenceThreshold(row.decimal("confidence_threshold"))
                .build();
            records.add(record);
        }

        if (!errors.isEmpty()) {
            log.warn("Bulk input rejected: {} structural errors in {} rows", errors.size(), rows.size());
        }
        return new IngestionResult(records, errors);
    }

    /**
     * Normalize a typed API payload: trims strings, applies the default priority,
     * cleans list entries and deduplicates keywords.
     */
    public IntentRecord fromInput(IntentRecordInput input) {
        return IntentRecord.builder()
            .intentId(trimToNull(input.getIntentId()))
            .intentName(trimToNull(input.getIntentName()))
            .category(trimToNull(input.getCategory()))
            .agentRouting(trimToNull(input.getAgentRouting()))
            .priority(input.getPriority() != null ? input.getPriority() : IntentRecord.DEFAULT_PRIORITY)
            .descriptionShort(trimToNull(input.getDescriptionShort()))
            .disambiguationPrompt(trimToNull(input.getDisambiguationPrompt()))
            .trainingUtterances(cleanList(input.getTrainingUtterances()))
            .keywords(TextMatching.normalizeKeywords(input.getKeywords()))
            .confidenceThreshold(input.getConfidenceThreshold())
            .build();
    }

    public List<IntentRecord> fromInputs(Collection<IntentRecordInput> inputs) {
        List<IntentRecord> records = new ArrayList<>(inputs.size());
        for (IntentRecordInput input : inputs) {
            records.add(fromInput(input));
        }
        return records;
    }

    private static Map<String, Object> canonicalColumns(Map<String, Object> row) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        if (row == null) {
            return canonical;
        }
        row.forEach((header, value) -> {
            if (header == null) {
                return;
            }
            String key = header.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
            canonical.put(COLUMN_ALIASES.getOrDefault(key, key), value);
        });
        return canonical;
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>();
        for (String value : values) {
            String trimmed = trimToNull(value);
            if (trimmed != null) {
                cleaned.add(trimmed);
            }
        }
        return List.copyOf(cleaned);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean isEmptyCell(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        return value.toString().isBlank();
    }

    /**
     * Reads one row's cells, recording coercion failures against the row.
     */
    private final class RowReader {

        private final int rowNumber;
        private final Map<String, Object> cells;
        private final List<ValidationIssue> errors;
        private final String intentId;

        RowReader(int rowNumber, Map<String, Object> cells, List<ValidationIssue> errors) {
            this.rowNumber = rowNumber;
            this.cells = cells;
            this.errors = errors;
            Object id = cells.get("intent_id");
            this.intentId = id == null ? null : trimToNull(id.toString());
        }

        String text(String column) {
            Object value = cells.get(column);
            if (value == null) {
                return null;
            }
            if (value instanceof Collection) {
                reject(column, "expected a single text value, got a list");
                return null;
            }
            return trimToNull(value.toString());
        }

        Integer integer(String column, int defaultValue) {
            Object value = cells.get(column);
            if (isEmptyCell(value)) {
                return defaultValue;
            }
            if (value instanceof Number) {
                double number = ((Number) value).doubleValue();
                if (number == Math.rint(number) && Math.abs(number) <= Integer.MAX_VALUE) {
                    return (int) number;
                }
                reject(column, column + " must be an integer, got " + value);
                return null;
            }
            String text = value.toString().trim();
            Integer parsed = parseWholeNumber(text);
            if (parsed == null) {
                reject(column, column + " must be an integer, got '" + text + "'");
            }
            return parsed;
        }

        Double decimal(String column) {
            Object value = cells.get(column);
            if (isEmptyCell(value)) {
                return null;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            String text = value.toString().trim();
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                reject(column, column + " must be a number, got '" + text + "'");
                return null;
            }
        }

        List<String> list(String column) {
            Object value = cells.get(column);
            if (isEmptyCell(value)) {
                return List.of();
            }
            List<String> items = new ArrayList<>();
            if (value instanceof Collection) {
                for (Object item : (Collection<?>) value) {
                    if (item != null) {
                        items.add(item.toString());
                    }
                }
            } else {
                String delimiter = properties.getIngestion().getListDelimiter();
                items.addAll(List.of(value.toString().split(Pattern.quote(delimiter), -1)));
            }
            return cleanList(items);
        }

        private Integer parseWholeNumber(String text) {
            try {
                double number = Double.parseDouble(text);
                if (number == Math.rint(number) && Math.abs(number) <= Integer.MAX_VALUE) {
                    return (int) number;
                }
                return null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        private void reject(String column, String message) {
            errors.add(ValidationIssue.atRow(rowNumber, intentId, column, message));
        }
    }
}
