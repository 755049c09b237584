package com.yava.intent.service;

import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.ExtractedSlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls slot values out of a single utterance with the patterns configured under
 * {@code intent.slots}. Slots of the matched intent come first; common slots
 * (member id, phone, date...) are added when the intent did not already fill them.
 * Nothing is remembered between calls.
 */
@Component
@Slf4j
public class SlotExtractor {

    private final List<SlotPattern> common;
    private final Map<String, List<SlotPattern>> byIntent;

    public SlotExtractor(IntentClassifierProperties properties) {
        IntentClassifierProperties.Slots slots = properties.getSlots();
        this.common = compile(slots.getCommon());
        Map<String, List<SlotPattern>> compiled = new HashMap<>();
        slots.getIntents().forEach((intentName, definitions) ->
            compiled.put(intentName.toLowerCase(Locale.ROOT), compile(definitions)));
        this.byIntent = Collections.unmodifiableMap(compiled);
        log.info("Loaded slot patterns: {} common, {} intents", common.size(), byIntent.size());
    }

    /**
     * Slots found in {@code utterance}. {@code intentName} may be null when nothing
     * matched; only common slots are tried then.
     */
    public Map<String, ExtractedSlot> extract(String utterance, String intentName) {
        if (utterance == null || utterance.isBlank()) {
            return Map.of();
        }
        Map<String, ExtractedSlot> found = new LinkedHashMap<>();
        if (intentName != null) {
            for (SlotPattern slot : byIntent.getOrDefault(intentName.toLowerCase(Locale.ROOT), List.of())) {
                slot.match(utterance).ifPresent(value -> found.put(slot.name, value));
            }
        }
        for (SlotPattern slot : common) {
            if (!found.containsKey(slot.name)) {
                slot.match(utterance).ifPresent(value -> found.put(slot.name, value));
            }
        }
        if (!found.isEmpty()) {
            log.debug("Extracted slots {} for intent {}", found.keySet(), intentName);
        }
        return Collections.unmodifiableMap(found);
    }

    private static List<SlotPattern> compile(Map<String, IntentClassifierProperties.SlotDefinition> definitions) {
        List<SlotPattern> compiled = new ArrayList<>(definitions.size());
        definitions.forEach((name, definition) -> compiled.add(new SlotPattern(name, definition)));
        return List.copyOf(compiled);
    }

    private static final class SlotPattern {

        private final String name;
        private final String type;
        private final double confidence;
        private final List<Pattern> patterns;

        private SlotPattern(String name, IntentClassifierProperties.SlotDefinition definition) {
            this.name = name;
            this.type = definition.getType();
            this.confidence = definition.getConfidence();
            int flags = definition.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE;
            List<Pattern> compiled = new ArrayList<>();
            for (String regex : definition.getPatterns()) {
                compiled.add(Pattern.compile(regex, flags));
            }
            this.patterns = List.copyOf(compiled);
        }

        private Optional<ExtractedSlot> match(String utterance) {
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(utterance);
                if (matcher.find()) {
                    String value = matcher.groupCount() >= 1 && matcher.group(1) != null
                        ? matcher.group(1)
                        : matcher.group();
                    return Optional.of(new ExtractedSlot(value.trim(), type, confidence));
                }
            }
            return Optional.empty();
        }
    }
}
