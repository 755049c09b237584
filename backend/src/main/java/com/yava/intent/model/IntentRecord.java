package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized, immutable intent as held by a registry snapshot.
 * Fields may still be missing or out of range until the record has passed
 * {@link com.yava.intent.validation.IntentRecordValidator}.
 */
@Value
@Builder(toBuilder = true)
public class IntentRecord {

    public static final int DEFAULT_PRIORITY = 3;

    @JsonProperty("intent_id")
    String intentId;

    @JsonProperty("intent_name")
    String intentName;

    @JsonProperty("category")
    String category;

    @JsonProperty("agent_routing")
    String agentRouting;

    @JsonProperty("priority")
    Integer priority;

    @JsonProperty("description_short")
    String descriptionShort;

    @JsonProperty("disambiguation_prompt")
    String disambiguationPrompt;

    @JsonProperty("training_utterances")
    List<String> trainingUtterances;

    /** Lowercase, deduplicated, in first-seen order. */
    @JsonProperty("keywords")
    List<String> keywords;

    @JsonProperty("confidence_threshold")
    Double confidenceThreshold;

    public int effectivePriority() {
        return priority != null ? priority : DEFAULT_PRIORITY;
    }

    public double effectiveThreshold(double registryDefault) {
        return confidenceThreshold != null ? confidenceThreshold : registryDefault;
    }

    public boolean hasDisambiguationPrompt() {
        return disambiguationPrompt != null && !disambiguationPrompt.isBlank();
    }

    public IntentRecordInput toInput() {
        return IntentRecordInput.builder()
            .intentId(intentId)
            .intentName(intentName)
            .category(category)
            .agentRouting(agentRouting)
            .priority(priority)
            .descriptionShort(descriptionShort)
            .disambiguationPrompt(disambiguationPrompt)
            .trainingUtterances(trainingUtterances)
            .keywords(keywords)
            .confidenceThreshold(confidenceThreshold)
            .build();
    }
}
