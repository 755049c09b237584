package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one classification call: a firm match, a request for clarification,
 * or no match.
 */
@Value
@Builder
public class ClassificationDecision {

    @JsonProperty("intent_name")
    String intentName;

    @JsonProperty("intent_id")
    String intentId;

    @JsonProperty("agent")
    String agent;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("needs_clarification")
    boolean needsClarification;

    @JsonProperty("disambiguation_prompt")
    String disambiguationPrompt;

    /** Guidance for the caller when nothing matched. */
    @JsonProperty("fallback_message")
    String fallbackMessage;

    @JsonProperty("candidates")
    List<ScoredCandidate> candidates;

    /** Values pulled out of the utterance, keyed by slot name. */
    @JsonProperty("slots")
    Map<String, ExtractedSlot> slots;

    @JsonProperty("registry_version")
    long registryVersion;

    public boolean isMatch() {
        return intentName != null && !needsClarification;
    }
}
