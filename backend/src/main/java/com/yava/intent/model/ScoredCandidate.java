package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One intent as scored against an utterance, with the named sub-scores that
 * produced its confidence.
 */
@Value
@Builder
public class ScoredCandidate {

    @JsonProperty("intent_id")
    String intentId;

    @JsonProperty("intent_name")
    String intentName;

    @JsonProperty("agent")
    String agent;

    @JsonProperty("priority")
    int priority;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("exact_score")
    double exactScore;

    @JsonProperty("keyword_score")
    double keywordScore;

    @JsonProperty("fuzzy_score")
    double fuzzyScore;

    @JsonProperty("best_match")
    String bestMatch;
}
