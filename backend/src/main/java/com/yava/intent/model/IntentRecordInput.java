package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * External shape of one intent, as submitted through the API and as persisted
 * in the configuration file. Values are typed but unchecked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentRecordInput {

    @JsonProperty("intent_id")
    private String intentId;

    @JsonProperty("intent_name")
    private String intentName;

    @JsonProperty("category")
    private String category;

    @JsonProperty("agent_routing")
    private String agentRouting;

    @JsonProperty("priority")
    private Integer priority;

    @JsonProperty("description_short")
    private String descriptionShort;

    @JsonProperty("disambiguation_prompt")
    private String disambiguationPrompt;

    @JsonProperty("training_utterances")
    private List<String> trainingUtterances;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("confidence_threshold")
    private Double confidenceThreshold;
}
