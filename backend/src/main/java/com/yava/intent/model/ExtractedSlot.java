package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A slot value found in a single utterance.
 */
@Value
public class ExtractedSlot {

    @JsonProperty("value")
    String value;

    @JsonProperty("type")
    String type;

    @JsonProperty("confidence")
    double confidence;
}
