package com.yava.intent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Classification of an utterance that may carry several requests at once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MultiIntentDecision {

    @JsonProperty("multi_intent")
    private boolean multiIntent;

    @JsonProperty("decision")
    private ClassificationDecision decision;

    @JsonProperty("segments")
    private List<Segment> segments;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Segment {
        @JsonProperty("segment")
        private String segment;

        @JsonProperty("decision")
        private ClassificationDecision decision;
    }
}
