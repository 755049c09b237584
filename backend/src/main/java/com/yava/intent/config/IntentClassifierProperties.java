package com.yava.intent.config;

import com.yava.intent.model.FallbackPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the registry and classification engine, bound from {@code intent.*}.
 */
@Data
@ConfigurationProperties(prefix = "intent")
public class IntentClassifierProperties {

    private Classifier classifier = new Classifier();
    private Registry registry = new Registry();
    private Ingestion ingestion = new Ingestion();
    private Validation validation = new Validation();
    private Store store = new Store();
    private Slots slots = new Slots();

    @Data
    public static class Classifier {
        /** Confidence floor an exact or near-exact training utterance hit lifts the score to. */
        private double exactMatchConfidence = 1.0;
        /** Weight of the keyword sub-score. */
        private double keywordWeight = 0.4;
        /** Matched keywords needed for a full keyword sub-score. */
        private int keywordSaturation = 1;
        /** Weight of the best token similarity against a training utterance. */
        private double fuzzyWeight = 0.6;
        private int nearExactMaxEdits = 2;
        /** Lead the top candidate needs over the runner-up for a firm match. */
        private double ambiguityMargin = 0.10;
        /** Candidates below this are never surfaced as a match or for clarification. */
        private double considerationFloor = 0.25;
        private int maxCandidates = 3;
    }

    @Data
    public static class Registry {
        private double defaultConfidenceThreshold = 0.6;
        private String fallbackAgent = "FallbackAgent";
        private String clarificationPrompt =
            "I want to make sure I help you correctly. Could you tell me a bit more about what you need?";
        private String noMatchMessage =
            "Sorry, I didn't catch that. You can ask about pharmacy, claims, benefits, providers and more.";
        private int maxPublishAttempts = 3;

        public FallbackPolicy toFallbackPolicy() {
            return new FallbackPolicy(fallbackAgent, clarificationPrompt, noMatchMessage);
        }
    }

    @Data
    public static class Ingestion {
        private String listDelimiter = "|";
    }

    @Data
    public static class Validation {
        /** Similarity above which two intents without disambiguation prompts are flagged. */
        private double overlapSimilarityFloor = 0.8;
    }

    /**
     * Slot patterns keyed by slot name. Intent-specific slots are keyed by intent name first.
     */
    @Data
    public static class Slots {
        private Map<String, SlotDefinition> common = new LinkedHashMap<>();
        private Map<String, Map<String, SlotDefinition>> intents = new LinkedHashMap<>();
    }

    @Data
    public static class SlotDefinition {
        private String type = "string";
        /** Tried in order; the first capture group of the first hit is the value. */
        private List<String> patterns = new ArrayList<>();
        private double confidence = 0.9;
        private boolean caseSensitive = false;
    }

    @Data
    public static class Store {
        private String path = "./data/intents.json";
        private String seedResource = "/intents.json";
    }
}
