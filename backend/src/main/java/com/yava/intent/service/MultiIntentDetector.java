package com.yava.intent.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Spots utterances that bundle several requests ("refill my prescription and also
 * check my claim") and splits them into separately classifiable segments.
 */
@Component
public class MultiIntentDetector {

    private static final List<Pattern> SIGNALS = List.of(
        Pattern.compile("\\b(?:and also|also|plus|as well as|additionally|another thing|one more thing)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(?:oh and|btw|by the way|while i'm here|while you're at it)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\band\\s+i\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("[.?!]\\s+\\S", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SPLITTERS = List.of(
        Pattern.compile("\\s+and also\\s+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\s+oh and\\s+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\s+also\\s+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\s+and\\s+(?=i\\s)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\s+plus\\s+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\s+as well as\\s+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\s+(?:btw|by the way)\\s+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("[.?!]\\s+"));

    private static final int MIN_SEGMENT_WORDS = 2;

    public boolean hasMultipleIntents(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return false;
        }
        return SIGNALS.stream().anyMatch(p -> p.matcher(utterance).find());
    }

    /**
     * Split on conjunctions and sentence breaks; segments shorter than two words are dropped.
     */
    public List<String> split(String utterance) {
        List<String> segments = new ArrayList<>();
        if (utterance == null || utterance.isBlank()) {
            return segments;
        }
        segments.add(utterance.trim());
        for (Pattern splitter : SPLITTERS) {
            List<String> next = new ArrayList<>();
            for (String segment : segments) {
                for (String part : splitter.split(segment)) {
                    String trimmed = part.trim();
                    if (!trimmed.isEmpty()) {
                        next.add(trimmed);
                    }
                }
            }
            segments = next;
        }
        segments.removeIf(s -> s.split("\\s+").length < MIN_SEGMENT_WORDS);
        return segments;
    }
}
