package com.yava.intent.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Text normalization and similarity measures shared by the classifier and the
 * validation engine. All methods are pure.
 */
public final class TextMatching {

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "is", "are", "was", "were", "for", "of", "to", "in", "on", "at",
        "and", "or", "with", "my", "me", "you", "your", "this", "that", "can", "does", "did",
        "what", "whats", "how", "where", "when", "who", "why", "which", "have", "has", "our", "its",
        "please", "there", "will", "would", "could", "should", "about", "from", "just", "also", "any");

    private TextMatching() {
    }

    /**
     * Lowercase, trim and collapse whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * Normalized words with punctuation removed, in order.
     */
    public static List<String> words(String text) {
        String cleaned = normalize(text).replaceAll("[^a-z0-9\\s]", "").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(cleaned.split("\\s+"));
    }

    /**
     * Punctuation-free words joined by single spaces, so "refill!!!" compares equal to "refill".
     */
    public static String canonical(String text) {
        return String.join(" ", words(text));
    }

    /**
     * Words longer than two characters that are not stop words.
     */
    public static Set<String> significantTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String word : words(text)) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    /**
     * Dice coefficient over significant tokens, in [0,1].
     */
    public static double tokenSimilarity(String a, String b) {
        return tokenSimilarity(significantTokens(a), significantTokens(b));
    }

    public static double tokenSimilarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int overlap = 0;
        for (String token : a) {
            if (b.contains(token)) {
                overlap++;
            }
        }
        return (2.0 * overlap) / (a.size() + b.size());
    }

    /**
     * True when {@code phrase} occurs in {@code text} on word boundaries.
     */
    public static boolean containsPhrase(String text, String phrase) {
        List<String> phraseWords = words(phrase);
        if (phraseWords.isEmpty()) {
            return false;
        }
        String haystack = " " + String.join(" ", words(text)) + " ";
        return haystack.contains(" " + String.join(" ", phraseWords) + " ");
    }

    /**
     * Equality, or an edit distance of at most {@code maxEdits}. Callers pass
     * {@link #canonical(String)} forms.
     * Short strings only count when equal, otherwise "hi" would near-match "ok".
     */
    public static boolean isNearExact(String normalizedA, String normalizedB, int maxEdits) {
        if (normalizedA.equals(normalizedB)) {
            return !normalizedA.isEmpty();
        }
        if (maxEdits <= 0 || Math.max(normalizedA.length(), normalizedB.length()) <= maxEdits * 4) {
            return false;
        }
        if (Math.abs(normalizedA.length() - normalizedB.length()) > maxEdits) {
            return false;
        }
        return levenshtein(normalizedA, normalizedB) <= maxEdits;
    }

    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Lowercased, trimmed, deduplicated keywords in first-seen order.
     */
    public static List<String> normalizeKeywords(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String keyword : keywords) {
            String normalized = normalize(keyword);
            if (!normalized.isEmpty()) {
                unique.add(normalized);
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }

    public static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
