package com.yava.intent.service;

import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.ClassificationDecision;
import com.yava.intent.model.ExtractedSlot;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.MultiIntentDecision;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.model.ScoredCandidate;
import com.yava.intent.registry.IntentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-based intent classification over a registry snapshot.
 *
 * <p>Each intent gets three sub-scores against the normalized utterance:
 * <ul>
 *   <li>exact: 1 when a training utterance matches exactly or within a few edits,
 *       ignoring punctuation</li>
 *   <li>keyword: matched keywords, saturating at {@code keyword-saturation} hits</li>
 *   <li>fuzzy: best token similarity against any training utterance</li>
 * </ul>
 * Keyword and fuzzy are combined by the configured weights; an exact hit lifts the
 * result to {@code exact-match-confidence}. The score is clipped to [0,1]. Intents are ranked by
 * confidence, then priority (higher first), then intent_id. The result depends only
 * on the utterance and the snapshot.
 */
@Service
@Slf4j
public class IntentClassificationService {

    private static final double EPSILON = 1e-9;
    private static final int MAX_PROMPT_OPTIONS = 3;

    private static final Comparator<ScoredCandidate> RANKING = Comparator
        .comparingDouble(ScoredCandidate::getConfidence).reversed()
        .thenComparing(Comparator.comparingInt(ScoredCandidate::getPriority).reversed())
        .thenComparing(ScoredCandidate::getIntentId);

    private final IntentRegistry registry;
    private final MultiIntentDetector multiIntentDetector;
    private final SlotExtractor slotExtractor;
    private final IntentClassifierProperties properties;

    public IntentClassificationService(IntentRegistry registry,
                                       MultiIntentDetector multiIntentDetector,
                                       SlotExtractor slotExtractor,
                                       IntentClassifierProperties properties) {
        this.registry = registry;
        this.multiIntentDetector = multiIntentDetector;
        this.slotExtractor = slotExtractor;
        this.properties = properties;
    }

    /**
     * Classify against the active snapshot.
     */
    public ClassificationDecision classify(String utterance) {
        return classify(utterance, registry.current());
    }

    public ClassificationDecision classify(String utterance, RegistrySnapshot snapshot) {
        String normalized = TextMatching.normalize(utterance);
        if (normalized.isEmpty()) {
            log.debug("Blank utterance, returning no match");
            return noMatch(snapshot, 0.0, List.of(), Map.of());
        }

        List<ScoredCandidate> ranked = rank(normalized, snapshot);
        IntentClassifierProperties.Classifier settings = properties.getClassifier();

        ScoredCandidate top = ranked.get(0);
        double runnerUp = ranked.size() > 1 ? ranked.get(1).getConfidence() : 0.0;
        IntentRecord topRecord = snapshot.find(top.getIntentId()).orElseThrow();
        double threshold = topRecord.effectiveThreshold(snapshot.getDefaultConfidenceThreshold());
        boolean clearLead = top.getConfidence() - runnerUp + EPSILON >= settings.getAmbiguityMargin();

        ClassificationDecision decision;
        if (top.getConfidence() + EPSILON >= threshold && clearLead) {
            decision = ClassificationDecision.builder()
                .intentName(top.getIntentName())
                .intentId(top.getIntentId())
                .agent(top.getAgent())
                .confidence(top.getConfidence())
                .needsClarification(false)
                .candidates(explain(ranked, 0))
                .slots(slotExtractor.extract(utterance, top.getIntentName()))
                .registryVersion(snapshot.getVersion())
                .build();
        } else if (top.getConfidence() < settings.getConsiderationFloor()) {
            decision = noMatch(snapshot, top.getConfidence(), explain(ranked, 0),
                slotExtractor.extract(utterance, null));
        } else {
            List<ScoredCandidate> contenders = ranked.stream()
                .filter(c -> c.getConfidence() >= settings.getConsiderationFloor())
                .filter(c -> top.getConfidence() - c.getConfidence() <= settings.getAmbiguityMargin() + EPSILON)
                .collect(Collectors.toList());
            String prompt = topRecord.hasDisambiguationPrompt()
                ? topRecord.getDisambiguationPrompt()
                : clarificationPrompt(contenders, snapshot);
            decision = ClassificationDecision.builder()
                .confidence(top.getConfidence())
                .needsClarification(true)
                .disambiguationPrompt(prompt)
                .candidates(explain(ranked, contenders.size()))
                .slots(slotExtractor.extract(utterance, null))
                .registryVersion(snapshot.getVersion())
                .build();
        }

        log.info("Classified '{}' against version {}: intent={}, confidence={}, clarification={}",
                utterance, snapshot.getVersion(), decision.getIntentName(),
                decision.getConfidence(), decision.isNeedsClarification());
        return decision;
    }

    /**
     * Classify the whole utterance and, when it looks like several requests, each
     * segment on its own. All parts are scored against the same snapshot.
     * {@code multi_intent} is set when at least two segments match different intents.
     */
    public MultiIntentDecision classifyMulti(String utterance) {
        RegistrySnapshot snapshot = registry.current();
        ClassificationDecision whole = classify(utterance, snapshot);

        List<MultiIntentDecision.Segment> segments = new ArrayList<>();
        if (multiIntentDetector.hasMultipleIntents(utterance)) {
            List<String> parts = multiIntentDetector.split(utterance);
            if (parts.size() > 1) {
                for (String part : parts) {
                    segments.add(new MultiIntentDecision.Segment(part, classify(part, snapshot)));
                }
            }
        }

        long distinctIntents = segments.stream()
            .map(MultiIntentDecision.Segment::getDecision)
            .filter(ClassificationDecision::isMatch)
            .map(ClassificationDecision::getIntentId)
            .distinct()
            .count();
        return new MultiIntentDecision(distinctIntents > 1, whole, segments);
    }

    /**
     * Score and rank every intent of the snapshot for an already normalized utterance.
     */
    public List<ScoredCandidate> rank(String normalizedUtterance, RegistrySnapshot snapshot) {
        String canonical = TextMatching.canonical(normalizedUtterance);
        Set<String> tokens = TextMatching.significantTokens(normalizedUtterance);
        List<ScoredCandidate> scored = new ArrayList<>(snapshot.size());
        for (IntentRecord record : snapshot.getRecords()) {
            scored.add(score(normalizedUtterance, canonical, tokens, record));
        }
        scored.sort(RANKING);
        return scored;
    }

    private ScoredCandidate score(String normalized, String canonical, Set<String> tokens, IntentRecord record) {
        IntentClassifierProperties.Classifier settings = properties.getClassifier();

        double exact = 0.0;
        double fuzzy = 0.0;
        String bestMatch = null;
        for (String example : record.getTrainingUtterances()) {
            if (exact == 0.0 && TextMatching.isNearExact(canonical, TextMatching.canonical(example),
                    settings.getNearExactMaxEdits())) {
                exact = 1.0;
                bestMatch = example;
            }
            double similarity = TextMatching.tokenSimilarity(tokens, TextMatching.significantTokens(example));
            if (similarity > fuzzy) {
                fuzzy = similarity;
                if (exact == 0.0) {
                    bestMatch = example;
                }
            }
        }

        double keyword = 0.0;
        List<String> keywords = record.getKeywords();
        if (keywords != null && !keywords.isEmpty()) {
            long matched = keywords.stream().filter(k -> TextMatching.containsPhrase(normalized, k)).count();
            int saturation = Math.max(1, Math.min(settings.getKeywordSaturation(), keywords.size()));
            keyword = Math.min(1.0, (double) matched / saturation);
        }

        double combined = settings.getKeywordWeight() * keyword + settings.getFuzzyWeight() * fuzzy;
        if (exact > 0.0) {
            combined = Math.max(combined, settings.getExactMatchConfidence());
        }
        double confidence = TextMatching.round(Math.max(0.0, Math.min(1.0, combined)));

        log.debug("Scored {} ({}): exact={}, keyword={}, fuzzy={} -> {}",
                record.getIntentId(), record.getIntentName(), exact, keyword, fuzzy, confidence);

        return ScoredCandidate.builder()
            .intentId(record.getIntentId())
            .intentName(record.getIntentName())
            .agent(record.getAgentRouting())
            .priority(record.effectivePriority())
            .confidence(confidence)
            .exactScore(exact)
            .keywordScore(TextMatching.round(keyword))
            .fuzzyScore(TextMatching.round(fuzzy))
            .bestMatch(bestMatch)
            .build();
    }

    /**
     * "Are you asking about X or Y?" built from the contenders' short descriptions.
     * Falls back to the registry prompt when no contender has one.
     */
    private String clarificationPrompt(List<ScoredCandidate> contenders, RegistrySnapshot snapshot) {
        List<String> options = contenders.stream()
            .limit(MAX_PROMPT_OPTIONS)
            .map(c -> snapshot.find(c.getIntentId()).map(IntentRecord::getDescriptionShort).orElse(null))
            .filter(d -> d != null && !d.isBlank())
            .map(IntentClassificationService::asOption)
            .distinct()
            .collect(Collectors.toList());
        if (options.isEmpty()) {
            return snapshot.getFallbackPolicy().getClarificationPrompt();
        }
        if (options.size() == 1) {
            return "Just to confirm, are you asking about " + options.get(0) + "?";
        }
        String last = options.get(options.size() - 1);
        String head = String.join(", ", options.subList(0, options.size() - 1));
        String separator = options.size() == 2 ? " or " : ", or ";
        return "I want to make sure I help you correctly. Are you asking about " + head + separator + last + "?";
    }

    /**
     * Lowercase the leading letter unless the description starts with an acronym.
     */
    private static String asOption(String description) {
        String trimmed = description.trim();
        if (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.length() > 1 && Character.isUpperCase(trimmed.charAt(1))) {
            return trimmed;
        }
        return Character.toLowerCase(trimmed.charAt(0)) + trimmed.substring(1);
    }

    /**
     * Top candidates with a non-zero score, at least {@code minimum} of them.
     */
    private List<ScoredCandidate> explain(List<ScoredCandidate> ranked, int minimum) {
        int limit = Math.max(properties.getClassifier().getMaxCandidates(), minimum);
        return ranked.stream()
            .filter(c -> c.getConfidence() > 0.0)
            .limit(limit)
            .collect(Collectors.toUnmodifiableList());
    }

    private ClassificationDecision noMatch(RegistrySnapshot snapshot, double confidence,
                                           List<ScoredCandidate> candidates, Map<String, ExtractedSlot> slots) {
        return ClassificationDecision.builder()
            .slots(slots)
            .confidence(confidence)
            .needsClarification(false)
            .fallbackMessage(snapshot.getFallbackPolicy().getNoMatchMessage())
            .candidates(candidates)
            .registryVersion(snapshot.getVersion())
            .build();
    }
}
