package com.yava.intent;

import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.registry.IntentRegistry;
import com.yava.intent.service.SlotExtractor;
import com.yava.intent.validation.IntentRecordValidator;
import com.yava.intent.validation.IntentSetValidator;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: a small healthcare catalogue and wiring helpers.
 */
public final class IntentFixtures {

    private IntentFixtures() {
    }

    public static IntentRecord pharmacy() {
        return IntentRecord.builder()
            .intentId("INT-PHR-0001")
            .intentName("pharmacy")
            .category("healthcare")
            .agentRouting("PharmacyAgent")
            .priority(4)
            .descriptionShort("Prescription or medication refills")
            .disambiguationPrompt("Are you asking about a prescription or about your plan coverage?")
            .trainingUtterances(List.of(
                "I need to refill my prescription",
                "Where is the nearest pharmacy?",
                "I need help with my medication"))
            .keywords(List.of("medication", "prescription"))
            .confidenceThreshold(0.7)
            .build();
    }

    public static IntentRecord benefits() {
        return IntentRecord.builder()
            .intentId("INT-BEN-0014")
            .intentName("benefits")
            .category("benefits")
            .agentRouting("BenefitsAgent")
            .priority(3)
            .descriptionShort("Coverage and benefit information")
            .disambiguationPrompt("Do you want to know what your plan covers?")
            .trainingUtterances(List.of(
                "I need help with my coverage",
                "What does my plan cover",
                "Explain my benefits"))
            .keywords(List.of("coverage", "benefits"))
            .build();
    }

    public static IntentRecord claims() {
        return IntentRecord.builder()
            .intentId("INT-CLM-0035")
            .intentName("claims")
            .category("claims")
            .agentRouting("ClaimsAgent")
            .priority(3)
            .descriptionShort("Claim status or submission")
            .trainingUtterances(List.of(
                "Check my claim status",
                "Submit a new claim",
                "Why was my claim denied",
                "Where is my reimbursement",
                "Track claim payment"))
            .keywords(List.of("claim", "denied", "reimbursement"))
            .build();
    }

    public static IntentRecord.IntentRecordBuilder minimal(String id, String name) {
        return IntentRecord.builder()
            .intentId(id)
            .intentName(name)
            .category("wellness")
            .agentRouting("WellnessAgent")
            .priority(3)
            .descriptionShort("Wellness programs")
            .trainingUtterances(List.of("tell me about " + name))
            .keywords(List.of());
    }

    /**
     * Defaults plus a few slot patterns: a common member id, a pharmacy medication
     * and a claim number.
     */
    public static IntentClassifierProperties properties() {
        IntentClassifierProperties properties = new IntentClassifierProperties();
        IntentClassifierProperties.Slots slots = properties.getSlots();
        slots.getCommon().put("member_id",
            slot("member_id", "\\bmember\\s*id\\s*(?:is\\s+)?([A-Z]{0,4}\\d{6,11})\\b"));
        slots.getIntents().put("pharmacy", new LinkedHashMap<>(Map.of("medication_name",
            slot("medication", "(?:refill|for)\\s+(?:my\\s+)?(?!prescription\\b|medication\\b|meds\\b)([a-z]{4,})"))));
        slots.getIntents().put("claims", new LinkedHashMap<>(Map.of("claim_number",
            slot("claim_id", "claim\\s*(?:#|number)?\\s*[:\\s]?\\s*(\\d{6,15})"))));
        return properties;
    }

    public static IntentClassifierProperties.SlotDefinition slot(String type, String... patterns) {
        IntentClassifierProperties.SlotDefinition definition = new IntentClassifierProperties.SlotDefinition();
        definition.setType(type);
        definition.setPatterns(List.of(patterns));
        return definition;
    }

    public static SlotExtractor slotExtractor(IntentClassifierProperties properties) {
        return new SlotExtractor(properties);
    }

    public static IntentSetValidator setValidator(IntentClassifierProperties properties) {
        return new IntentSetValidator(new IntentRecordValidator(), properties);
    }

    public static IntentRegistry registry(IntentClassifierProperties properties, IntentRecord... records) {
        IntentRegistry registry = new IntentRegistry(setValidator(properties), properties);
        registry.initialize(Arrays.asList(records));
        return registry;
    }

    public static RegistrySnapshot snapshot(long version, IntentRecord... records) {
        IntentClassifierProperties properties = properties();
        return new RegistrySnapshot(version, Arrays.asList(records),
            properties.getRegistry().getDefaultConfidenceThreshold(),
            properties.getRegistry().toFallbackPolicy());
    }
}
