package com.yava.intent.config;

import com.yava.intent.ingestion.IntentRowNormalizer;
import com.yava.intent.model.IntentRecordInput;
import com.yava.intent.model.ValidationIssue;
import com.yava.intent.model.ValidationReport;
import com.yava.intent.registry.IntentRegistry;
import com.yava.intent.store.IntentConfigStore;
import com.yava.intent.store.IntentConfigStoreException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads the intent configuration from the store at startup and publishes it as
 * the first registry version. Without a valid configuration there is nothing to
 * classify against, so failures here stop the application.
 */
@Component
@Slf4j
public class IntentConfigLoader {

    private final IntentConfigStore store;
    private final IntentRowNormalizer normalizer;
    private final IntentRegistry registry;

    public IntentConfigLoader(IntentConfigStore store, IntentRowNormalizer normalizer, IntentRegistry registry) {
        this.store = store;
        this.normalizer = normalizer;
        this.registry = registry;
    }

    @PostConstruct
    public void load() {
        List<IntentRecordInput> intents;
        try {
            intents = store.load();
        } catch (IntentConfigStoreException e) {
            log.error("Intent configuration store is unreachable and no snapshot is available: {}", e.getMessage(), e);
            throw new IllegalStateException("Cannot start without an intent configuration", e);
        }

        ValidationReport report = registry.initialize(normalizer.fromInputs(intents));
        if (!report.isValid()) {
            for (ValidationIssue error : report.getErrors()) {
                log.error("Invalid intent {} field {}: {}", error.getIntentId(), error.getField(), error.getMessage());
            }
            throw new IllegalStateException("Stored intent configuration is invalid (" + report.getErrors().size() + " errors)");
        }
        for (ValidationIssue warning : report.getWarnings()) {
            log.warn("Intent {}: {}", warning.getIntentId(), warning.getMessage());
        }
        log.info("Loaded {} intents, registry version {}", intents.size(), registry.current().getVersion());
    }
}
